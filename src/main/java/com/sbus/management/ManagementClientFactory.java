package com.sbus.management;

/**
 * Creates the management client of an entity path.
 */
public interface ManagementClientFactory {

    ManagementClient create(String entityPath, String address, String audience);
}
