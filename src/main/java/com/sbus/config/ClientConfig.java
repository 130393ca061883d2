package com.sbus.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Client configuration.
 * Supports configuration from a classpath properties file, environment variables and programmatic settings.
 */
public class ClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ClientConfig.class);

    public static final String DEFAULT_RESOURCE = "sbus-client.properties";

    // Namespace
    private String endpoint = "sb://localhost/";

    // Receiver defaults
    private int maxConcurrentCalls = 1;
    private boolean autoComplete = false;
    private Duration maxAutoRenewDuration = Duration.ofSeconds(300);
    private Duration maxSessionAutoRenewDuration = Duration.ofSeconds(300);

    // Batch receive
    private Duration batchMaxWaitTime = Duration.ofSeconds(60);
    private Duration batchIdleTimeout = Duration.ofSeconds(1);

    // Recovery
    private int reconnectAttempts = 150;
    private Duration reconnectDelay = Duration.ofSeconds(15);
    private int operationRetryAttempts = 3;
    private Duration operationRetryDelay = Duration.ofSeconds(5);

    // Security
    private Duration tokenRenewalMargin = Duration.ofMinutes(5);

    // Locks obtained over the management channel
    private Duration lockStoreSweepInterval = Duration.ofMinutes(5);

    public ClientConfig() {
        // Load from environment variables if available
        loadFromEnvironment(System.getenv());
    }

    /**
     * Defaults, overridden by {@value #DEFAULT_RESOURCE} on the classpath, overridden by the environment.
     */
    public static ClientConfig load() {
        ClientConfig config = new ClientConfig();
        try (InputStream in = ClientConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                Properties properties = new Properties();
                properties.load(in);
                config.loadFromProperties(properties);
                log.debug("Loaded client configuration from {}", DEFAULT_RESOURCE);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + DEFAULT_RESOURCE, e);
        }
        config.loadFromEnvironment(System.getenv());
        return config;
    }

    /**
     * Load configuration from environment variables.
     */
    void loadFromEnvironment(Map<String, String> env) {
        if (env.containsKey("SBUS_ENDPOINT")) {
            endpoint = env.get("SBUS_ENDPOINT");
        }
        if (env.containsKey("SBUS_MAX_CONCURRENT_CALLS")) {
            maxConcurrentCalls = Integer.parseInt(env.get("SBUS_MAX_CONCURRENT_CALLS"));
        }
        if (env.containsKey("SBUS_MAX_AUTO_RENEW_SECONDS")) {
            maxAutoRenewDuration = Duration.ofSeconds(Long.parseLong(env.get("SBUS_MAX_AUTO_RENEW_SECONDS")));
        }
        if (env.containsKey("SBUS_RECONNECT_ATTEMPTS")) {
            reconnectAttempts = Integer.parseInt(env.get("SBUS_RECONNECT_ATTEMPTS"));
        }
        if (env.containsKey("SBUS_RECONNECT_DELAY_SECONDS")) {
            reconnectDelay = Duration.ofSeconds(Long.parseLong(env.get("SBUS_RECONNECT_DELAY_SECONDS")));
        }
    }

    /**
     * Load configuration from Properties object.
     */
    public void loadFromProperties(Properties properties) {
        if (properties.containsKey("endpoint")) {
            endpoint = properties.getProperty("endpoint");
        }
        if (properties.containsKey("receiver.maxConcurrentCalls")) {
            maxConcurrentCalls = Integer.parseInt(properties.getProperty("receiver.maxConcurrentCalls"));
        }
        if (properties.containsKey("receiver.autoComplete")) {
            autoComplete = Boolean.parseBoolean(properties.getProperty("receiver.autoComplete"));
        }
        if (properties.containsKey("receiver.maxAutoRenewSeconds")) {
            maxAutoRenewDuration = seconds(properties, "receiver.maxAutoRenewSeconds");
        }
        if (properties.containsKey("session.maxAutoRenewSeconds")) {
            maxSessionAutoRenewDuration = seconds(properties, "session.maxAutoRenewSeconds");
        }
        if (properties.containsKey("batch.maxWaitSeconds")) {
            batchMaxWaitTime = seconds(properties, "batch.maxWaitSeconds");
        }
        if (properties.containsKey("batch.idleTimeoutMillis")) {
            batchIdleTimeout = Duration.ofMillis(Long.parseLong(properties.getProperty("batch.idleTimeoutMillis")));
        }
        if (properties.containsKey("reconnect.attempts")) {
            reconnectAttempts = Integer.parseInt(properties.getProperty("reconnect.attempts"));
        }
        if (properties.containsKey("reconnect.delaySeconds")) {
            reconnectDelay = seconds(properties, "reconnect.delaySeconds");
        }
        if (properties.containsKey("retry.attempts")) {
            operationRetryAttempts = Integer.parseInt(properties.getProperty("retry.attempts"));
        }
        if (properties.containsKey("retry.delaySeconds")) {
            operationRetryDelay = seconds(properties, "retry.delaySeconds");
        }
        if (properties.containsKey("token.renewalMarginSeconds")) {
            tokenRenewalMargin = seconds(properties, "token.renewalMarginSeconds");
        }
        if (properties.containsKey("lockStore.sweepIntervalSeconds")) {
            lockStoreSweepInterval = seconds(properties, "lockStore.sweepIntervalSeconds");
        }
    }

    private static Duration seconds(Properties properties, String key) {
        return Duration.ofSeconds(Long.parseLong(properties.getProperty(key)));
    }

    /**
     * Export configuration as a map.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("endpoint", endpoint);
        map.put("maxConcurrentCalls", maxConcurrentCalls);
        map.put("autoComplete", autoComplete);
        map.put("maxAutoRenewSeconds", maxAutoRenewDuration.getSeconds());
        map.put("maxSessionAutoRenewSeconds", maxSessionAutoRenewDuration.getSeconds());
        map.put("batchMaxWaitSeconds", batchMaxWaitTime.getSeconds());
        map.put("batchIdleTimeoutMillis", batchIdleTimeout.toMillis());
        map.put("reconnectAttempts", reconnectAttempts);
        map.put("reconnectDelaySeconds", reconnectDelay.getSeconds());
        map.put("retryAttempts", operationRetryAttempts);
        map.put("retryDelaySeconds", operationRetryDelay.getSeconds());
        map.put("tokenRenewalMarginSeconds", tokenRenewalMargin.getSeconds());
        map.put("lockStoreSweepIntervalSeconds", lockStoreSweepInterval.getSeconds());
        return map;
    }

    // Getters and setters
    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    public void setMaxConcurrentCalls(int maxConcurrentCalls) {
        this.maxConcurrentCalls = maxConcurrentCalls;
    }

    public boolean isAutoComplete() {
        return autoComplete;
    }

    public void setAutoComplete(boolean autoComplete) {
        this.autoComplete = autoComplete;
    }

    public Duration getMaxAutoRenewDuration() {
        return maxAutoRenewDuration;
    }

    public void setMaxAutoRenewDuration(Duration maxAutoRenewDuration) {
        this.maxAutoRenewDuration = maxAutoRenewDuration;
    }

    public Duration getMaxSessionAutoRenewDuration() {
        return maxSessionAutoRenewDuration;
    }

    public void setMaxSessionAutoRenewDuration(Duration maxSessionAutoRenewDuration) {
        this.maxSessionAutoRenewDuration = maxSessionAutoRenewDuration;
    }

    public Duration getBatchMaxWaitTime() {
        return batchMaxWaitTime;
    }

    public void setBatchMaxWaitTime(Duration batchMaxWaitTime) {
        this.batchMaxWaitTime = batchMaxWaitTime;
    }

    public Duration getBatchIdleTimeout() {
        return batchIdleTimeout;
    }

    public void setBatchIdleTimeout(Duration batchIdleTimeout) {
        this.batchIdleTimeout = batchIdleTimeout;
    }

    public int getReconnectAttempts() {
        return reconnectAttempts;
    }

    public void setReconnectAttempts(int reconnectAttempts) {
        this.reconnectAttempts = reconnectAttempts;
    }

    public Duration getReconnectDelay() {
        return reconnectDelay;
    }

    public void setReconnectDelay(Duration reconnectDelay) {
        this.reconnectDelay = reconnectDelay;
    }

    public int getOperationRetryAttempts() {
        return operationRetryAttempts;
    }

    public void setOperationRetryAttempts(int operationRetryAttempts) {
        this.operationRetryAttempts = operationRetryAttempts;
    }

    public Duration getOperationRetryDelay() {
        return operationRetryDelay;
    }

    public void setOperationRetryDelay(Duration operationRetryDelay) {
        this.operationRetryDelay = operationRetryDelay;
    }

    public Duration getTokenRenewalMargin() {
        return tokenRenewalMargin;
    }

    public void setTokenRenewalMargin(Duration tokenRenewalMargin) {
        this.tokenRenewalMargin = tokenRenewalMargin;
    }

    public Duration getLockStoreSweepInterval() {
        return lockStoreSweepInterval;
    }

    public void setLockStoreSweepInterval(Duration lockStoreSweepInterval) {
        this.lockStoreSweepInterval = lockStoreSweepInterval;
    }
}
