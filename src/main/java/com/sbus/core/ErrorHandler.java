package com.sbus.core;

/**
 * Application callback for errors that happen outside any call the application made.
 */
@FunctionalInterface
public interface ErrorHandler {

    void onError(Throwable error);
}
