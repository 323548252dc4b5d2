package com.github.yoep.debrid.adapter;

/**
 * Exception indicating that an error occurred while invoking a debrid provider.
 */
public class DebridException extends RuntimeException {
    public DebridException(String message) {
        super(message);
    }

    public DebridException(String message, Throwable cause) {
        super(message, cause);
    }
}
