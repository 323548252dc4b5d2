package com.github.yoep.debrid.core;

import com.github.yoep.debrid.adapter.DebridException;

/**
 * Exception indicating that a resolve request is missing required parameters.
 */
public class InvalidResolveRequestException extends DebridException {
    public InvalidResolveRequestException(String message) {
        super(message);
    }
}
