package com.github.yoep.debrid.core.resolve;

import com.github.yoep.debrid.adapter.DebridException;

/**
 * Exception indicating that a resolve failed unexpectedly at the provider.
 */
public class ResolveException extends DebridException {
    public ResolveException(String message, Throwable cause) {
        super(message, cause);
    }
}
