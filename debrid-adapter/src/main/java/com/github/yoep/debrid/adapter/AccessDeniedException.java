package com.github.yoep.debrid.adapter;

import lombok.Getter;

import java.text.MessageFormat;

/**
 * Exception indicating that the credential is valid, but the subscription of the user doesn't grant access (anymore).
 */
@Getter
public class AccessDeniedException extends DebridException {
    private final String providerKey;

    public AccessDeniedException(String providerKey) {
        super(MessageFormat.format("Access has been denied by provider \"{0}\"", providerKey));
        this.providerKey = providerKey;
    }
}
