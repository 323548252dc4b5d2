package com.github.yoep.debrid.adapter;

import lombok.Getter;

import java.text.MessageFormat;

/**
 * Exception indicating that the credential has been rejected by the provider.
 */
@Getter
public class InvalidCredentialException extends DebridException {
    private final String providerKey;

    public InvalidCredentialException(String providerKey) {
        super(MessageFormat.format("Credential has been rejected by provider \"{0}\"", providerKey));
        this.providerKey = providerKey;
    }
}
