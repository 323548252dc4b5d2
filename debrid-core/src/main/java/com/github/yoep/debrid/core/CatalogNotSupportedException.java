package com.github.yoep.debrid.core;

import com.github.yoep.debrid.adapter.DebridException;
import lombok.Getter;

import java.text.MessageFormat;

/**
 * Exception indicating that the provider doesn't offer a catalog.
 */
@Getter
public class CatalogNotSupportedException extends DebridException {
    private final String providerKey;

    public CatalogNotSupportedException(String providerKey) {
        super(MessageFormat.format("Provider \"{0}\" doesn't support a catalog", providerKey));
        this.providerKey = providerKey;
    }
}
