package com.github.yoep.debrid.core.providers;

import com.github.yoep.debrid.adapter.DebridException;
import lombok.Getter;

@Getter
public class ProviderNotFoundException extends DebridException {
    private final String key;

    public ProviderNotFoundException(String key) {
        super("Provider '" + key + "' couldn't be found");
        this.key = key;
    }
}
