package com.github.yoep.debrid.core.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

@Data
@Validated
@ConfigurationProperties("debrid")
public class DebridProperties {
    /**
     * The product name which is shown in the label of error streams.
     */
    @NotBlank
    private String productName = "Torrentio";

    /**
     * The minimum length of a provider credential.
     * Shorter credentials are rejected without contacting the provider.
     */
    @Min(1)
    private int minCredentialLength = 15;

    /**
     * The resolve properties.
     */
    @Valid
    @NotNull
    private ResolveProperties resolve = new ResolveProperties();
}
