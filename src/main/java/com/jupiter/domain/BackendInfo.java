package com.jupiter.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Description of a query backend for operator tooling.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BackendInfo {

    @JsonProperty("available")
    private final boolean available;

    @JsonProperty("provider_type")
    private final String providerType;

    @JsonProperty("description")
    private final String description;

    public BackendInfo(boolean available, String providerType, String description) {
        this.available = available;
        this.providerType = providerType;
        this.description = description;
    }

    public static BackendInfo unavailable() {
        return new BackendInfo(false, null, null);
    }

    public boolean isAvailable() {
        return available;
    }

    public String getProviderType() {
        return providerType;
    }

    public String getDescription() {
        return description;
    }
}
