package com.example.storefront.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LoginResult(
    String token,
    @JsonProperty("expires_at") String expiresAt
) {
}
