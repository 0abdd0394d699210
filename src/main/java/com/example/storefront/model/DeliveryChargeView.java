package com.example.storefront.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

@Builder
public record DeliveryChargeView(
    String id,
    String name,
    String notes,
    List<DeliveryRate> rates,
    @JsonProperty("created_at") String createdAt
) {
}
