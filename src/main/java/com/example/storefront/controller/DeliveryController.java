package com.example.storefront.controller;

import com.example.storefront.model.DeliveryChargeView;
import com.example.storefront.model.DeliveryRate;
import com.example.storefront.service.DeliveryChargeService;
import com.fasterxml.jackson.databind.node.NullNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Validated
public class DeliveryController {

    private final DeliveryChargeService deliveryChargeService;

    /**
     * The newest delivery-charge table, or a JSON {@code null} before any has been set.
     */
    @GetMapping("/delivery")
    public ResponseEntity<Object> currentDeliveryCharge() {
        return deliveryChargeService.currentDeliveryCharge()
            .<ResponseEntity<Object>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(NullNode.getInstance()));
    }

    @PostMapping("/admin/delivery")
    public ResponseEntity<DeliveryChargeView> setDeliveryCharge(@Valid @RequestBody SetDeliveryChargeRequest request) {
        List<DeliveryRate> rates = request.rates() == null
            ? List.of()
            : request.rates().stream()
                .map(rate -> new DeliveryRate(rate.location(), rate.charge()))
                .toList();
        DeliveryChargeView created = deliveryChargeService.setDeliveryCharge(request.name(), request.notes(), rates);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    public record SetDeliveryChargeRequest(
        String name,
        String notes,
        List<@Valid @NotNull DeliveryRateRequest> rates
    ) {
    }

    public record DeliveryRateRequest(
        @NotBlank String location,
        @NotNull @PositiveOrZero Double charge
    ) {
    }
}
