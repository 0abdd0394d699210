package com.example.storefront.service;

import com.example.storefront.model.DeliveryChargeView;
import com.example.storefront.model.DeliveryRate;
import com.example.storefront.persistence.document.DeliveryChargeDocument;
import com.example.storefront.persistence.repository.DeliveryChargeRepository;
import com.example.storefront.util.IdCodec;
import com.example.storefront.util.Timestamps;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Delivery-charge tables are append-only: every change inserts a new table and the newest one is current.
 */
@Service
@RequiredArgsConstructor
public class DeliveryChargeService {

    private static final Logger log = LoggerFactory.getLogger(DeliveryChargeService.class);
    static final String DEFAULT_NAME = "Standard Delivery";

    private final DeliveryChargeRepository deliveryChargeRepository;
    private final Clock clock;

    public Optional<DeliveryChargeView> currentDeliveryCharge() {
        return deliveryChargeRepository.findFirstByOrderByCreatedAtDescIdDesc()
            .map(this::toView);
    }

    public DeliveryChargeView setDeliveryCharge(String name, String notes, List<DeliveryRate> rates) {
        List<DeliveryChargeDocument.Rate> storedRates = new ArrayList<>();
        if (rates != null) {
            rates.forEach(rate -> storedRates.add(DeliveryChargeDocument.Rate.builder()
                .location(rate.location())
                .charge(rate.charge())
                .build()));
        }

        DeliveryChargeDocument document = DeliveryChargeDocument.builder()
            .name(StringUtils.hasText(name) ? name : DEFAULT_NAME)
            .notes(notes)
            .rates(storedRates)
            .createdAt(Timestamps.now(clock))
            .build();

        DeliveryChargeDocument saved = deliveryChargeRepository.insert(document);
        log.info("Stored delivery charge table {} with {} rates", saved.getId(), storedRates.size());
        return toView(saved);
    }

    public DeliveryChargeView toView(DeliveryChargeDocument document) {
        List<DeliveryRate> rates = Optional.ofNullable(document.getRates()).orElse(List.of()).stream()
            .map(rate -> new DeliveryRate(rate.getLocation(), rate.getCharge()))
            .toList();
        return DeliveryChargeView.builder()
            .id(IdCodec.encode(document.getId()))
            .name(document.getName())
            .notes(document.getNotes())
            .rates(rates)
            .createdAt(Timestamps.format(document.getCreatedAt()))
            .build();
    }
}
