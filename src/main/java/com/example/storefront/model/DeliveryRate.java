package com.example.storefront.model;

/**
 * One row of a delivery-charge table: the charge for delivering to a location or zone.
 */
public record DeliveryRate(String location, double charge) {
}
