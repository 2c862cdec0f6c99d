package com.github.dimitryivaniuta.gateway.checkout.service.dto;

import java.math.BigDecimal;

/**
 * Line item of the business object being paid for.
 *
 * @param name item name
 * @param price unit price
 * @param quantity quantity
 */
public record ReferenceLineItem(String name, BigDecimal price, int quantity) {}
