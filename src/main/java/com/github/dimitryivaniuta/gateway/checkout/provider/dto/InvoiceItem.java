package com.github.dimitryivaniuta.gateway.checkout.provider.dto;

import java.math.BigDecimal;

/**
 * Invoice line item.
 *
 * @param name item name
 * @param price unit price
 * @param quantity quantity
 */
public record InvoiceItem(String name, BigDecimal price, int quantity) {}
