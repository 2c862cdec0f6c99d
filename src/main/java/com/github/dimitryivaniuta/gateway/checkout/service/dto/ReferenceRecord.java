package com.github.dimitryivaniuta.gateway.checkout.service.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * Resolved reference record: what the checkout is paying for.
 *
 * @param referenceType reference type
 * @param referenceId reference id
 * @param items line items shown on the hosted invoice
 * @param customerMobile customer mobile number, null when the customer has none
 * @param amountOwed amount the reference record expects
 * @param currency currency of the reference record
 */
public record ReferenceRecord(
        String referenceType,
        String referenceId,
        List<ReferenceLineItem> items,
        String customerMobile,
        BigDecimal amountOwed,
        String currency
) {}
