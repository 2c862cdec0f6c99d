package com.github.dimitryivaniuta.gateway.checkout.service;

import com.github.dimitryivaniuta.gateway.checkout.config.AppProperties;
import com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutStatus;
import org.springframework.stereotype.Component;

/**
 * Maps provider invoice statuses onto {@link CheckoutStatus}.
 *
 * <p>Only statuses explicitly configured as paid map to COMPLETED. Unknown or missing statuses are PENDING:
 * no proof of payment means not paid.</p>
 */
@Component
public class InvoiceStatusMapper {

    private final AppProperties.Provider provider;

    public InvoiceStatusMapper(AppProperties properties) {
        this.provider = properties.getProvider();
    }

    public CheckoutStatus map(String providerStatus) {
        if (providerStatus == null || providerStatus.isBlank()) {
            return CheckoutStatus.PENDING;
        }
        String status = providerStatus.trim();
        if (provider.getCompletedStatuses().stream().anyMatch(status::equalsIgnoreCase)) {
            return CheckoutStatus.COMPLETED;
        }
        if (provider.getFailedStatuses().stream().anyMatch(status::equalsIgnoreCase)) {
            return CheckoutStatus.FAILED;
        }
        return CheckoutStatus.PENDING;
    }
}
