package com.github.dimitryivaniuta.gateway.checkout.service;

import com.github.dimitryivaniuta.gateway.checkout.domain.CheckoutStatus;
import com.github.dimitryivaniuta.gateway.checkout.service.dto.PaymentAuthorizationResult;

/**
 * Owner of reference records, told once when a checkout for one of its records is paid.
 *
 * <p>Called inside the settlement transaction; throwing rolls the settlement back and leaves the checkout PENDING.</p>
 */
public interface PaymentAuthorizationHandler {

    /**
     * Payment-authorized notification.
     *
     * @param referenceType reference type
     * @param referenceId reference id
     * @param status always {@link CheckoutStatus#COMPLETED}
     * @return redirect hints, never null
     */
    PaymentAuthorizationResult onPaymentAuthorized(String referenceType, String referenceId, CheckoutStatus status);
}
