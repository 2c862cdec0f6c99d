package com.github.dimitryivaniuta.gateway.checkout.service.error;

import org.springframework.http.HttpStatus;

/**
 * The reference record has already been paid through a completed checkout.
 */
public class AlreadySettledException extends CheckoutException {

    public AlreadySettledException(String referenceType, String referenceId) {
        super(HttpStatus.CONFLICT, "ALREADY_SETTLED",
                referenceType + " '" + referenceId + "' has already been paid", null);
    }
}
