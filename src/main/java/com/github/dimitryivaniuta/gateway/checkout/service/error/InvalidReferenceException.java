package com.github.dimitryivaniuta.gateway.checkout.service.error;

import org.springframework.http.HttpStatus;

/**
 * The reference record does not exist or does not resolve to the expected document chain.
 */
public class InvalidReferenceException extends CheckoutException {

    public InvalidReferenceException(String detail) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_REFERENCE", detail, null);
    }
}
