package com.github.dimitryivaniuta.gateway.checkout.service.error;

import org.springframework.http.HttpStatus;

/**
 * No checkout was ever issued for the token.
 */
public class UnknownTokenException extends CheckoutException {

    public UnknownTokenException(String token) {
        super(HttpStatus.NOT_FOUND, "UNKNOWN_TOKEN", "No checkout found for token '" + token + "'", null);
    }
}
