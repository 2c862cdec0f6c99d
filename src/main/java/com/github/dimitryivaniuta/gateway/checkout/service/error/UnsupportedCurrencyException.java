package com.github.dimitryivaniuta.gateway.checkout.service.error;

import org.springframework.http.HttpStatus;

/**
 * The requested currency is not on the gateway's allow-list. Raised before any provider call.
 */
public class UnsupportedCurrencyException extends CheckoutException {

    public UnsupportedCurrencyException(String gatewayName, String currency) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "UNSUPPORTED_CURRENCY",
                "Please select another payment method. " + gatewayName
                        + " does not support transactions in currency '" + currency + "'",
                null);
    }
}
