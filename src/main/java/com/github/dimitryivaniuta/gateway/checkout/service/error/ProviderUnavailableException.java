package com.github.dimitryivaniuta.gateway.checkout.service.error;

import com.github.dimitryivaniuta.gateway.checkout.provider.ProviderException;
import org.springframework.http.HttpStatus;

/**
 * The provider could not create the invoice. Nothing was persisted locally.
 */
public class ProviderUnavailableException extends CheckoutException {

    private final ProviderException.Kind kind;

    public ProviderUnavailableException(String gatewayName, ProviderException cause) {
        super(HttpStatus.BAD_GATEWAY, "PROVIDER_UNAVAILABLE",
                "Failed to create " + gatewayName + " invoice, please check your settings", cause);
        this.kind = cause.getKind();
    }

    public ProviderException.Kind getKind() {
        return kind;
    }
}
