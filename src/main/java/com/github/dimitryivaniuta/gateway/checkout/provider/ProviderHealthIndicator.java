package com.github.dimitryivaniuta.gateway.checkout.provider;

import com.github.dimitryivaniuta.gateway.checkout.config.AppProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Credential probe for the invoice provider, exposed as the {@code provider} health component.
 *
 * <p>Lists a single invoice: cheap, read-only, and fails with 401 when the API key is wrong.</p>
 */
@Component("provider")
public class ProviderHealthIndicator implements HealthIndicator {

    private final InvoiceProvider invoiceProvider;
    private final AppProperties properties;

    public ProviderHealthIndicator(InvoiceProvider invoiceProvider, AppProperties properties) {
        this.invoiceProvider = invoiceProvider;
        this.properties = properties;
    }

    @Override
    public Health health() {
        String gateway = properties.getCheckout().getGatewayName();
        try {
            invoiceProvider.listInvoices(1);
            return Health.up().withDetail("gateway", gateway).build();
        } catch (ProviderException e) {
            return Health.down()
                    .withDetail("gateway", gateway)
                    .withDetail("kind", e.getKind().name())
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
