package com.github.dimitryivaniuta.gateway.checkout.service;

import com.github.dimitryivaniuta.gateway.checkout.config.AppProperties;
import com.github.dimitryivaniuta.gateway.checkout.service.error.UnsupportedCurrencyException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Gateway fee charged to the payer on top of the requested amount.
 *
 * <p>{@code fee = baseFee + floor(amount * percentage / 100 / step) * step}, i.e. the percentage part is
 * truncated to the next lower multiple of {@code step}. With the defaults (2000, 2.9%, 1000) an amount of
 * 100000 yields 2000 + 2000 = 4000.</p>
 */
@Component
public class FeeCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final AppProperties properties;

    public FeeCalculator(AppProperties properties) {
        this.properties = properties;
    }

    /**
     * Computes the fee for an amount.
     *
     * @param amount amount in major units, not negative
     * @param currency ISO currency
     * @return fee in minor units
     * @throws UnsupportedCurrencyException if the currency is not on the allow-list
     */
    public long computeFee(BigDecimal amount, String currency) {
        requireSupportedCurrency(currency);
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }

        AppProperties.Fee fee = properties.getCheckout().getFee();
        BigDecimal step = BigDecimal.valueOf(fee.getRoundingStep());
        BigDecimal surcharge = amount.multiply(fee.getPercentage()).divide(HUNDRED);
        long truncated = surcharge.divide(step, 0, RoundingMode.FLOOR).longValueExact() * fee.getRoundingStep();
        return fee.getBaseFee() + truncated;
    }

    /**
     * Rejects currencies outside the configured allow-list.
     *
     * @param currency ISO currency
     * @return normalized (upper-case) currency
     * @throws UnsupportedCurrencyException if the currency is not allowed
     */
    public String requireSupportedCurrency(String currency) {
        String normalized = currency == null ? "" : currency.trim().toUpperCase(Locale.ROOT);
        boolean supported = properties.getCheckout().getSupportedCurrencies().stream()
                .anyMatch(c -> c.equalsIgnoreCase(normalized));
        if (!supported) {
            throw new UnsupportedCurrencyException(properties.getCheckout().getGatewayName(), currency);
        }
        return normalized;
    }
}
