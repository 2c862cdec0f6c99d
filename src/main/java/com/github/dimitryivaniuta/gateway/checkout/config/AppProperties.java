package com.github.dimitryivaniuta.gateway.checkout.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level configuration properties.
 *
 * <p>Everything the checkout flow needs (gateway name, currency allow-list, fee parameters, provider endpoint)
 * is bound here once and injected, instead of living in process-wide constants.</p>
 */
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private final Checkout checkout = new Checkout();
    private final Provider provider = new Provider();
    private final Outbox outbox = new Outbox();

    @Getter
    @Setter
    public static class Checkout {
        /**
         * Display name of the payment gateway.
         */
        private String gatewayName = "Xendit";

        /**
         * Currencies accepted for checkout. Anything else is rejected before the provider is called.
         */
        private List<String> supportedCurrencies = new ArrayList<>(List.of("IDR"));

        /**
         * Absolute base URL of the storefront; redirects and the confirmation URL are resolved against it.
         */
        private String siteBaseUrl = "http://localhost:8080";

        /**
         * Path of the confirmation endpoint the provider sends the payer back to.
         */
        private String confirmPath = "/api/checkout/confirm_payment";

        /**
         * Default landing page after a confirmed payment.
         */
        private String successPath = "payment-success";

        /**
         * Default landing page when the payment is not (yet) confirmed.
         */
        private String failurePath = "payment-failed";

        /**
         * When true, a confirmation that finds the invoice unpaid moves the token to FAILED.
         * When false, only statuses listed in {@code app.provider.failed-statuses} do.
         */
        private boolean failUnpaidOnConfirm = false;

        /**
         * Lifetime of the hosted invoice.
         */
        private Duration invoiceDuration = Duration.ofSeconds(600);

        /**
         * Whether the provider should e-mail the invoice to the payer.
         */
        private boolean sendEmail = true;

        private final Fee fee = new Fee();
    }

    @Getter
    @Setter
    public static class Fee {
        /**
         * Flat fee in minor units.
         */
        private long baseFee = 2000L;

        /**
         * Percentage surcharge applied to the amount (2.9 means 2.9%).
         */
        private BigDecimal percentage = new BigDecimal("2.9");

        /**
         * The percentage part is truncated down to a multiple of this step.
         */
        private long roundingStep = 1000L;

        /**
         * Fee line type sent to the provider.
         */
        private String type = "GATEWAY";
    }

    @Getter
    @Setter
    public static class Provider {
        /**
         * Base URL of the provider REST API.
         */
        private String baseUrl = "https://api.xendit.co";

        /**
         * Secret API key. Supplied by the environment, never logged.
         */
        private String apiKey;

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(15);

        /**
         * Provider invoice statuses that mean the payer has paid.
         */
        private List<String> completedStatuses = new ArrayList<>(List.of("PAID", "SETTLED"));

        /**
         * Provider invoice statuses that mean the invoice can no longer be paid.
         */
        private List<String> failedStatuses = new ArrayList<>(List.of("EXPIRED"));
    }

    @Getter
    @Setter
    public static class Outbox {
        /**
         * Runs the scheduled Kafka publisher. Events are recorded either way.
         */
        private boolean publisherEnabled = false;

        /**
         * Kafka topic name for checkout events.
         */
        private String checkoutEventsTopic = "checkout-events";

        /**
         * Max number of events per batch.
         */
        private int batchSize = 100;

        /**
         * Fixed delay between publisher runs in milliseconds.
         */
        private long publishIntervalMs = 1000L;

        /**
         * Kafka send acknowledgment timeout.
         */
        private Duration sendTimeout = Duration.ofSeconds(5);

        /**
         * Max number of send attempts before moving to DEAD.
         */
        private int maxAttempts = 10;

        /**
         * Base backoff used for retries (exponential).
         */
        private Duration baseBackoff = Duration.ofSeconds(1);

        /**
         * Maximum backoff cap.
         */
        private Duration maxBackoff = Duration.ofMinutes(2);
    }
}
