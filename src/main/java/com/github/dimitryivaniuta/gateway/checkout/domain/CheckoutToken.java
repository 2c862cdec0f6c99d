package com.github.dimitryivaniuta.gateway.checkout.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Correlates a reference record (the business object being paid for) with a provider-side invoice.
 *
 * <p>The token is the reference record's own id, so there is at most one checkout per reference record.
 * Requesting a new checkout while the token is still PENDING supersedes it via {@link #supersede}.
 * Status transitions out of PENDING happen only through the conditional updates in
 * {@code CheckoutTokenRepository}; rows are never deleted and double as an audit trail.</p>
 */
@Entity
@Table(
        name = "checkout_tokens",
        indexes = @Index(name = "idx_checkout_tokens_reference", columnList = "reference_type,reference_id")
)
@Getter
@Setter
@NoArgsConstructor
public class CheckoutToken {

    @Id
    @Column(name = "token", nullable = false, updatable = false, length = 140)
    private String token;

    @Column(name = "provider_invoice_id", nullable = false, length = 64)
    private String providerInvoiceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private CheckoutStatus status;

    @Column(name = "raw_output", nullable = false, columnDefinition = "text")
    private String rawOutput;

    @Column(name = "reference_type", nullable = false, updatable = false, length = 64)
    private String referenceType;

    @Column(name = "reference_id", nullable = false, updatable = false, length = 140)
    private String referenceId;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "invoice_url", nullable = false, length = 1024)
    private String invoiceUrl;

    @Column(name = "redirect_target", nullable = true, length = 1024)
    private String redirectTarget;

    @Column(name = "redirect_to", nullable = true, length = 1024)
    private String redirectTo;

    @Column(name = "redirect_message", nullable = true, length = 512)
    private String redirectMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at", nullable = true)
    private Instant completedAt;

    /**
     * Creates a new PENDING token.
     *
     * @param referenceType reference record type
     * @param referenceId reference record id (also used as the token)
     * @param providerInvoiceId invoice id returned by the provider
     * @param invoiceUrl hosted checkout URL
     * @param amount amount requested
     * @param currency ISO currency
     * @param rawOutput raw provider response
     * @return token
     */
    public static CheckoutToken pending(
            String referenceType,
            String referenceId,
            String providerInvoiceId,
            String invoiceUrl,
            BigDecimal amount,
            String currency,
            String rawOutput
    ) {
        Objects.requireNonNull(referenceType, "referenceType");
        Objects.requireNonNull(referenceId, "referenceId");
        Objects.requireNonNull(providerInvoiceId, "providerInvoiceId");

        CheckoutToken t = new CheckoutToken();
        t.token = referenceId;
        t.referenceType = referenceType;
        t.referenceId = referenceId;
        t.providerInvoiceId = providerInvoiceId;
        t.invoiceUrl = invoiceUrl;
        t.amount = amount;
        t.currency = currency;
        t.rawOutput = rawOutput;
        t.status = CheckoutStatus.PENDING;
        t.createdAt = Instant.now();
        t.updatedAt = t.createdAt;
        return t;
    }

    /**
     * Replaces the invoice behind a not-yet-completed token with a freshly created one.
     *
     * @param replacement token built from the new provider invoice
     */
    public void supersede(CheckoutToken replacement) {
        if (status == CheckoutStatus.COMPLETED) {
            throw new IllegalStateException("Completed checkout " + token + " cannot be superseded");
        }
        this.providerInvoiceId = replacement.providerInvoiceId;
        this.invoiceUrl = replacement.invoiceUrl;
        this.amount = replacement.amount;
        this.currency = replacement.currency;
        this.rawOutput = replacement.rawOutput;
        this.redirectTarget = null;
        this.redirectTo = replacement.redirectTo;
        this.redirectMessage = replacement.redirectMessage;
        this.status = CheckoutStatus.PENDING;
        this.updatedAt = Instant.now();
    }

    /**
     * Stores the redirect hints supplied with the checkout request.
     *
     * @param redirectTo page to continue to after the payment page
     * @param redirectMessage message shown on the landing page
     */
    public void withRedirectHints(String redirectTo, String redirectMessage) {
        this.redirectTo = redirectTo;
        this.redirectMessage = redirectMessage;
    }

    public boolean isCompleted() {
        return status == CheckoutStatus.COMPLETED;
    }
}
