package com.github.dimitryivaniuta.gateway.checkout.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Payment request raised against a {@link SalesOrder}; this is the reference record a checkout pays.
 */
@Entity
@Table(name = "payment_requests")
@Getter
@Setter
@NoArgsConstructor
public class PaymentRequest {

    /** Reference type name used by checkout requests. */
    public static final String REFERENCE_TYPE = "PaymentRequest";

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 140)
    private String id;

    @Column(name = "sales_order_id", nullable = false, length = 140)
    private String salesOrderId;

    @Column(name = "grand_total", nullable = false, precision = 19, scale = 2)
    private BigDecimal grandTotal;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PaymentRequestStatus status;

    /**
     * Optional document-specific page the payer lands on after paying.
     */
    @Column(name = "success_redirect", nullable = true, length = 1024)
    private String successRedirect;

    @Column(name = "paid_at", nullable = true)
    private Instant paidAt;

    /**
     * Marks the request as paid.
     *
     * @return false if it already was
     */
    public boolean markPaid() {
        if (status == PaymentRequestStatus.PAID) {
            return false;
        }
        this.status = PaymentRequestStatus.PAID;
        this.paidAt = Instant.now();
        return true;
    }
}
