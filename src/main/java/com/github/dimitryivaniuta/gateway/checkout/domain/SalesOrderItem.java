package com.github.dimitryivaniuta.gateway.checkout.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Line of a {@link SalesOrder}.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SalesOrderItem {

    @Column(name = "item_code", nullable = false, length = 140)
    private String itemCode;

    @Column(name = "rate", nullable = false, precision = 19, scale = 2)
    private BigDecimal rate;

    @Column(name = "qty", nullable = false)
    private int qty;
}
