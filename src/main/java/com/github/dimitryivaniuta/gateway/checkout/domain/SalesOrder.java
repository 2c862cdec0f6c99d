package com.github.dimitryivaniuta.gateway.checkout.domain;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Sales order a payment request settles against.
 */
@Entity
@Table(name = "sales_orders")
@Getter
@Setter
@NoArgsConstructor
public class SalesOrder {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 140)
    private String id;

    @Column(name = "customer_id", nullable = false, length = 140)
    private String customerId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "sales_order_items", joinColumns = @JoinColumn(name = "sales_order_id"))
    @OrderColumn(name = "idx")
    private List<SalesOrderItem> items = new ArrayList<>();
}
