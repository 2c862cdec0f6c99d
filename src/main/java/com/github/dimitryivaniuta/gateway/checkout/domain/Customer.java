package com.github.dimitryivaniuta.gateway.checkout.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Customer master data, read-only from the checkout's point of view.
 */
@Entity
@Table(name = "customers")
@Getter
@Setter
@NoArgsConstructor
public class Customer {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 140)
    private String id;

    @Column(name = "customer_name", nullable = false, length = 255)
    private String customerName;

    @Column(name = "email", nullable = true, length = 255)
    private String email;

    @Column(name = "mobile_no", nullable = true, length = 32)
    private String mobileNo;
}
