package com.github.dimitryivaniuta.gateway.checkout.repo;

import com.github.dimitryivaniuta.gateway.checkout.domain.PaymentRequest;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * JPA repository for {@link PaymentRequest}.
 */
public interface PaymentRequestRepository extends JpaRepository<PaymentRequest, String> {
}
