package com.github.dimitryivaniuta.gateway.checkout.repo;

import com.github.dimitryivaniuta.gateway.checkout.domain.Customer;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * JPA repository for {@link Customer}.
 */
public interface CustomerRepository extends JpaRepository<Customer, String> {
}
