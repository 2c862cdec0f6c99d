package com.github.dimitryivaniuta.gateway.checkout.repo;

import com.github.dimitryivaniuta.gateway.checkout.domain.SalesOrder;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * JPA repository for {@link SalesOrder}.
 */
public interface SalesOrderRepository extends JpaRepository<SalesOrder, String> {
}
