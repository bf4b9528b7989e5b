package com.hhplus.storefront.infrastructure.persistence.order;

import com.hhplus.storefront.domain.order.Order;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * Order JPA Repository
 */
public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    Optional<Order> findByCheckoutId(String checkoutId);

    Optional<Order> findByIdempotencyKey(String idempotencyKey);

    boolean existsByCheckoutIdOrIdempotencyKey(String checkoutId, String idempotencyKey);

    List<Order> findByOwnerIdOrderByCreatedAtDescOrderIdDesc(String ownerId);
}
