package com.hhplus.storefront.domain.order;

import java.util.List;
import java.util.Optional;

/**
 * Order Repository Interface (Domain Layer - Port)
 * append-only: 수정/삭제 메서드를 제공하지 않는다.
 */
public interface OrderRepository {

    Order append(Order order);

    Optional<Order> findById(Long orderId);

    Optional<Order> findByCheckoutId(String checkoutId);

    Optional<Order> findByIdempotencyKey(String idempotencyKey);

    boolean existsByCheckoutIdOrIdempotencyKey(String checkoutId, String idempotencyKey);

    /**
     * 소유자의 주문 목록 (최신순)
     */
    List<Order> findByOwnerId(String ownerId);
}
