package com.hhplus.storefront.infrastructure.persistence.order;

import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Order Repository 구현
 * Order 엔티티는 @Immutable 이므로 저장 이후 변경은 반영되지 않는다.
 */
@Repository
@Primary
public class MySQLOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
    }

    @Override
    public Order append(Order order) {
        return orderJpaRepository.saveAndFlush(order);
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return orderJpaRepository.findById(orderId);
    }

    @Override
    public Optional<Order> findByCheckoutId(String checkoutId) {
        return orderJpaRepository.findByCheckoutId(checkoutId);
    }

    @Override
    public Optional<Order> findByIdempotencyKey(String idempotencyKey) {
        return orderJpaRepository.findByIdempotencyKey(idempotencyKey);
    }

    @Override
    public boolean existsByCheckoutIdOrIdempotencyKey(String checkoutId, String idempotencyKey) {
        return orderJpaRepository.existsByCheckoutIdOrIdempotencyKey(checkoutId, idempotencyKey);
    }

    @Override
    public List<Order> findByOwnerId(String ownerId) {
        return orderJpaRepository.findByOwnerIdOrderByCreatedAtDescOrderIdDesc(ownerId);
    }
}
