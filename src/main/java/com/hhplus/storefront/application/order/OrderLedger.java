package com.hhplus.storefront.application.order;

import com.hhplus.storefront.application.alert.AlertService;
import com.hhplus.storefront.domain.order.DuplicateOrderException;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderNotFoundException;
import com.hhplus.storefront.domain.order.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * OrderLedger - 주문 원장 (append-only)
 *
 * 역할:
 * - 커밋된 체크아웃의 주문을 한 번만 기록
 * - 소유자 기준 주문 조회
 *
 * 비즈니스 규칙:
 * - 체크아웃 ID/멱등성 키당 주문은 최대 1건
 * - 위반 시 DuplicateOrderException 과 정합성 알림
 * - 다른 소유자의 주문은 존재하지 않는 것처럼 응답 (404)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderLedger {

    private final OrderRepository orderRepository;
    private final AlertService alertService;

    /**
     * 주문 기록 (호출자 트랜잭션에 참여)
     *
     * @throws DuplicateOrderException 같은 체크아웃/멱등성 키의 주문이 이미 있음
     */
    @Transactional
    public Order append(Order order) {
        if (orderRepository.existsByCheckoutIdOrIdempotencyKey(order.getCheckoutId(), order.getIdempotencyKey())) {
            alertService.notifyDuplicateOrder(order.getCheckoutId(), order.getIdempotencyKey());
            throw new DuplicateOrderException(order.getCheckoutId(), order.getIdempotencyKey());
        }
        try {
            Order saved = orderRepository.append(order);
            log.info("[OrderLedger] 주문 기록 - orderId={}, orderNumber={}, checkoutId={}, total={}",
                    saved.getOrderId(), saved.getOrderNumber(), saved.getCheckoutId(), saved.getTotalAmount());
            return saved;
        } catch (DataIntegrityViolationException e) {
            alertService.notifyDuplicateOrder(order.getCheckoutId(), order.getIdempotencyKey());
            throw new DuplicateOrderException(order.getCheckoutId(), order.getIdempotencyKey(), e);
        }
    }

    @Transactional(readOnly = true)
    public Order get(Long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    @Transactional(readOnly = true)
    public Order getForOwner(String ownerId, Long orderId) {
        return orderRepository.findById(orderId)
                .filter(order -> order.isOwnedBy(ownerId))
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    /**
     * 소유자의 주문 목록 (최신순)
     */
    @Transactional(readOnly = true)
    public List<Order> listForOwner(String ownerId) {
        return orderRepository.findByOwnerId(ownerId);
    }

    @Transactional(readOnly = true)
    public Optional<Order> findByIdempotencyKey(String idempotencyKey) {
        return orderRepository.findByIdempotencyKey(idempotencyKey);
    }

    @Transactional(readOnly = true)
    public Optional<Order> findByCheckoutId(String checkoutId) {
        return orderRepository.findByCheckoutId(checkoutId);
    }
}
