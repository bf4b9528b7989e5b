package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.domain.checkout.CheckoutAttempt;
import com.hhplus.storefront.domain.payment.PaymentOutcome;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Order 도메인 엔티티 (불변)
 *
 * 책임:
 * - 커밋된 체크아웃의 결과(라인 복사본, 합계, 결제 결과) 보관
 *
 * 핵심 비즈니스 규칙:
 * - 한 번 기록되면 변경되지 않는다 (append-only)
 * - checkoutId, idempotencyKey 당 최대 1건 (유니크 제약)
 * - 주문 번호 형식: ORD-{yyyyMMdd}-{8자리 16진수}
 */
@Entity
@Immutable
@Table(name = "orders", uniqueConstraints = {
    @UniqueConstraint(name = "uk_orders_number", columnNames = "order_number"),
    @UniqueConstraint(name = "uk_orders_checkout", columnNames = "checkout_id"),
    @UniqueConstraint(name = "uk_orders_idempotency_key", columnNames = "idempotency_key")
}, indexes = {
    @Index(name = "idx_orders_owner_created", columnList = "owner_id, created_at")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    private static final DateTimeFormatter ORDER_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "order_number", nullable = false, length = 30)
    private String orderNumber;

    @Column(name = "checkout_id", nullable = false, length = 64)
    private String checkoutId;

    @Column(name = "idempotency_key", nullable = false, length = 200)
    private String idempotencyKey;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_lines", joinColumns = @JoinColumn(name = "order_id"))
    @OrderColumn(name = "line_order")
    @Builder.Default
    private List<OrderLine> lines = new ArrayList<>();

    @Column(name = "total_amount", nullable = false)
    private long totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_outcome", nullable = false, length = 20)
    private PaymentOutcome paymentOutcome;

    @Column(name = "payment_reference", length = 100)
    private String paymentReference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 결제 승인된 체크아웃으로부터 주문 생성
     */
    public static Order fromCheckout(CheckoutAttempt attempt, LocalDateTime now) {
        if (!attempt.isAwaitingCommit()) {
            throw new IllegalStateException("결제 승인된 체크아웃만 주문이 될 수 있습니다: " + attempt.getCheckoutId());
        }
        List<OrderLine> lines = attempt.getLines().stream()
                .map(OrderLine::from)
                .collect(Collectors.toList());

        return Order.builder()
                .orderNumber(generateOrderNumber(now))
                .checkoutId(attempt.getCheckoutId())
                .idempotencyKey(attempt.getIdempotencyKey())
                .ownerId(attempt.getOwnerId())
                .lines(lines)
                .totalAmount(attempt.getTotalAmount())
                .paymentOutcome(attempt.getPaymentOutcome())
                .paymentReference(attempt.getPaymentReference())
                .createdAt(now)
                .build();
    }

    static String generateOrderNumber(LocalDateTime now) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase();
        return "ORD-" + now.format(ORDER_DATE) + "-" + suffix;
    }

    public boolean isOwnedBy(String candidateOwnerId) {
        return ownerId.equals(candidateOwnerId);
    }
}
