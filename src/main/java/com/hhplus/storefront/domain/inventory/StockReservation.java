package com.hhplus.storefront.domain.inventory;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * StockReservation 도메인 엔티티
 *
 * 책임:
 * - 진행 중인 체크아웃과 점유 재고를 연결
 * - 만료 시각(expiresAt)을 가져 버려진 체크아웃의 재고 누수를 막음
 *
 * 비즈니스 규칙:
 * - HELD 에서만 다른 상태로 전이 가능
 * - attemptNumber로 같은 체크아웃의 재시도 회차를 구분
 */
@Entity
@Table(name = "stock_reservations", indexes = {
        @Index(name = "idx_reservation_checkout", columnList = "checkout_id"),
        @Index(name = "idx_reservation_status_expires", columnList = "status, expires_at")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockReservation {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "reservation_id")
    private Long reservationId;

    @Column(name = "checkout_id", nullable = false, length = 64)
    private String checkoutId;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReservationStatus status;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static StockReservation hold(String checkoutId, int attemptNumber, Long productId, int quantity,
                                        LocalDateTime expiresAt, LocalDateTime now) {
        return StockReservation.builder()
                .checkoutId(checkoutId)
                .attemptNumber(attemptNumber)
                .productId(productId)
                .quantity(quantity)
                .status(ReservationStatus.HELD)
                .expiresAt(expiresAt)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public boolean isHeld() {
        return status == ReservationStatus.HELD;
    }

    public boolean isExpiredAt(LocalDateTime now) {
        return isHeld() && expiresAt.isBefore(now);
    }

    public void markCommitted(LocalDateTime now) {
        transition(ReservationStatus.COMMITTED, now);
    }

    public void markReleased(LocalDateTime now) {
        transition(ReservationStatus.RELEASED, now);
    }

    public void markExpired(LocalDateTime now) {
        transition(ReservationStatus.EXPIRED, now);
    }

    /**
     * 만료/해제된 예약을 판매 가능 재고에서 직접 재획득하여 확정한 경우
     */
    public void markReacquiredAndCommitted(LocalDateTime now) {
        this.status = ReservationStatus.COMMITTED;
        this.updatedAt = now;
    }

    private void transition(ReservationStatus target, LocalDateTime now) {
        if (!isHeld()) {
            throw new IllegalStateException(String.format(
                    "HELD 상태가 아닌 예약은 %s로 변경할 수 없습니다 (reservationId=%d, status=%s)",
                    target, reservationId, status));
        }
        this.status = target;
        this.updatedAt = now;
    }
}
