package com.hhplus.storefront.domain.inventory;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * ProductStock 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 상품별 판매 가능 수량(available)과 예약 수량(reserved) 관리
 * - 예약/해제/확정 시 두 카운터 사이의 수량 이동
 *
 * 핵심 비즈니스 규칙:
 * - available >= 0, reserved >= 0 (어떤 연산도 음수를 만들지 않음)
 * - 예약: available → reserved
 * - 해제: reserved → available
 * - 확정: reserved 감소 (재고 영구 소진)
 * - 동시성 제어는 행 단위 비관적 락(SELECT ... FOR UPDATE)에 맡긴다
 */
@Entity
@Table(name = "product_stocks")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductStock {
    @Id
    @Column(name = "product_id")
    private Long productId;

    @Column(name = "available_quantity", nullable = false)
    private int availableQuantity;

    @Column(name = "reserved_quantity", nullable = false)
    private int reservedQuantity;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static ProductStock create(Long productId, int initialQuantity, LocalDateTime now) {
        if (initialQuantity < 0) {
            throw new IllegalArgumentException("초기 재고는 0 이상이어야 합니다");
        }
        return ProductStock.builder()
                .productId(productId)
                .availableQuantity(initialQuantity)
                .reservedQuantity(0)
                .updatedAt(now)
                .build();
    }

    /**
     * 예약: 판매 가능 수량에서 예약 수량으로 이동
     *
     * @throws InsufficientStockException 판매 가능 수량 부족
     */
    public void reserve(int quantity, LocalDateTime now) {
        requirePositive(quantity);
        if (availableQuantity < quantity) {
            throw new InsufficientStockException(productId, quantity, availableQuantity);
        }
        this.availableQuantity -= quantity;
        this.reservedQuantity += quantity;
        this.updatedAt = now;
    }

    /**
     * 해제: 예약 수량을 판매 가능 수량으로 되돌림
     */
    public void release(int quantity, LocalDateTime now) {
        requirePositive(quantity);
        requireReserved(quantity);
        this.reservedQuantity -= quantity;
        this.availableQuantity += quantity;
        this.updatedAt = now;
    }

    /**
     * 확정: 예약 수량을 영구 소진
     */
    public void commitReserved(int quantity, LocalDateTime now) {
        requirePositive(quantity);
        requireReserved(quantity);
        this.reservedQuantity -= quantity;
        this.updatedAt = now;
    }

    /**
     * 예약 없이 판매 가능 수량에서 직접 소진
     * 결제 승인 후 예약이 만료된 경우의 재획득에 사용
     *
     * @throws InsufficientStockException 판매 가능 수량 부족
     */
    public void consumeAvailable(int quantity, LocalDateTime now) {
        requirePositive(quantity);
        if (availableQuantity < quantity) {
            throw new InsufficientStockException(productId, quantity, availableQuantity);
        }
        this.availableQuantity -= quantity;
        this.updatedAt = now;
    }

    public void restock(int quantity, LocalDateTime now) {
        requirePositive(quantity);
        this.availableQuantity += quantity;
        this.updatedAt = now;
    }

    private void requirePositive(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("수량은 0보다 커야 합니다: " + quantity);
        }
    }

    private void requireReserved(int quantity) {
        if (reservedQuantity < quantity) {
            throw new IllegalStateException(String.format(
                    "예약 수량보다 많이 해제/확정할 수 없습니다 (productId=%d, 요청=%d, 예약=%d)",
                    productId, quantity, reservedQuantity));
        }
    }
}
