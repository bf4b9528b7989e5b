package com.hhplus.storefront.domain.catalog;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Product 카탈로그 엔티티
 *
 * 책임:
 * - 상품의 현재 판매 가격과 판매 여부(active) 보관
 *
 * 핵심 비즈니스 규칙:
 * - 가격은 최소 통화 단위(원)의 정수
 * - 체크아웃 엔진은 이 엔티티를 읽기만 한다 (상품 CRUD는 범위 밖)
 */
@Entity
@Table(name = "products")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "product_id")
    private Long productId;

    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(name = "price", nullable = false)
    private Long price;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 상품 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 상품명은 필수
     * - 가격은 0 이상
     */
    public static Product create(String productName, Long price, LocalDateTime now) {
        if (productName == null || productName.isBlank()) {
            throw new IllegalArgumentException("상품명은 필수입니다");
        }
        if (price == null || price < 0) {
            throw new IllegalArgumentException("가격은 0 이상이어야 합니다");
        }

        return Product.builder()
                .productName(productName)
                .price(price)
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void changePrice(Long newPrice, LocalDateTime now) {
        if (newPrice == null || newPrice < 0) {
            throw new IllegalArgumentException("가격은 0 이상이어야 합니다");
        }
        this.price = newPrice;
        this.updatedAt = now;
    }

    public void deactivate(LocalDateTime now) {
        this.active = false;
        this.updatedAt = now;
    }
}
