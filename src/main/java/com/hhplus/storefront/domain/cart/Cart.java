package com.hhplus.storefront.domain.cart;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cart 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 소유자(사용자 ID 또는 비회원 세션 ID)별 장바구니 라인 관리
 * - 낙관적 동시성 제어용 version 관리
 *
 * 핵심 비즈니스 규칙:
 * - 한 장바구니 안에서 productId는 중복되지 않음
 * - 모든 변경은 version을 1 증가시킴
 * - 호출자가 기대한 version과 현재 version이 다르면 변경 없이 충돌 예외
 * - 수량은 1 이상 maxQuantity 이하
 */
@Entity
@Table(name = "carts", uniqueConstraints = {
    @UniqueConstraint(name = "uk_carts_owner", columnNames = "owner_id")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Cart {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_id")
    private Long cartId;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "cart_items", joinColumns = @JoinColumn(name = "cart_id"))
    @OrderColumn(name = "line_order")
    @Builder.Default
    private List<CartLine> lines = new ArrayList<>();

    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Cart create(String ownerId, LocalDateTime now) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("장바구니 소유자 ID는 필수입니다");
        }
        return Cart.builder()
                .ownerId(ownerId)
                .version(0L)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 기대 버전 검증 (null이면 검증 생략)
     *
     * @throws CartVersionConflictException 버전 불일치
     */
    public void verifyVersion(Long expectedVersion) {
        if (expectedVersion != null && expectedVersion != version) {
            throw new CartVersionConflictException(ownerId, expectedVersion, version);
        }
    }

    /**
     * 상품 추가
     *
     * - 같은 상품이 있으면 수량 누적 (replaceQuantity=true면 덮어쓰기)
     * - 단가는 현재 카탈로그 가격으로 갱신
     */
    public void addItem(Long productId, int quantity, long unitPrice, boolean replaceQuantity,
                        int maxQuantity, LocalDateTime now) {
        validateQuantity(quantity, maxQuantity);

        int index = indexOf(productId);
        if (index < 0) {
            lines.add(new CartLine(productId, quantity, unitPrice));
        } else {
            int merged = replaceQuantity ? quantity : lines.get(index).getQuantity() + quantity;
            validateQuantity(merged, maxQuantity);
            lines.set(index, new CartLine(productId, merged, unitPrice));
        }
        touch(now);
    }

    public void updateQuantity(Long productId, int quantity, int maxQuantity, LocalDateTime now) {
        validateQuantity(quantity, maxQuantity);
        int index = requireIndex(productId);
        lines.set(index, lines.get(index).withQuantity(quantity));
        touch(now);
    }

    public void removeItem(Long productId, LocalDateTime now) {
        lines.remove(requireIndex(productId));
        touch(now);
    }

    public void clear(LocalDateTime now) {
        lines.clear();
        touch(now);
    }

    /**
     * 구매 완료된 수량만큼 차감
     * 체크아웃 중 사용자가 장바구니를 수정했다면 그 수정분은 남긴다.
     */
    public void deductPurchased(List<CartLine> purchased, LocalDateTime now) {
        for (CartLine bought : purchased) {
            int index = indexOf(bought.getProductId());
            if (index < 0) {
                continue;
            }
            int remaining = lines.get(index).getQuantity() - bought.getQuantity();
            if (remaining > 0) {
                lines.set(index, lines.get(index).withQuantity(remaining));
            } else {
                lines.remove(index);
            }
        }
        touch(now);
    }

    /**
     * 다른 장바구니(비회원 세션)의 라인을 합친다. 합친 수량은 maxQuantity로 제한.
     */
    public void mergeFrom(Cart other, int maxQuantity, LocalDateTime now) {
        for (CartLine line : other.getLines()) {
            int index = indexOf(line.getProductId());
            if (index < 0) {
                lines.add(line.withQuantity(Math.min(line.getQuantity(), maxQuantity)));
            } else {
                int merged = Math.min(lines.get(index).getQuantity() + line.getQuantity(), maxQuantity);
                lines.set(index, lines.get(index).withQuantity(merged));
            }
        }
        touch(now);
    }

    public Optional<CartLine> findLine(Long productId) {
        int index = indexOf(productId);
        return index < 0 ? Optional.empty() : Optional.of(lines.get(index));
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public long totalAmount() {
        return lines.stream().mapToLong(CartLine::lineTotal).sum();
    }

    public int totalQuantity() {
        return lines.stream().mapToInt(CartLine::getQuantity).sum();
    }

    public CartSnapshot snapshot() {
        return new CartSnapshot(ownerId, version, lines);
    }

    private void validateQuantity(int quantity, int maxQuantity) {
        if (quantity < CartConstants.MIN_CART_QUANTITY || quantity > maxQuantity) {
            throw new InvalidQuantityException(quantity, maxQuantity);
        }
    }

    private int indexOf(Long productId) {
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).getProductId().equals(productId)) {
                return i;
            }
        }
        return -1;
    }

    private int requireIndex(Long productId) {
        int index = indexOf(productId);
        if (index < 0) {
            throw new CartItemNotFoundException(ownerId, productId);
        }
        return index;
    }

    private void touch(LocalDateTime now) {
        this.version += 1;
        this.updatedAt = now;
    }
}
