package com.hhplus.storefront.domain.cart;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 장바구니 라인 (값 객체)
 *
 * - 담을 당시의 단가 스냅샷(unitPrice)을 보관
 * - 불변: 수량 변경은 새 인스턴스로 교체
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class CartLine {

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    @Column(name = "unit_price", nullable = false)
    private long unitPrice;

    public CartLine withQuantity(int newQuantity) {
        return new CartLine(productId, newQuantity, unitPrice);
    }

    public long lineTotal() {
        return unitPrice * quantity;
    }
}
