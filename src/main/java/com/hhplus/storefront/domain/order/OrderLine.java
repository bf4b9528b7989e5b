package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.domain.cart.CartLine;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 라인 - 체크아웃 스냅샷 라인의 복사본
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class OrderLine {

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    @Column(name = "unit_price", nullable = false)
    private long unitPrice;

    @Column(name = "line_total", nullable = false)
    private long lineTotal;

    public static OrderLine from(CartLine line) {
        return new OrderLine(line.getProductId(), line.getQuantity(), line.getUnitPrice(), line.lineTotal());
    }
}
