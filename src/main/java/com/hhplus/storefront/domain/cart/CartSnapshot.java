package com.hhplus.storefront.domain.cart;

import lombok.Getter;

import java.util.List;

/**
 * 체크아웃 시작 시점의 장바구니 불변 복사본
 * 이후 사용자의 장바구니 수정은 진행 중인 체크아웃에 영향을 주지 않는다.
 */
@Getter
public class CartSnapshot {

    private final String ownerId;
    private final long version;
    private final List<CartLine> lines;

    public CartSnapshot(String ownerId, long version, List<CartLine> lines) {
        this.ownerId = ownerId;
        this.version = version;
        this.lines = List.copyOf(lines);
    }

    public static CartSnapshot empty(String ownerId) {
        return new CartSnapshot(ownerId, 0L, List.of());
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public long totalAmount() {
        return lines.stream().mapToLong(CartLine::lineTotal).sum();
    }
}
