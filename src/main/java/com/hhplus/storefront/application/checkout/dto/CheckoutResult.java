package com.hhplus.storefront.application.checkout.dto;

import com.hhplus.storefront.domain.order.Order;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 체크아웃 결과
 * replayed=true 이면 같은 멱등성 키로 이미 만들어진 주문을 돌려준 것
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CheckoutResult {

    private final String checkoutId;
    private final Order order;
    private final boolean replayed;

    public static CheckoutResult created(String checkoutId, Order order) {
        return new CheckoutResult(checkoutId, order, false);
    }

    public static CheckoutResult replayed(String checkoutId, Order order) {
        return new CheckoutResult(checkoutId, order, true);
    }
}
