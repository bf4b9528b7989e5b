package com.hhplus.storefront.domain.checkout;

/**
 * 체크아웃 시도 상태
 *
 * INITIATED → VALIDATED → RESERVED → PAYMENT_PENDING → COMMITTED
 * 커밋 이전의 모든 상태에서 REJECTED 로 전이 가능
 */
public enum CheckoutState {
    INITIATED,
    VALIDATED,
    RESERVED,
    PAYMENT_PENDING,
    COMMITTED,
    REJECTED;

    public boolean isTerminal() {
        return this == COMMITTED || this == REJECTED;
    }
}
