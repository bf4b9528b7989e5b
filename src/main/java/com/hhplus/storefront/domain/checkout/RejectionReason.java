package com.hhplus.storefront.domain.checkout;

public enum RejectionReason {
    PRODUCT_UNAVAILABLE,
    INVALID_QUANTITY,
    PRICE_CHANGED,
    INSUFFICIENT_STOCK,
    RESERVATION_FAILED,
    PAYMENT_DECLINED,
    PAYMENT_ERROR,
    TIMEOUT
}
