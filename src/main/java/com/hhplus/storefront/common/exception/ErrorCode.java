package com.hhplus.storefront.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_CART_VERSION_CONFLICT, APP_PAYMENT_ERROR
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // Catalog Domain
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    PRODUCT_UNAVAILABLE("DOMAIN_PRODUCT_UNAVAILABLE", "판매 중인 상품이 아닙니다", 400),

    // Inventory Domain
    INSUFFICIENT_STOCK("DOMAIN_INVENTORY_INSUFFICIENT_STOCK", "재고가 부족합니다", 409),
    STOCK_NOT_FOUND("DOMAIN_INVENTORY_STOCK_NOT_FOUND", "재고 정보를 찾을 수 없습니다", 404),

    // Cart Domain
    CART_VERSION_CONFLICT("DOMAIN_CART_VERSION_CONFLICT", "장바구니가 다른 요청에 의해 변경되었습니다", 409),
    CART_ITEM_NOT_FOUND("DOMAIN_CART_ITEM_NOT_FOUND", "장바구니 항목을 찾을 수 없습니다", 404),
    CART_EMPTY("DOMAIN_CART_EMPTY", "장바구니가 비어 있습니다", 400),
    INVALID_QUANTITY("DOMAIN_CART_INVALID_QUANTITY", "유효하지 않은 수량입니다", 400),

    // Checkout Domain
    PRICE_CHANGED("DOMAIN_CHECKOUT_PRICE_CHANGED", "상품 가격이 변경되었습니다", 409),
    IDEMPOTENCY_KEY_CONFLICT("DOMAIN_CHECKOUT_IDEMPOTENCY_KEY_CONFLICT", "다른 사용자가 사용한 멱등성 키입니다", 409),
    CHECKOUT_NOT_FOUND("DOMAIN_CHECKOUT_NOT_FOUND", "체크아웃을 찾을 수 없습니다", 404),

    // Payment Domain
    PAYMENT_DECLINED("DOMAIN_PAYMENT_DECLINED", "결제가 거절되었습니다", 402),

    // Order Domain
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),

    // ========== Application Layer Errors ==========

    PAYMENT_ERROR("APP_PAYMENT_ERROR", "결제 처리 중 오류가 발생했습니다. 같은 멱등성 키로 다시 시도하세요", 503),
    CHECKOUT_TIMEOUT("APP_CHECKOUT_TIMEOUT", "체크아웃 제한 시간이 지났습니다", 409),
    CHECKOUT_IN_PROGRESS("APP_CHECKOUT_IN_PROGRESS", "같은 키의 체크아웃이 이미 진행 중입니다", 409),
    CHECKOUT_COMMIT_PENDING("APP_CHECKOUT_COMMIT_PENDING", "결제는 승인되었고 주문 확정을 재시도 중입니다", 503),
    DUPLICATE_ORDER("APP_ORDER_DUPLICATE", "이미 주문이 생성된 체크아웃입니다", 500),

    // ========== System Errors (5XX) ==========

    DATABASE_ERROR("SYSTEM_DATABASE_ERROR", "데이터베이스 오류가 발생했습니다", 500),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
