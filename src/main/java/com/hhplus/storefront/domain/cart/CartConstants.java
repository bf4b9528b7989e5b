package com.hhplus.storefront.domain.cart;

/**
 * CartConstants - 장바구니 도메인 상수
 *
 * 사용 예:
 * - if (quantity < CartConstants.MIN_CART_QUANTITY) throw ...
 * - 최대 수량은 storefront.cart.max-quantity-per-line 설정값을 따르며 기본값은 DEFAULT_MAX_CART_QUANTITY
 */
public class CartConstants {

    // ========== Cart Item Quantity Constants ==========

    /** 장바구니 항목 최소 수량 */
    public static final int MIN_CART_QUANTITY = 1;

    /** 장바구니 항목 기본 최대 수량 */
    public static final int DEFAULT_MAX_CART_QUANTITY = 100;

    // ========== Checkout Idempotency ==========

    /** 클라이언트가 멱등성 키를 주지 않았을 때 사용하는 파생 키 형식: cart:{ownerId}:v{version} */
    public static final String DERIVED_IDEMPOTENCY_KEY_FORMAT = "cart:%s:v%d";

    private CartConstants() {
        throw new AssertionError("CartConstants는 인스턴스화할 수 없습니다");
    }
}
