package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 장바구니에 해당 상품 라인이 없을 때 발생하는 예외
 */
public class CartItemNotFoundException extends DomainException {

    public CartItemNotFoundException(String ownerId, Long productId) {
        super(ErrorCode.CART_ITEM_NOT_FOUND, String.format("ownerId=%s, productId=%d", ownerId, productId));
    }
}
