package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 유효하지 않은 수량일 때 발생하는 예외
 */
public class InvalidQuantityException extends DomainException {

    public InvalidQuantityException(int quantity, int maxQuantity) {
        super(ErrorCode.INVALID_QUANTITY, String.format("수량은 %d 이상 %d 이하여야 합니다 (입력값: %d)",
                CartConstants.MIN_CART_QUANTITY, maxQuantity, quantity));
    }
}
