package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

public class EmptyCartException extends DomainException {

    public EmptyCartException(String ownerId) {
        super(ErrorCode.CART_EMPTY, "ownerId=" + ownerId);
    }
}
