package com.hhplus.storefront.domain.checkout;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

public class CheckoutNotFoundException extends DomainException {

    public CheckoutNotFoundException(String checkoutId) {
        super(ErrorCode.CHECKOUT_NOT_FOUND, "checkoutId=" + checkoutId);
    }
}
