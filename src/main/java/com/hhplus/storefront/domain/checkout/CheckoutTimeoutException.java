package com.hhplus.storefront.domain.checkout;

import com.hhplus.storefront.common.exception.ApplicationException;
import com.hhplus.storefront.common.exception.ErrorCode;

public class CheckoutTimeoutException extends ApplicationException {

    public CheckoutTimeoutException(String checkoutId) {
        super(ErrorCode.CHECKOUT_TIMEOUT, "checkoutId=" + checkoutId);
    }
}
