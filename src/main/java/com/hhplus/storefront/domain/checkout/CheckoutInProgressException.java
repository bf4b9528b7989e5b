package com.hhplus.storefront.domain.checkout;

import com.hhplus.storefront.common.exception.ApplicationException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 같은 멱등성 키의 체크아웃이 아직 진행 중일 때 (409)
 */
public class CheckoutInProgressException extends ApplicationException {

    public CheckoutInProgressException(String checkoutId, CheckoutState state) {
        super(ErrorCode.CHECKOUT_IN_PROGRESS, String.format("checkoutId=%s, state=%s", checkoutId, state));
    }
}
