package com.hhplus.storefront.domain.payment;

import com.hhplus.storefront.common.exception.ApplicationException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 결제 게이트웨이 일시 오류 (503)
 * 체크아웃 기록은 남아 있어 같은 멱등성 키로 재시도할 수 있다.
 */
public class PaymentFailedException extends ApplicationException {

    public PaymentFailedException(String checkoutId, String reason) {
        super(ErrorCode.PAYMENT_ERROR, String.format("checkoutId=%s, 사유=%s", checkoutId, reason));
    }
}
