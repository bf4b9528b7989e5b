package com.hhplus.storefront.domain.payment;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 결제 거절 (402) - 이번 시도는 종료, 재고 예약은 해제됨
 */
public class PaymentDeclinedException extends DomainException {

    public PaymentDeclinedException(String checkoutId, String reason) {
        super(ErrorCode.PAYMENT_DECLINED, String.format("checkoutId=%s, 사유=%s", checkoutId, reason));
    }
}
