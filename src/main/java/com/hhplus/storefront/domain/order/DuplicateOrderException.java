package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.ApplicationException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 같은 체크아웃/멱등성 키로 두 번째 주문을 기록하려 한 경우
 * 정상적인 멱등성 처리에서는 발생하지 않으며, 발생 시 정합성 알림 대상이다.
 */
public class DuplicateOrderException extends ApplicationException {

    public DuplicateOrderException(String checkoutId, String idempotencyKey) {
        super(ErrorCode.DUPLICATE_ORDER, String.format("checkoutId=%s, key=%s", checkoutId, idempotencyKey));
    }

    public DuplicateOrderException(String checkoutId, String idempotencyKey, Throwable cause) {
        this(checkoutId, idempotencyKey);
        initCause(cause);
    }
}
