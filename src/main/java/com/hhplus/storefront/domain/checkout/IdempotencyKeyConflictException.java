package com.hhplus.storefront.domain.checkout;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 다른 소유자가 이미 사용한 멱등성 키로 요청한 경우 (409)
 */
public class IdempotencyKeyConflictException extends DomainException {

    public IdempotencyKeyConflictException(String idempotencyKey) {
        super(ErrorCode.IDEMPOTENCY_KEY_CONFLICT, "key=" + idempotencyKey);
    }
}
