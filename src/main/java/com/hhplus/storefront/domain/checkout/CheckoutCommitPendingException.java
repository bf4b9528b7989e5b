package com.hhplus.storefront.domain.checkout;

import com.hhplus.storefront.common.exception.ApplicationException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 결제 승인 후 커밋 트랜잭션이 실패한 경우 (503)
 * 체크아웃은 승인 상태로 남아 같은 키의 재요청이나 복구 작업이 커밋만 다시 실행한다.
 */
public class CheckoutCommitPendingException extends ApplicationException {

    public CheckoutCommitPendingException(String checkoutId, Throwable cause) {
        super(ErrorCode.CHECKOUT_COMMIT_PENDING, "checkoutId=" + checkoutId);
        initCause(cause);
    }
}
