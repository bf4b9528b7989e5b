package com.hhplus.storefront.domain.cart;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 장바구니 버전 충돌 (409)
 * 호출자는 최신 장바구니를 다시 읽고 재시도한다.
 */
@Getter
public class CartVersionConflictException extends DomainException {

    private final long expectedVersion;
    private final long currentVersion;

    public CartVersionConflictException(String ownerId, long expectedVersion, long currentVersion) {
        super(ErrorCode.CART_VERSION_CONFLICT,
                String.format("ownerId=%s, 기대 버전=%d, 현재 버전=%d", ownerId, expectedVersion, currentVersion));
        this.expectedVersion = expectedVersion;
        this.currentVersion = currentVersion;
    }
}
