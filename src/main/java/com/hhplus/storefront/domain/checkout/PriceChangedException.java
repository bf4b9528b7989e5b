package com.hhplus.storefront.domain.checkout;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 장바구니 가격 스냅샷과 현재 카탈로그 가격이 다를 때 (409)
 * 조용한 가격 재산정은 하지 않는다. 사용자가 다시 확인해야 한다.
 */
@Getter
public class PriceChangedException extends DomainException {

    private final Long productId;
    private final long snapshotPrice;
    private final long currentPrice;

    public PriceChangedException(Long productId, long snapshotPrice, long currentPrice) {
        super(ErrorCode.PRICE_CHANGED,
                String.format("productId=%d, 담은 가격=%d, 현재 가격=%d", productId, snapshotPrice, currentPrice));
        this.productId = productId;
        this.snapshotPrice = snapshotPrice;
        this.currentPrice = currentPrice;
    }
}
