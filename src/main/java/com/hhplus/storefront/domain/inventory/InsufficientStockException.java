package com.hhplus.storefront.domain.inventory;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 예약 가능한 재고가 부족할 때 발생하는 예외 (409)
 * 이번 체크아웃 시도에 대해서는 종료 조건이며, 사용자가 장바구니를 조정해야 한다.
 */
@Getter
public class InsufficientStockException extends DomainException {

    private final Long productId;
    private final int requested;
    private final int available;

    public InsufficientStockException(Long productId, int requested, int available) {
        super(ErrorCode.INSUFFICIENT_STOCK,
                String.format("productId=%d, 요청=%d, 가능=%d", productId, requested, available));
        this.productId = productId;
        this.requested = requested;
        this.available = available;
    }
}
