package com.hhplus.storefront.domain.inventory;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

public class StockNotFoundException extends DomainException {

    public StockNotFoundException(Long productId) {
        super(ErrorCode.STOCK_NOT_FOUND, "productId=" + productId);
    }
}
