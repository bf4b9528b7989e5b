package com.hhplus.storefront.domain.catalog;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 판매 중지된 상품을 담거나 주문하려 할 때 발생하는 예외 (400)
 */
public class ProductUnavailableException extends DomainException {

    public ProductUnavailableException(Long productId) {
        super(ErrorCode.PRODUCT_UNAVAILABLE, "productId=" + productId);
    }
}
