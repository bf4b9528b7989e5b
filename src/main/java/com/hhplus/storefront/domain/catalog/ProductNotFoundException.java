package com.hhplus.storefront.domain.catalog;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 상품을 찾을 수 없을 때 발생하는 예외 (404)
 */
public class ProductNotFoundException extends DomainException {

    public ProductNotFoundException(Long productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "productId=" + productId);
    }
}
