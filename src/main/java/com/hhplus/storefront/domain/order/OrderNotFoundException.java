package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;

/**
 * 주문을 찾을 수 없을 때 발생하는 예외 (404)
 * 다른 소유자의 주문 조회도 존재를 드러내지 않도록 같은 예외로 응답한다.
 */
public class OrderNotFoundException extends DomainException {

    public OrderNotFoundException(Long orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "orderId=" + orderId);
    }
}
