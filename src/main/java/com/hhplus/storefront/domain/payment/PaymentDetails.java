package com.hhplus.storefront.domain.payment;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 클라이언트가 제공한 결제 수단 정보
 * token은 시뮬레이터가 결과를 결정하는 키로도 쓰인다.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class PaymentDetails {
    private final String method;
    private final String token;
}
