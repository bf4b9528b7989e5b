package com.hhplus.storefront.presentation.checkout.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 체크아웃 요청 DTO
 * idempotency_key 가 없으면 장바구니 버전으로 유도한 키를 사용한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutRequest {

    @JsonProperty("idempotency_key")
    private String idempotencyKey;

    @JsonProperty("payment_details")
    private PaymentDetailsRequest paymentDetails;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PaymentDetailsRequest {
        private String method;
        private String token;
    }
}
