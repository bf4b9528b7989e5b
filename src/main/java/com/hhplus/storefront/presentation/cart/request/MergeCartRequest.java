package com.hhplus.storefront.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 비회원 세션 장바구니 병합 요청 DTO
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class MergeCartRequest {

    @JsonProperty("session_id")
    private String sessionId;
}
