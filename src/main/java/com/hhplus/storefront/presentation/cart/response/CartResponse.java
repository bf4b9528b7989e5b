package com.hhplus.storefront.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 장바구니 조회/변경 응답 DTO
 * version 은 다음 변경 요청의 expected_version 으로 사용한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {

    @JsonProperty("owner_id")
    private String ownerId;

    private Long version;

    private List<CartItemResponse> items;

    @JsonProperty("total_amount")
    private Long totalAmount;

    @JsonProperty("total_quantity")
    private Integer totalQuantity;
}
