package com.hhplus.storefront.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 라인 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItemResponse {

    @JsonProperty("product_id")
    private Long productId;

    private Integer quantity;

    @JsonProperty("unit_price")
    private Long unitPrice;

    @JsonProperty("line_total")
    private Long lineTotal;
}
