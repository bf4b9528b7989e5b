package com.hhplus.storefront.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 상품 추가 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemRequest {

    @JsonProperty("product_id")
    private Long productId;

    private Integer quantity;

    @JsonProperty("expected_version")
    private Long expectedVersion;

    @JsonProperty("replace_quantity")
    private Boolean replaceQuantity;
}
