package com.hhplus.storefront.presentation.inventory.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.storefront.domain.inventory.ProductStock;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 상품 재고 현황 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryResponse {

    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("available_quantity")
    private Integer availableQuantity;

    @JsonProperty("reserved_quantity")
    private Integer reservedQuantity;

    public static InventoryResponse from(ProductStock stock) {
        return InventoryResponse.builder()
                .productId(stock.getProductId())
                .availableQuantity(stock.getAvailableQuantity())
                .reservedQuantity(stock.getReservedQuantity())
                .build();
    }
}
