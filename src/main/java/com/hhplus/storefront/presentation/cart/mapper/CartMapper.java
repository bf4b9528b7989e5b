package com.hhplus.storefront.presentation.cart.mapper;

import com.hhplus.storefront.domain.cart.CartLine;
import com.hhplus.storefront.domain.cart.CartSnapshot;
import com.hhplus.storefront.presentation.cart.response.CartItemResponse;
import com.hhplus.storefront.presentation.cart.response.CartResponse;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * CartMapper - 장바구니 스냅샷 → 응답 DTO 변환
 *
 * 책임:
 * - @JsonProperty 같은 직렬화 관심사는 Presentation 계층에만 둔다
 * - 요청 필수값 검증 (누락 시 400)
 */
@Component
public class CartMapper {

    public CartResponse toCartResponse(CartSnapshot snapshot) {
        return CartResponse.builder()
                .ownerId(snapshot.getOwnerId())
                .version(snapshot.getVersion())
                .items(snapshot.getLines().stream()
                        .map(this::toCartItemResponse)
                        .collect(Collectors.toList()))
                .totalAmount(snapshot.totalAmount())
                .totalQuantity(snapshot.getLines().stream().mapToInt(CartLine::getQuantity).sum())
                .build();
    }

    public CartItemResponse toCartItemResponse(CartLine line) {
        return CartItemResponse.builder()
                .productId(line.getProductId())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .lineTotal(line.lineTotal())
                .build();
    }

    public int requireQuantity(Integer quantity) {
        if (quantity == null) {
            throw new IllegalArgumentException("quantity 는 필수입니다");
        }
        return quantity;
    }

    public Long requireProductId(Long productId) {
        if (productId == null || productId <= 0) {
            throw new IllegalArgumentException("product_id 는 양수여야 합니다: " + productId);
        }
        return productId;
    }
}
