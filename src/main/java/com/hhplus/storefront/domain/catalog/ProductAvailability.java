package com.hhplus.storefront.domain.catalog;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 카탈로그 조회 결과: 상품 존재 여부와 판매 여부
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProductAvailability {

    private static final ProductAvailability MISSING = new ProductAvailability(false, false);

    private final boolean exists;
    private final boolean active;

    public static ProductAvailability missing() {
        return MISSING;
    }

    public static ProductAvailability of(boolean active) {
        return new ProductAvailability(true, active);
    }

    public boolean isPurchasable() {
        return exists && active;
    }
}
