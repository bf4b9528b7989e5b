package com.hhplus.storefront.domain.catalog;

/**
 * ProductCatalog - 카탈로그 조회 포트 (Domain Layer - Port)
 *
 * 역할:
 * - 장바구니와 체크아웃이 현재 가격과 판매 여부를 확인하는 유일한 통로
 * - 상품 관리(CRUD)는 외부 협력자의 책임이며 이 포트는 읽기 전용
 */
public interface ProductCatalog {

    /**
     * 현재 판매 가격 조회
     *
     * @throws ProductNotFoundException 상품이 없는 경우
     */
    long getCurrentPrice(Long productId);

    /**
     * 상품 존재/판매 여부 조회 (없으면 예외 대신 missing 반환)
     */
    ProductAvailability getProduct(Long productId);
}
