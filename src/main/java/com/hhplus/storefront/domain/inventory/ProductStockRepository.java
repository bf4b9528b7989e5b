package com.hhplus.storefront.domain.inventory;

import java.util.Optional;

/**
 * ProductStock Repository Interface (Domain Layer - Port)
 */
public interface ProductStockRepository {

    Optional<ProductStock> findByProductId(Long productId);

    /**
     * 비관적 락(SELECT ... FOR UPDATE)으로 재고 행 조회
     * 호출 트랜잭션이 끝날 때까지 같은 상품의 다른 예약/해제/확정은 대기한다.
     */
    Optional<ProductStock> findByProductIdForUpdate(Long productId);

    ProductStock save(ProductStock stock);
}
