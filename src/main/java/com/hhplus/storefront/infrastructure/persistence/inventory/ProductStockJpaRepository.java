package com.hhplus.storefront.infrastructure.persistence.inventory;

import com.hhplus.storefront.domain.inventory.ProductStock;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * ProductStock JPA Repository
 */
public interface ProductStockJpaRepository extends JpaRepository<ProductStock, Long> {

    /**
     * 비관적 락(Pessimistic Lock)을 사용하여 재고 조회
     * SELECT ... FOR UPDATE 쿼리로 즉시 락 획득
     *
     * 예시:
     * Thread A가 lock 획득 → available 검사 → 예약 → 커밋(해제)
     * Thread B는 Thread A의 커밋까지 대기 후 갱신된 available 을 본다
     * 결과: 동시 예약 합계가 판매 가능 수량을 넘지 않음
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ProductStock s WHERE s.productId = :productId")
    Optional<ProductStock> findByIdForUpdate(@Param("productId") Long productId);
}
