package com.hhplus.storefront.infrastructure.persistence.cart;

import com.hhplus.storefront.domain.cart.Cart;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Cart JPA Repository
 * Spring Data JPA를 통한 Cart 엔티티 영구 저장소
 */
public interface CartJpaRepository extends JpaRepository<Cart, Long> {

    Optional<Cart> findByOwnerId(String ownerId);

    boolean existsByOwnerId(String ownerId);

    /**
     * SELECT ... FOR UPDATE 로 장바구니 행 잠금
     * 버전 비교와 변경 사이에 다른 요청이 끼어들지 못하게 한다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Cart c WHERE c.ownerId = :ownerId")
    Optional<Cart> findByOwnerIdForUpdate(@Param("ownerId") String ownerId);
}
