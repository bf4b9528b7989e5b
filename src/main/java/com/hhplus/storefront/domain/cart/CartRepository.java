package com.hhplus.storefront.domain.cart;

import java.util.Optional;

/**
 * Cart Repository Interface (Domain Layer - Port)
 * 의존성 역전: 구현체는 이 인터페이스에 의존한다.
 */
public interface CartRepository {

    Optional<Cart> findByOwnerId(String ownerId);

    /**
     * 엔티티를 읽지 않는 존재 확인 (잠금 없는 일반 조회)
     * 없는 키를 FOR UPDATE 로 조회하면 MySQL 이 갭 락을 잡으므로 잠금 조회 전에 사용한다.
     */
    boolean existsByOwnerId(String ownerId);

    /**
     * 비관적 락으로 장바구니 조회
     * 버전 비교와 변경을 하나의 원자적 단위로 만든다.
     */
    Optional<Cart> findByOwnerIdForUpdate(String ownerId);

    Cart save(Cart cart);

    /**
     * 저장 후 즉시 flush (유니크 제약 위반을 호출 지점에서 드러내기 위함)
     */
    Cart saveAndFlush(Cart cart);
}
