package com.hhplus.storefront.domain.inventory;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * StockReservation Repository Interface (Domain Layer - Port)
 */
public interface StockReservationRepository {

    StockReservation save(StockReservation reservation);

    Optional<StockReservation> findByIdForUpdate(Long reservationId);

    /**
     * 체크아웃의 모든 예약을 상품 ID 오름차순으로 잠금 조회
     */
    List<StockReservation> findByCheckoutIdForUpdate(String checkoutId);

    List<StockReservation> findByCheckoutId(String checkoutId);

    /**
     * 만료 시각이 지난 HELD 예약 ID 목록
     */
    List<Long> findExpiredHeldIds(LocalDateTime now);
}
