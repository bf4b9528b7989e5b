package com.hhplus.storefront.infrastructure.persistence.inventory;

import com.hhplus.storefront.domain.inventory.ReservationStatus;
import com.hhplus.storefront.domain.inventory.StockReservation;
import com.hhplus.storefront.domain.inventory.StockReservationRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 StockReservation Repository 구현
 */
@Repository
@Primary
public class MySQLStockReservationRepository implements StockReservationRepository {

    private final StockReservationJpaRepository stockReservationJpaRepository;

    public MySQLStockReservationRepository(StockReservationJpaRepository stockReservationJpaRepository) {
        this.stockReservationJpaRepository = stockReservationJpaRepository;
    }

    @Override
    public StockReservation save(StockReservation reservation) {
        return stockReservationJpaRepository.save(reservation);
    }

    @Override
    public Optional<StockReservation> findByIdForUpdate(Long reservationId) {
        return stockReservationJpaRepository.findByIdForUpdate(reservationId);
    }

    @Override
    public List<StockReservation> findByCheckoutIdForUpdate(String checkoutId) {
        return stockReservationJpaRepository.findByCheckoutIdForUpdate(checkoutId);
    }

    @Override
    public List<StockReservation> findByCheckoutId(String checkoutId) {
        return stockReservationJpaRepository.findByCheckoutIdOrderByProductIdAsc(checkoutId);
    }

    @Override
    public List<Long> findExpiredHeldIds(LocalDateTime now) {
        return stockReservationJpaRepository.findIdsByStatusAndExpiresAtBefore(ReservationStatus.HELD, now);
    }
}
