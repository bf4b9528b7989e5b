package com.hhplus.storefront.infrastructure.persistence.inventory;

import com.hhplus.storefront.domain.inventory.ReservationStatus;
import com.hhplus.storefront.domain.inventory.StockReservation;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface StockReservationJpaRepository extends JpaRepository<StockReservation, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM StockReservation r WHERE r.reservationId = :reservationId")
    Optional<StockReservation> findByIdForUpdate(@Param("reservationId") Long reservationId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM StockReservation r WHERE r.checkoutId = :checkoutId ORDER BY r.productId ASC, r.reservationId ASC")
    List<StockReservation> findByCheckoutIdForUpdate(@Param("checkoutId") String checkoutId);

    List<StockReservation> findByCheckoutIdOrderByProductIdAsc(String checkoutId);

    @Query("SELECT r.reservationId FROM StockReservation r WHERE r.status = :status AND r.expiresAt < :now ORDER BY r.reservationId ASC")
    List<Long> findIdsByStatusAndExpiresAtBefore(@Param("status") ReservationStatus status,
                                                 @Param("now") LocalDateTime now);
}
