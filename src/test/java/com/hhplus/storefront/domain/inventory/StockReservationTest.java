package com.hhplus.storefront.domain.inventory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("StockReservation 도메인 단위 테스트")
class StockReservationTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 11, 7, 12, 0);

    private StockReservation held() {
        return StockReservation.hold("checkout-1", 1, 10L, 2, NOW.plusMinutes(15), NOW);
    }

    @Test
    @DisplayName("만료 판단 - HELD 이고 expiresAt 이 지났을 때만")
    void testIsExpiredAt() {
        StockReservation reservation = held();

        assertFalse(reservation.isExpiredAt(NOW.plusMinutes(15)));
        assertTrue(reservation.isExpiredAt(NOW.plusMinutes(16)));

        reservation.markCommitted(NOW);
        assertFalse(reservation.isExpiredAt(NOW.plusHours(1)));
    }

    @Test
    @DisplayName("HELD 가 아닌 예약은 다시 전이할 수 없다")
    void testTransition_OnlyFromHeld() {
        StockReservation reservation = held();
        reservation.markReleased(NOW);

        assertEquals(ReservationStatus.RELEASED, reservation.getStatus());
        assertThrows(IllegalStateException.class, () -> reservation.markCommitted(NOW));
        assertThrows(IllegalStateException.class, () -> reservation.markExpired(NOW));
    }

    @Test
    @DisplayName("만료된 예약의 재획득 확정")
    void testMarkReacquiredAndCommitted() {
        StockReservation reservation = held();
        reservation.markExpired(NOW);

        reservation.markReacquiredAndCommitted(NOW);

        assertEquals(ReservationStatus.COMMITTED, reservation.getStatus());
    }
}
