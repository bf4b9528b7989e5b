package com.hhplus.storefront.domain.inventory;

/**
 * 재고 예약 상태
 *
 * HELD → COMMITTED | RELEASED | EXPIRED
 * HELD 상태의 예약만 재고(reserved)를 점유한다.
 */
public enum ReservationStatus {
    HELD,
    COMMITTED,
    RELEASED,
    EXPIRED
}
