package com.hhplus.storefront.application.inventory;

import com.hhplus.storefront.domain.checkout.CheckoutAttemptRepository;
import com.hhplus.storefront.domain.inventory.StockReservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * ReservationExpiryJob - 만료된 재고 예약 스윕
 *
 * 역할:
 * - expiresAt 이 지난 HELD 예약을 찾아 재고를 판매 가능 수량으로 되돌림 (EXPIRED)
 * - 버려진 체크아웃으로 인한 영구적인 재고 누수 방지
 *
 * 예외:
 * - 결제 승인 후 커밋 대기 중인 체크아웃의 예약은 남겨둔다
 *
 * 실행:
 * - storefront.reservation-sweep.fixed-delay-ms 간격 (기본 60초)
 * - 예약 하나당 트랜잭션 하나 (한 번에 하나의 재고 행만 잠금)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationExpiryJob {

    private final InventoryLedger inventoryLedger;
    private final StockReservationRepository stockReservationRepository;
    private final CheckoutAttemptRepository checkoutAttemptRepository;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${storefront.reservation-sweep.fixed-delay-ms:60000}")
    public void sweep() {
        try {
            releaseExpired();
        } catch (Exception e) {
            log.error("[ReservationExpiryJob] 예약 만료 처리 중 예상치 못한 에러", e);
        }
    }

    /**
     * 만료 예약 일괄 해제
     *
     * @return 해제한 예약 수
     */
    public int releaseExpired() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Long> expiredIds = stockReservationRepository.findExpiredHeldIds(now);
        if (expiredIds.isEmpty()) {
            log.debug("[ReservationExpiryJob] 만료된 예약 없음");
            return 0;
        }

        Set<String> retained = new HashSet<>(checkoutAttemptRepository.findAwaitingCommitIds());
        int released = 0;
        for (Long reservationId : expiredIds) {
            try {
                if (inventoryLedger.expireReservation(reservationId, retained)) {
                    released++;
                }
            } catch (RuntimeException e) {
                log.error("[ReservationExpiryJob] 예약 만료 처리 실패 - reservationId={}", reservationId, e);
            }
        }

        log.info("[ReservationExpiryJob] 만료 예약 해제 완료 - 대상={}, 해제={}", expiredIds.size(), released);
        return released;
    }
}
