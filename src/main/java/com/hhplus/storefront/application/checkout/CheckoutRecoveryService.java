package com.hhplus.storefront.application.checkout;

import com.hhplus.storefront.application.alert.AlertService;
import com.hhplus.storefront.application.inventory.ReservationExpiryJob;
import com.hhplus.storefront.domain.checkout.CheckoutAttemptRepository;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * CheckoutRecoveryService - 중단된 체크아웃 복구
 *
 * 역할:
 * - 결제 승인 후 커밋 전에 중단된 시도: 커밋 단계만 재실행 (재과금 없음)
 * - 마감이 지난 미완료 시도: REJECTED/TIMEOUT 처리 후 예약 해제
 * - 남은 만료 예약 스윕
 *
 * 실행 시점:
 * - 애플리케이션 기동 완료 직후 1회
 * - storefront.recovery.fixed-delay-ms 간격 (기본 30초)
 *
 * 시도 하나당 트랜잭션 하나로 처리하며, 한 건의 실패가 나머지를 막지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutRecoveryService {

    private final CheckoutAttemptRepository checkoutAttemptRepository;
    private final CheckoutTransactionService checkoutTransactionService;
    private final ReservationExpiryJob reservationExpiryJob;
    private final AlertService alertService;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        log.info("[CheckoutRecoveryService] 기동 시 체크아웃 복구 시작");
        runSafely();
    }

    @Scheduled(fixedDelayString = "${storefront.recovery.fixed-delay-ms:30000}")
    public void recoverPeriodically() {
        runSafely();
    }

    /**
     * 복구 1회 실행
     *
     * @return 커밋 재실행 건수와 타임아웃 처리 건수
     */
    public RecoveryReport recover() {
        int committed = resumeApprovedCommits();
        int expired = expireOverdueAttempts();
        reservationExpiryJob.releaseExpired();

        if (committed > 0 || expired > 0) {
            alertService.notifyRecovery(committed, expired);
        }
        return new RecoveryReport(committed, expired);
    }

    private int resumeApprovedCommits() {
        List<String> awaiting = checkoutAttemptRepository.findAwaitingCommitIds();
        int committed = 0;
        for (String checkoutId : awaiting) {
            try {
                checkoutTransactionService.commit(checkoutId);
                committed++;
                log.info("[CheckoutRecoveryService] 승인된 체크아웃 커밋 재실행 - checkoutId={}", checkoutId);
            } catch (RuntimeException e) {
                log.error("[CheckoutRecoveryService] 커밋 재실행 실패 - checkoutId={}", checkoutId, e);
            }
        }
        return committed;
    }

    private int expireOverdueAttempts() {
        List<String> overdue = checkoutAttemptRepository.findUnfinishedIdsWithDeadlineBefore(LocalDateTime.now(clock));
        int expired = 0;
        for (String checkoutId : overdue) {
            try {
                if (checkoutTransactionService.expireIfOverdue(checkoutId)) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.error("[CheckoutRecoveryService] 타임아웃 처리 실패 - checkoutId={}", checkoutId, e);
            }
        }
        return expired;
    }

    private void runSafely() {
        try {
            recover();
        } catch (Exception e) {
            log.error("[CheckoutRecoveryService] 복구 작업 중 예상치 못한 에러", e);
        }
    }

    /**
     * 복구 1회 결과
     */
    @Getter
    @AllArgsConstructor
    public static class RecoveryReport {
        private final int committed;
        private final int expired;
    }
}
