package com.hhplus.storefront.application.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * AlertService - 정합성 알림 서비스 (Application 계층)
 *
 * 역할:
 * - 정상 흐름에서는 일어나면 안 되는 상황(중복 주문, 승인 후 커밋 실패 등)을 관리자에게 알림
 *
 * 현재 구현:
 * - 로깅 기반 알림 (ERROR/WARN 레벨)
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    /**
     * 중복 주문 시도 알림
     *
     * 시나리오:
     * - 같은 체크아웃/멱등성 키로 두 번째 주문 기록 시도
     * - 멱등성 처리 결함을 의미하므로 즉시 확인 필요
     */
    public void notifyDuplicateOrder(String checkoutId, String idempotencyKey) {
        String message = String.format(
                "[정합성 알림 - 중복 주문] 체크아웃 ID: %s, 멱등성 키: %s - 멱등성 처리 점검 필요",
                checkoutId, idempotencyKey
        );
        log.error(message);
    }

    /**
     * 타임아웃 처리된 체크아웃에 결제 승인이 도착한 경우
     *
     * 시나리오:
     * - 결제 응답 대기 중 마감 시각 초과로 체크아웃이 REJECTED(TIMEOUT) 처리됨
     * - 이후 결제 승인 응답 도착 → 주문 없이 과금됨, 수동 환불 필요
     */
    public void notifyApprovedAfterTimeout(String checkoutId, String ownerId, long amount, String paymentReference) {
        String message = String.format(
                "[정합성 알림 - 타임아웃 후 결제 승인] 체크아웃 ID: %s, 소유자: %s, 금액: %d원, 결제 참조: %s - 환불 처리 필요",
                checkoutId, ownerId, amount, paymentReference
        );
        log.error(message);
    }

    /**
     * 결제 승인 후 커밋 실패
     *
     * 시나리오:
     * - 주문 기록/재고 확정/장바구니 정리 트랜잭션 실패
     * - 체크아웃은 승인 상태로 남아 복구 작업이 커밋만 다시 실행한다 (재과금 없음)
     */
    public void notifyCommitFailure(String checkoutId, String ownerId, String error) {
        String message = String.format(
                "[커밋 실패] 체크아웃 ID: %s, 소유자: %s, 에러: %s - 복구 작업이 재시도합니다",
                checkoutId, ownerId, error
        );
        log.error(message);
    }

    /**
     * 만료된 예약을 재획득하지 못한 경우
     *
     * 시나리오:
     * - 결제 승인 후 커밋 시점에 예약이 이미 만료/해제되어 판매 가능 재고에서 직접 차감 시도
     * - 그 사이 다른 체크아웃이 재고를 가져가 부족
     */
    public void notifyReservationReacquireFailure(String checkoutId, Long productId, int quantity, int available) {
        String message = String.format(
                "[재고 재획득 실패] 체크아웃 ID: %s, 상품 ID: %d, 필요 수량: %d개, 판매 가능: %d개 - 재입고 또는 환불 필요",
                checkoutId, productId, quantity, available
        );
        log.error(message);
    }

    /**
     * 복구 작업 결과 알림
     */
    public void notifyRecovery(int committed, int expired) {
        String message = String.format(
                "[체크아웃 복구] 커밋 재실행: %d건, 타임아웃 처리: %d건", committed, expired
        );
        log.warn(message);
    }
}
