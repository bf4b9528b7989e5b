package com.hhplus.storefront.domain.payment;

/**
 * 결제 결과
 * - APPROVED: 승인 (커밋 단계로 진행)
 * - DECLINED: 거절 (종료, 사용자가 새 결제 수단 제공)
 * - ERROR: 일시적 오류 (같은 멱등성 키로 재시도 가능)
 */
public enum PaymentOutcome {
    APPROVED,
    DECLINED,
    ERROR
}
