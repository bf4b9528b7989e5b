package com.hhplus.storefront.application.checkout.dto;

import com.hhplus.storefront.domain.checkout.CheckoutAttempt;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 체크아웃 시작 단계의 판단 결과
 *
 * - RUN: 검증부터 진행 (새 시도 또는 거절/타임아웃 후 재시작)
 * - RESUME_COMMIT: 결제 승인 기록이 있으므로 커밋만 재실행 (재과금 금지)
 * - REPLAY: 이미 커밋됨, 기존 주문으로 응답
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BeginResult {

    public enum Action {
        RUN,
        RESUME_COMMIT,
        REPLAY
    }

    private final Action action;
    private final CheckoutAttempt attempt;

    public static BeginResult run(CheckoutAttempt attempt) {
        return new BeginResult(Action.RUN, attempt);
    }

    public static BeginResult resumeCommit(CheckoutAttempt attempt) {
        return new BeginResult(Action.RESUME_COMMIT, attempt);
    }

    public static BeginResult replay(CheckoutAttempt attempt) {
        return new BeginResult(Action.REPLAY, attempt);
    }
}
