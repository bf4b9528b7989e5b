package com.hhplus.storefront.domain.checkout;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * CheckoutAttempt Repository Interface (Domain Layer - Port)
 */
public interface CheckoutAttemptRepository {

    Optional<CheckoutAttempt> findById(String checkoutId);

    Optional<CheckoutAttempt> findByIdForUpdate(String checkoutId);

    Optional<CheckoutAttempt> findByIdempotencyKey(String idempotencyKey);

    Optional<CheckoutAttempt> findByIdempotencyKeyForUpdate(String idempotencyKey);

    CheckoutAttempt save(CheckoutAttempt attempt);

    /**
     * 저장 후 즉시 flush - 멱등성 키 유니크 제약 위반을 호출 지점에서 드러낸다
     */
    CheckoutAttempt saveAndFlush(CheckoutAttempt attempt);

    /**
     * 결제 승인 후 커밋되지 않은 시도 ID 목록 (복구 대상)
     */
    List<String> findAwaitingCommitIds();

    /**
     * 마감 시각이 지난 미종료 시도 ID 목록
     */
    List<String> findUnfinishedIdsWithDeadlineBefore(LocalDateTime now);
}
