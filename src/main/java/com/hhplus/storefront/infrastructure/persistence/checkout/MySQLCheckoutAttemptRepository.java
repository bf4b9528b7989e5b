package com.hhplus.storefront.infrastructure.persistence.checkout;

import com.hhplus.storefront.domain.checkout.CheckoutAttempt;
import com.hhplus.storefront.domain.checkout.CheckoutAttemptRepository;
import com.hhplus.storefront.domain.checkout.CheckoutState;
import com.hhplus.storefront.domain.payment.PaymentOutcome;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 CheckoutAttempt Repository 구현
 */
@Repository
@Primary
public class MySQLCheckoutAttemptRepository implements CheckoutAttemptRepository {

    private static final EnumSet<CheckoutState> UNFINISHED_STATES = EnumSet.of(
            CheckoutState.INITIATED, CheckoutState.VALIDATED, CheckoutState.RESERVED, CheckoutState.PAYMENT_PENDING);

    private final CheckoutAttemptJpaRepository checkoutAttemptJpaRepository;

    public MySQLCheckoutAttemptRepository(CheckoutAttemptJpaRepository checkoutAttemptJpaRepository) {
        this.checkoutAttemptJpaRepository = checkoutAttemptJpaRepository;
    }

    @Override
    public Optional<CheckoutAttempt> findById(String checkoutId) {
        return checkoutAttemptJpaRepository.findById(checkoutId);
    }

    @Override
    public Optional<CheckoutAttempt> findByIdForUpdate(String checkoutId) {
        return checkoutAttemptJpaRepository.findByIdForUpdate(checkoutId);
    }

    @Override
    public Optional<CheckoutAttempt> findByIdempotencyKey(String idempotencyKey) {
        return checkoutAttemptJpaRepository.findByIdempotencyKey(idempotencyKey);
    }

    @Override
    public Optional<CheckoutAttempt> findByIdempotencyKeyForUpdate(String idempotencyKey) {
        return checkoutAttemptJpaRepository.findByIdempotencyKeyForUpdate(idempotencyKey);
    }

    @Override
    public CheckoutAttempt save(CheckoutAttempt attempt) {
        return checkoutAttemptJpaRepository.save(attempt);
    }

    @Override
    public CheckoutAttempt saveAndFlush(CheckoutAttempt attempt) {
        return checkoutAttemptJpaRepository.saveAndFlush(attempt);
    }

    @Override
    public List<String> findAwaitingCommitIds() {
        return checkoutAttemptJpaRepository.findIdsByStateAndPaymentOutcome(
                CheckoutState.PAYMENT_PENDING, PaymentOutcome.APPROVED);
    }

    @Override
    public List<String> findUnfinishedIdsWithDeadlineBefore(LocalDateTime now) {
        return checkoutAttemptJpaRepository.findIdsByStateInAndDeadlineBefore(UNFINISHED_STATES, now);
    }
}
