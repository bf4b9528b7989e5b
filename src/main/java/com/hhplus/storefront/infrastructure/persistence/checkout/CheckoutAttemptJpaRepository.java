package com.hhplus.storefront.infrastructure.persistence.checkout;

import com.hhplus.storefront.domain.checkout.CheckoutAttempt;
import com.hhplus.storefront.domain.checkout.CheckoutState;
import com.hhplus.storefront.domain.payment.PaymentOutcome;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface CheckoutAttemptJpaRepository extends JpaRepository<CheckoutAttempt, String> {

    Optional<CheckoutAttempt> findByIdempotencyKey(String idempotencyKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM CheckoutAttempt a WHERE a.checkoutId = :checkoutId")
    Optional<CheckoutAttempt> findByIdForUpdate(@Param("checkoutId") String checkoutId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM CheckoutAttempt a WHERE a.idempotencyKey = :idempotencyKey")
    Optional<CheckoutAttempt> findByIdempotencyKeyForUpdate(@Param("idempotencyKey") String idempotencyKey);

    @Query("SELECT a.checkoutId FROM CheckoutAttempt a WHERE a.state = :state AND a.paymentOutcome = :outcome")
    List<String> findIdsByStateAndPaymentOutcome(@Param("state") CheckoutState state,
                                                 @Param("outcome") PaymentOutcome outcome);

    @Query("SELECT a.checkoutId FROM CheckoutAttempt a WHERE a.state IN :states AND a.deadline < :now")
    List<String> findIdsByStateInAndDeadlineBefore(@Param("states") Collection<CheckoutState> states,
                                                   @Param("now") LocalDateTime now);
}
