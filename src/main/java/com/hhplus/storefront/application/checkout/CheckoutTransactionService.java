package com.hhplus.storefront.application.checkout;

import com.hhplus.storefront.application.alert.AlertService;
import com.hhplus.storefront.application.cart.CartService;
import com.hhplus.storefront.application.checkout.dto.BeginResult;
import com.hhplus.storefront.application.inventory.InventoryLedger;
import com.hhplus.storefront.application.order.OrderLedger;
import com.hhplus.storefront.domain.cart.CartSnapshot;
import com.hhplus.storefront.domain.cart.EmptyCartException;
import com.hhplus.storefront.domain.checkout.CheckoutAttempt;
import com.hhplus.storefront.domain.checkout.CheckoutAttemptRepository;
import com.hhplus.storefront.domain.checkout.CheckoutInProgressException;
import com.hhplus.storefront.domain.checkout.CheckoutNotFoundException;
import com.hhplus.storefront.domain.checkout.CheckoutState;
import com.hhplus.storefront.domain.checkout.CheckoutTimeoutException;
import com.hhplus.storefront.domain.checkout.IdempotencyKeyConflictException;
import com.hhplus.storefront.domain.checkout.RejectionReason;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.payment.PaymentResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * CheckoutTransactionService - 체크아웃 상태 전이 트랜잭션 서비스
 *
 * 역할:
 * - CheckoutCoordinator 의 각 단계를 체크아웃 행 잠금 아래의 짧은 트랜잭션으로 실행
 * - Coordinator 와 빈을 분리하여 @Transactional 프록시가 항상 적용되게 한다
 *
 * 잠금 순서 (교착 방지):
 * - 체크아웃 행 → 예약 행 → 재고 행(상품 ID 오름차순) → 장바구니 행
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutTransactionService {

    private final CheckoutAttemptRepository checkoutAttemptRepository;
    private final InventoryLedger inventoryLedger;
    private final OrderLedger orderLedger;
    private final CartService cartService;
    private final AlertService alertService;
    private final CheckoutSettings checkoutSettings;
    private final Clock clock;

    /**
     * 체크아웃 시작 (멱등성 키 기준)
     *
     * 기존 시도가 있으면:
     * - 다른 소유자 → IdempotencyKeyConflictException
     * - COMMITTED → REPLAY
     * - 결제 승인 후 미커밋 → RESUME_COMMIT
     * - 마감 초과 → TIMEOUT 거절 후 재시작
     * - REJECTED → 새 스냅샷으로 재시작
     * - 그 외 진행 중 → CheckoutInProgressException
     *
     * 새 시도는 saveAndFlush 로 즉시 INSERT 하여 같은 키의 동시 생성 경쟁을 이 호출에서 드러낸다.
     */
    @Transactional(noRollbackFor = EmptyCartException.class)
    public BeginResult begin(String ownerId, String idempotencyKey, CartSnapshot snapshot) {
        LocalDateTime now = now();
        Optional<CheckoutAttempt> existing = checkoutAttemptRepository.findByIdempotencyKeyForUpdate(idempotencyKey);

        if (existing.isEmpty()) {
            requireItems(ownerId, snapshot);
            CheckoutAttempt created = checkoutAttemptRepository.saveAndFlush(
                    CheckoutAttempt.initiate(idempotencyKey, snapshot, deadlineFrom(now), now));
            log.info("[CheckoutTransactionService] 체크아웃 시작 - checkoutId={}, ownerId={}, key={}, total={}",
                    created.getCheckoutId(), ownerId, idempotencyKey, created.getTotalAmount());
            return BeginResult.run(created);
        }

        CheckoutAttempt attempt = existing.get();
        if (!attempt.isOwnedBy(ownerId)) {
            throw new IdempotencyKeyConflictException(idempotencyKey);
        }
        if (attempt.isCommitted()) {
            return BeginResult.replay(attempt);
        }
        if (attempt.isAwaitingCommit()) {
            log.info("[CheckoutTransactionService] 결제 승인된 체크아웃 커밋 재개 - checkoutId={}", attempt.getCheckoutId());
            return BeginResult.resumeCommit(attempt);
        }
        if (attempt.isOverdue(now, checkoutSettings.getRecoveryGrace())) {
            expireLocked(attempt, now);
        }
        if (attempt.isRejected()) {
            requireItems(ownerId, snapshot);
            attempt.restart(snapshot, deadlineFrom(now), now);
            log.info("[CheckoutTransactionService] 거절된 체크아웃 재시작 - checkoutId={}, attemptNumber={}",
                    attempt.getCheckoutId(), attempt.getAttemptNumber());
            return BeginResult.run(attempt);
        }
        throw new CheckoutInProgressException(attempt.getCheckoutId(), attempt.getState());
    }

    /**
     * 다음 상태로 전진 (마감 검사 포함)
     *
     * 호출자의 회차가 이미 끝났으면(타임아웃 거절 또는 같은 키로 재시작) 그 회차가 잡아 둔 예약을 해제하고
     * 타임아웃으로 응답한다. 해제는 예외와 함께 커밋된다.
     *
     * @param attemptNumber 호출자가 구동 중인 회차
     * @throws CheckoutTimeoutException 마감 초과 또는 이미 종료된 회차
     */
    @Transactional(noRollbackFor = CheckoutTimeoutException.class)
    public CheckoutAttempt advance(String checkoutId, int attemptNumber, CheckoutState target) {
        LocalDateTime now = now();
        CheckoutAttempt attempt = lock(checkoutId);

        if (!attempt.isRound(attemptNumber) || attempt.isRejected()) {
            releaseFinishedRound(attempt, attemptNumber);
            throw new CheckoutTimeoutException(checkoutId);
        }
        if (attempt.isOverdue(now, checkoutSettings.getRecoveryGrace())) {
            expireLocked(attempt, now);
            throw new CheckoutTimeoutException(checkoutId);
        }

        switch (target) {
            case VALIDATED:
                attempt.markValidated(now);
                break;
            case RESERVED:
                attempt.markReserved(now);
                break;
            case PAYMENT_PENDING:
                attempt.markPaymentPending(now);
                break;
            default:
                throw new IllegalArgumentException("advance 로 전이할 수 없는 상태입니다: " + target);
        }
        log.debug("[CheckoutTransactionService] 상태 전이 - checkoutId={}, attemptNumber={}, state={}",
                checkoutId, attemptNumber, target);
        return attempt;
    }

    /**
     * 거절 + 예약 전체 해제 (하나의 트랜잭션)
     *
     * - 승인되었거나 종료된 현재 회차는 건드리지 않는다
     * - 이미 끝난 회차면 상태는 그대로 두고 그 회차의 예약만 해제한다
     */
    @Transactional
    public void rejectAndRelease(String checkoutId, int attemptNumber, RejectionReason reason) {
        CheckoutAttempt attempt = lock(checkoutId);
        if (!attempt.isRound(attemptNumber) || attempt.isRejected()) {
            releaseFinishedRound(attempt, attemptNumber);
            return;
        }
        if (attempt.isTerminal() || attempt.isAwaitingCommit()) {
            return;
        }
        attempt.reject(reason, now());
        inventoryLedger.releaseAll(checkoutId);
        log.warn("[CheckoutTransactionService] 체크아웃 거절 - checkoutId={}, attemptNumber={}, reason={}",
                checkoutId, attemptNumber, reason);
    }

    /**
     * 결제 결과 기록
     *
     * 호출자의 회차가 현재 결제 대기 회차가 아니면(타임아웃 거절 또는 재시작됨) 기록하지 않는다.
     * 그 결과가 승인이면 환불이 필요하므로 알림을 보낸다.
     *
     * @param chargedAmount 호출자 회차가 청구한 금액 (알림용)
     * @throws CheckoutTimeoutException 호출자의 회차가 이미 끝남
     */
    @Transactional(noRollbackFor = CheckoutTimeoutException.class)
    public CheckoutAttempt recordPaymentOutcome(String checkoutId, int attemptNumber, long chargedAmount,
                                                PaymentResult result) {
        CheckoutAttempt attempt = lock(checkoutId);
        if (!attempt.isRound(attemptNumber) || attempt.getState() != CheckoutState.PAYMENT_PENDING) {
            log.warn("[CheckoutTransactionService] 종료된 회차의 결제 결과 도착 - checkoutId={}, 응답 회차={}, 현재 회차={}, state={}, outcome={}",
                    checkoutId, attemptNumber, attempt.getAttemptNumber(), attempt.getState(), result.getOutcome());
            if (result.isApproved()) {
                alertService.notifyApprovedAfterTimeout(checkoutId, attempt.getOwnerId(),
                        chargedAmount, result.getReference());
            }
            releaseFinishedRound(attempt, attemptNumber);
            throw new CheckoutTimeoutException(checkoutId);
        }
        attempt.recordPayment(result, now());
        log.info("[CheckoutTransactionService] 결제 결과 기록 - checkoutId={}, attemptNumber={}, outcome={}, reference={}",
                checkoutId, attemptNumber, result.getOutcome(), result.getReference());
        return attempt;
    }

    /**
     * 커밋: 주문 기록 + 예약 확정 + 장바구니 정리 + COMMITTED 를 하나의 트랜잭션으로
     *
     * 멱등성:
     * - 체크아웃 행 잠금 아래에서 실행되므로 동시 커밋은 직렬화된다
     * - 이미 COMMITTED 면 기존 주문을 돌려준다
     */
    @Transactional
    public Order commit(String checkoutId) {
        LocalDateTime now = now();
        CheckoutAttempt attempt = lock(checkoutId);
        if (attempt.isCommitted()) {
            return orderLedger.get(attempt.getOrderId());
        }
        if (!attempt.isAwaitingCommit()) {
            throw new IllegalStateException(String.format(
                    "결제 승인되지 않은 체크아웃은 커밋할 수 없습니다 (checkoutId=%s, state=%s)",
                    checkoutId, attempt.getState()));
        }

        Order order = orderLedger.append(Order.fromCheckout(attempt, now));
        inventoryLedger.commitAll(checkoutId, attempt.getAttemptNumber());
        cartService.reduceAfterPurchase(attempt.snapshot());
        attempt.markCommitted(order.getOrderId(), now);

        log.info("[CheckoutTransactionService] 체크아웃 커밋 - checkoutId={}, orderId={}, orderNumber={}",
                checkoutId, order.getOrderId(), order.getOrderNumber());
        return order;
    }

    /**
     * 조회 시점 마감 검사 ("다음 관찰 시 타임아웃" 규칙)
     */
    @Transactional
    public CheckoutAttempt observe(String ownerId, String checkoutId) {
        CheckoutAttempt attempt = checkoutAttemptRepository.findByIdForUpdate(checkoutId)
                .filter(found -> found.isOwnedBy(ownerId))
                .orElseThrow(() -> new CheckoutNotFoundException(checkoutId));
        LocalDateTime now = now();
        if (attempt.isOverdue(now, checkoutSettings.getRecoveryGrace())) {
            expireLocked(attempt, now);
        }
        return attempt;
    }

    /**
     * 복구 작업용: 마감 초과 시 타임아웃 처리
     *
     * @return 타임아웃 처리했는지 여부
     */
    @Transactional
    public boolean expireIfOverdue(String checkoutId) {
        Optional<CheckoutAttempt> locked = checkoutAttemptRepository.findByIdForUpdate(checkoutId);
        if (locked.isEmpty()) {
            return false;
        }
        LocalDateTime now = now();
        if (!locked.get().isOverdue(now, checkoutSettings.getRecoveryGrace())) {
            return false;
        }
        expireLocked(locked.get(), now);
        return true;
    }

    private void expireLocked(CheckoutAttempt attempt, LocalDateTime now) {
        attempt.reject(RejectionReason.TIMEOUT, now);
        int released = inventoryLedger.releaseAll(attempt.getCheckoutId());
        log.warn("[CheckoutTransactionService] 체크아웃 타임아웃 - checkoutId={}, deadline={}, 해제 예약={}",
                attempt.getCheckoutId(), attempt.getDeadline(), released);
    }

    private void releaseFinishedRound(CheckoutAttempt attempt, int attemptNumber) {
        int released = inventoryLedger.releaseAll(attempt.getCheckoutId(), attemptNumber);
        if (released > 0) {
            log.warn("[CheckoutTransactionService] 종료된 회차가 잡은 예약 해제 - checkoutId={}, attemptNumber={}, 해제 예약={}",
                    attempt.getCheckoutId(), attemptNumber, released);
        }
    }

    private void requireItems(String ownerId, CartSnapshot snapshot) {
        if (snapshot.isEmpty()) {
            throw new EmptyCartException(ownerId);
        }
    }

    private CheckoutAttempt lock(String checkoutId) {
        return checkoutAttemptRepository.findByIdForUpdate(checkoutId)
                .orElseThrow(() -> new CheckoutNotFoundException(checkoutId));
    }

    private LocalDateTime deadlineFrom(LocalDateTime now) {
        return now.plus(checkoutSettings.getTimeout());
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
