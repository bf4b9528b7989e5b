package com.hhplus.storefront.domain.checkout;

import com.hhplus.storefront.domain.cart.CartLine;
import com.hhplus.storefront.domain.cart.CartSnapshot;
import com.hhplus.storefront.domain.payment.PaymentOutcome;
import com.hhplus.storefront.domain.payment.PaymentResult;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * CheckoutAttempt 도메인 엔티티 (체크아웃 상태 머신)
 *
 * 책임:
 * - 멱등성 키 하나에 대응하는 논리적 체크아웃 한 건의 진행 상태 기록
 * - 시작 시점의 장바구니 스냅샷과 결제 결과 보관
 * - 종료 상태 이후에도 유지되어 같은 키의 재요청을 같은 주문으로 응답
 *
 * 핵심 비즈니스 규칙:
 * - 상태는 정해진 순서로만 전진한다
 * - 결제 승인이 기록된 시도는 거절/타임아웃 처리하지 않는다 (커밋만 재실행)
 * - REJECTED 시도는 부수효과가 남지 않으므로 같은 키로 재시작할 수 있다 (attemptNumber 증가)
 */
@Entity
@Table(name = "checkout_attempts", uniqueConstraints = {
    @UniqueConstraint(name = "uk_checkout_idempotency_key", columnNames = "idempotency_key")
}, indexes = {
    @Index(name = "idx_checkout_state_deadline", columnList = "state, deadline")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutAttempt {
    @Id
    @Column(name = "checkout_id", length = 64)
    private String checkoutId;

    @Column(name = "idempotency_key", nullable = false, length = 200)
    private String idempotencyKey;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @Column(name = "cart_version", nullable = false)
    private long cartVersion;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "checkout_attempt_lines", joinColumns = @JoinColumn(name = "checkout_id"))
    @OrderColumn(name = "line_order")
    @Builder.Default
    private List<CartLine> lines = new ArrayList<>();

    @Column(name = "total_amount", nullable = false)
    private long totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private CheckoutState state;

    @Enumerated(EnumType.STRING)
    @Column(name = "rejection_reason", length = 30)
    private RejectionReason rejectionReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_outcome", length = 20)
    private PaymentOutcome paymentOutcome;

    @Column(name = "payment_reference", length = 100)
    private String paymentReference;

    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @Column(name = "deadline", nullable = false)
    private LocalDateTime deadline;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 새 체크아웃 시도 생성 (INITIATED)
     */
    public static CheckoutAttempt initiate(String idempotencyKey, CartSnapshot snapshot,
                                           LocalDateTime deadline, LocalDateTime now) {
        CheckoutAttempt attempt = CheckoutAttempt.builder()
                .checkoutId(UUID.randomUUID().toString())
                .idempotencyKey(idempotencyKey)
                .ownerId(snapshot.getOwnerId())
                .state(CheckoutState.INITIATED)
                .attemptNumber(1)
                .createdAt(now)
                .build();
        attempt.applySnapshot(snapshot, deadline, now);
        return attempt;
    }

    /**
     * 거절된 시도를 같은 키로 다시 시작
     * 이전 회차의 예약은 이미 해제되어 있어야 한다.
     */
    public void restart(CartSnapshot snapshot, LocalDateTime deadline, LocalDateTime now) {
        if (state != CheckoutState.REJECTED) {
            throw new IllegalStateException("거절된 체크아웃만 재시작할 수 있습니다: " + state);
        }
        this.state = CheckoutState.INITIATED;
        this.rejectionReason = null;
        this.paymentOutcome = null;
        this.paymentReference = null;
        this.attemptNumber += 1;
        applySnapshot(snapshot, deadline, now);
    }

    public void markValidated(LocalDateTime now) {
        advance(CheckoutState.INITIATED, CheckoutState.VALIDATED, now);
    }

    public void markReserved(LocalDateTime now) {
        advance(CheckoutState.VALIDATED, CheckoutState.RESERVED, now);
    }

    public void markPaymentPending(LocalDateTime now) {
        advance(CheckoutState.RESERVED, CheckoutState.PAYMENT_PENDING, now);
    }

    /**
     * 결제 결과 기록 (PAYMENT_PENDING 에서만)
     */
    public void recordPayment(PaymentResult result, LocalDateTime now) {
        requireState(CheckoutState.PAYMENT_PENDING);
        this.paymentOutcome = result.getOutcome();
        this.paymentReference = result.getReference();
        this.updatedAt = now;
    }

    public void markCommitted(Long orderId, LocalDateTime now) {
        if (!isAwaitingCommit()) {
            throw new IllegalStateException(String.format(
                    "결제 승인 전에는 커밋할 수 없습니다 (checkoutId=%s, state=%s, payment=%s)",
                    checkoutId, state, paymentOutcome));
        }
        this.state = CheckoutState.COMMITTED;
        this.orderId = orderId;
        this.updatedAt = now;
    }

    public void reject(RejectionReason reason, LocalDateTime now) {
        if (state.isTerminal()) {
            throw new IllegalStateException(String.format(
                    "종료된 체크아웃은 거절할 수 없습니다 (checkoutId=%s, state=%s)", checkoutId, state));
        }
        if (isAwaitingCommit()) {
            throw new IllegalStateException("결제 승인된 체크아웃은 거절할 수 없습니다: " + checkoutId);
        }
        this.state = CheckoutState.REJECTED;
        this.rejectionReason = reason;
        this.updatedAt = now;
    }

    /**
     * 호출자가 구동 중인 회차가 현재 회차인지
     * 타임아웃 후 같은 키로 재시작되면 이전 회차의 응답은 현재 회차에 반영하지 않는다.
     */
    public boolean isRound(int attemptNumber) {
        return this.attemptNumber == attemptNumber;
    }

    public boolean isCommitted() {
        return state == CheckoutState.COMMITTED;
    }

    public boolean isRejected() {
        return state == CheckoutState.REJECTED;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * 결제가 승인되었고 커밋만 남은 상태
     */
    public boolean isAwaitingCommit() {
        return state == CheckoutState.PAYMENT_PENDING && paymentOutcome == PaymentOutcome.APPROVED;
    }

    /**
     * 제한 시간 초과 여부
     * 결제 응답 대기 중인 시도는 paymentGrace 만큼 더 기다린다.
     */
    public boolean isOverdue(LocalDateTime now, Duration paymentGrace) {
        if (isTerminal() || isAwaitingCommit()) {
            return false;
        }
        LocalDateTime limit = state == CheckoutState.PAYMENT_PENDING ? deadline.plus(paymentGrace) : deadline;
        return now.isAfter(limit);
    }

    public boolean isOwnedBy(String candidateOwnerId) {
        return ownerId.equals(candidateOwnerId);
    }

    public CartSnapshot snapshot() {
        return new CartSnapshot(ownerId, cartVersion, lines);
    }

    private void applySnapshot(CartSnapshot snapshot, LocalDateTime deadline, LocalDateTime now) {
        this.cartVersion = snapshot.getVersion();
        this.lines.clear();
        this.lines.addAll(snapshot.getLines());
        this.totalAmount = snapshot.totalAmount();
        this.deadline = deadline;
        this.updatedAt = now;
    }

    private void advance(CheckoutState from, CheckoutState to, LocalDateTime now) {
        requireState(from);
        this.state = to;
        this.updatedAt = now;
    }

    private void requireState(CheckoutState expected) {
        if (state != expected) {
            throw new IllegalStateException(String.format(
                    "체크아웃 상태 전이 오류 (checkoutId=%s, 기대=%s, 현재=%s)", checkoutId, expected, state));
        }
    }
}
