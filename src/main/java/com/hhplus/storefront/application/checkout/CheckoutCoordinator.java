package com.hhplus.storefront.application.checkout;

import com.hhplus.storefront.application.alert.AlertService;
import com.hhplus.storefront.application.cart.CartService;
import com.hhplus.storefront.application.checkout.dto.BeginResult;
import com.hhplus.storefront.application.checkout.dto.CheckoutResult;
import com.hhplus.storefront.application.inventory.InventoryLedger;
import com.hhplus.storefront.application.order.OrderLedger;
import com.hhplus.storefront.domain.cart.CartConstants;
import com.hhplus.storefront.domain.cart.CartLine;
import com.hhplus.storefront.domain.cart.CartSnapshot;
import com.hhplus.storefront.domain.cart.EmptyCartException;
import com.hhplus.storefront.domain.cart.InvalidQuantityException;
import com.hhplus.storefront.domain.catalog.ProductAvailability;
import com.hhplus.storefront.domain.catalog.ProductCatalog;
import com.hhplus.storefront.domain.catalog.ProductUnavailableException;
import com.hhplus.storefront.domain.checkout.CheckoutAttempt;
import com.hhplus.storefront.domain.checkout.CheckoutCommitPendingException;
import com.hhplus.storefront.domain.checkout.CheckoutState;
import com.hhplus.storefront.domain.checkout.IdempotencyKeyConflictException;
import com.hhplus.storefront.domain.checkout.PriceChangedException;
import com.hhplus.storefront.domain.checkout.RejectionReason;
import com.hhplus.storefront.domain.inventory.InsufficientStockException;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.payment.PaymentDeclinedException;
import com.hhplus.storefront.domain.payment.PaymentDetails;
import com.hhplus.storefront.domain.payment.PaymentFailedException;
import com.hhplus.storefront.domain.payment.PaymentGateway;
import com.hhplus.storefront.domain.payment.PaymentOutcome;
import com.hhplus.storefront.domain.payment.PaymentRequest;
import com.hhplus.storefront.domain.payment.PaymentResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * CheckoutCoordinator - 장바구니 → 주문 체크아웃 조정자 (Application 계층)
 *
 * 역할:
 * - 체크아웃 상태 머신을 순서대로 구동
 *   INITIATED → VALIDATED → RESERVED → PAYMENT_PENDING → COMMITTED (실패 시 REJECTED)
 * - 멱등성 키 기준으로 재요청을 재생(replay)하거나 커밋만 재개
 *
 * 트랜잭션 경계:
 * - 이 클래스는 트랜잭션을 열지 않는다
 * - 각 상태 전이는 CheckoutTransactionService 의 짧은 트랜잭션으로 실행
 * - 결제 호출은 어떤 트랜잭션/락도 잡지 않은 상태에서 수행
 *
 * 실패 처리:
 * - 검증 실패: 부수효과 없이 REJECTED
 * - 재고 부족: 잡은 예약을 모두 해제한 뒤 REJECTED
 * - 결제 거절/오류: 예약 해제 후 REJECTED (같은 키로 재시도 가능)
 * - 결제 승인 후 커밋 실패: 승인 기록을 남기고 알림, 복구 작업이 커밋을 재실행
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutCoordinator {

    private static final int MAX_BEGIN_TRIES = 3;

    private final CheckoutTransactionService checkoutTransactionService;
    private final CartService cartService;
    private final ProductCatalog productCatalog;
    private final InventoryLedger inventoryLedger;
    private final PaymentGateway paymentGateway;
    private final OrderLedger orderLedger;
    private final AlertService alertService;
    private final CheckoutSettings checkoutSettings;
    private final Clock clock;

    /**
     * 체크아웃 실행
     *
     * @param ownerId 장바구니 소유자
     * @param idempotencyKey 클라이언트 멱등성 키 (null 이면 cart:{ownerId}:v{version} 로 유도)
     * @param paymentDetails 결제 수단
     * @return 생성되었거나 재생된 주문
     */
    public CheckoutResult checkout(String ownerId, String idempotencyKey, PaymentDetails paymentDetails) {
        log.info("[CheckoutCoordinator] 체크아웃 요청 - ownerId={}, key={}", ownerId, idempotencyKey);

        // ========== Step 0: 클라이언트 키로 이미 만들어진 주문이면 바로 재생 ==========
        if (idempotencyKey != null) {
            Optional<Order> existing = orderLedger.findByIdempotencyKey(idempotencyKey);
            if (existing.isPresent()) {
                Order order = existing.get();
                if (!order.isOwnedBy(ownerId)) {
                    throw new IdempotencyKeyConflictException(idempotencyKey);
                }
                log.info("[CheckoutCoordinator] 기존 주문 재생 - key={}, orderId={}", idempotencyKey, order.getOrderId());
                return CheckoutResult.replayed(order.getCheckoutId(), order);
            }
        }

        // ========== Step 1: 장바구니 스냅샷 + 키 결정 ==========
        CartSnapshot snapshot = cartService.snapshot(ownerId);
        String key = idempotencyKey;
        if (key == null) {
            if (snapshot.isEmpty()) {
                throw new EmptyCartException(ownerId);
            }
            key = String.format(CartConstants.DERIVED_IDEMPOTENCY_KEY_FORMAT, ownerId, snapshot.getVersion());
        }

        // ========== Step 2: 체크아웃 시도 시작/재개 ==========
        BeginResult begin = beginWithRaceRetry(ownerId, key, snapshot);
        CheckoutAttempt attempt = begin.getAttempt();
        switch (begin.getAction()) {
            case REPLAY:
                return CheckoutResult.replayed(attempt.getCheckoutId(), orderLedger.get(attempt.getOrderId()));
            case RESUME_COMMIT:
                return CheckoutResult.created(attempt.getCheckoutId(), commitApproved(attempt));
            default:
                return run(attempt, paymentDetails);
        }
    }

    /**
     * 체크아웃 시도 조회 (마감이 지났으면 조회 시점에 타임아웃 처리)
     */
    public CheckoutAttempt getAttempt(String ownerId, String checkoutId) {
        return checkoutTransactionService.observe(ownerId, checkoutId);
    }

    /**
     * 한 회차 구동
     * 모든 상태 전이에 회차 번호를 넘겨, 타임아웃 후 재시작된 시도에 이전 회차의 결과가 섞이지 않게 한다.
     */
    private CheckoutResult run(CheckoutAttempt attempt, PaymentDetails paymentDetails) {
        String checkoutId = attempt.getCheckoutId();
        int round = attempt.getAttemptNumber();

        // ========== Step 3: 검증 (판매 여부, 수량, 가격) ==========
        validate(attempt);
        checkoutTransactionService.advance(checkoutId, round, CheckoutState.VALIDATED);

        // ========== Step 4: 재고 예약 (상품 ID 오름차순) ==========
        reserveAll(attempt);
        checkoutTransactionService.advance(checkoutId, round, CheckoutState.RESERVED);

        // ========== Step 5: 결제 (트랜잭션 밖) ==========
        checkoutTransactionService.advance(checkoutId, round, CheckoutState.PAYMENT_PENDING);
        PaymentResult result = charge(attempt, paymentDetails);
        CheckoutAttempt recorded = checkoutTransactionService.recordPaymentOutcome(
                checkoutId, round, attempt.getTotalAmount(), result);

        if (result.getOutcome() == PaymentOutcome.DECLINED) {
            reject(attempt, RejectionReason.PAYMENT_DECLINED);
            throw new PaymentDeclinedException(checkoutId, result.getMessage());
        }
        if (result.getOutcome() == PaymentOutcome.ERROR) {
            reject(attempt, RejectionReason.PAYMENT_ERROR);
            throw new PaymentFailedException(checkoutId, result.getMessage());
        }

        // ========== Step 6: 커밋 ==========
        return CheckoutResult.created(checkoutId, commitApproved(recorded));
    }

    private void validate(CheckoutAttempt attempt) {
        int maxQuantity = checkoutSettings.getMaxQuantityPerLine();
        for (CartLine line : attempt.getLines()) {
            ProductAvailability availability = productCatalog.getProduct(line.getProductId());
            if (!availability.isPurchasable()) {
                reject(attempt, RejectionReason.PRODUCT_UNAVAILABLE);
                throw new ProductUnavailableException(line.getProductId());
            }
            if (line.getQuantity() < CartConstants.MIN_CART_QUANTITY || line.getQuantity() > maxQuantity) {
                reject(attempt, RejectionReason.INVALID_QUANTITY);
                throw new InvalidQuantityException(line.getQuantity(), maxQuantity);
            }
            long currentPrice = productCatalog.getCurrentPrice(line.getProductId());
            if (currentPrice != line.getUnitPrice()) {
                reject(attempt, RejectionReason.PRICE_CHANGED);
                throw new PriceChangedException(line.getProductId(), line.getUnitPrice(), currentPrice);
            }
        }
    }

    private void reserveAll(CheckoutAttempt attempt) {
        LocalDateTime expiresAt = LocalDateTime.now(clock).plus(checkoutSettings.getReservationTtl());
        List<CartLine> ordered = attempt.getLines().stream()
                .sorted(Comparator.comparing(CartLine::getProductId))
                .collect(Collectors.toList());
        try {
            for (CartLine line : ordered) {
                inventoryLedger.reserve(attempt.getCheckoutId(), attempt.getAttemptNumber(),
                        line.getProductId(), line.getQuantity(), expiresAt);
            }
        } catch (InsufficientStockException e) {
            log.warn("[CheckoutCoordinator] 재고 부족 - checkoutId={}, error={}",
                    attempt.getCheckoutId(), e.getMessage());
            reject(attempt, RejectionReason.INSUFFICIENT_STOCK);
            throw e;
        } catch (RuntimeException e) {
            log.error("[CheckoutCoordinator] 재고 예약 처리 실패 - checkoutId={}, error={}",
                    attempt.getCheckoutId(), e.getMessage());
            reject(attempt, RejectionReason.RESERVATION_FAILED);
            throw e;
        }
    }

    private PaymentResult charge(CheckoutAttempt attempt, PaymentDetails paymentDetails) {
        PaymentRequest request = PaymentRequest.builder()
                .checkoutId(attempt.getCheckoutId())
                .ownerId(attempt.getOwnerId())
                .amount(attempt.getTotalAmount())
                .paymentDetails(paymentDetails)
                .build();
        try {
            return paymentGateway.charge(request);
        } catch (RuntimeException e) {
            log.warn("[CheckoutCoordinator] 결제 게이트웨이 예외 - checkoutId={}, error={}",
                    attempt.getCheckoutId(), e.getMessage());
            return PaymentResult.error(e.getMessage());
        }
    }

    /**
     * 결제 승인된 시도의 커밋
     * 실패해도 승인 기록은 남아 있으므로 복구 작업/같은 키 재요청이 커밋만 다시 실행한다.
     */
    private Order commitApproved(CheckoutAttempt attempt) {
        try {
            return checkoutTransactionService.commit(attempt.getCheckoutId());
        } catch (RuntimeException e) {
            alertService.notifyCommitFailure(attempt.getCheckoutId(), attempt.getOwnerId(), e.getMessage());
            throw new CheckoutCommitPendingException(attempt.getCheckoutId(), e);
        }
    }

    /**
     * 같은 키의 동시 시작 경쟁 처리
     *
     * - 유니크 제약 위반: 먼저 커밋한 쪽의 시도가 있으므로 다시 읽으면 재생/진행 중으로 처리된다
     * - 락 실패(MySQL 갭 락 교착 등): 진 쪽 트랜잭션은 롤백되었으므로 다시 시작한다
     */
    private BeginResult beginWithRaceRetry(String ownerId, String key, CartSnapshot snapshot) {
        for (int tryCount = 1; ; tryCount++) {
            try {
                return checkoutTransactionService.begin(ownerId, key, snapshot);
            } catch (DataIntegrityViolationException | PessimisticLockingFailureException e) {
                if (tryCount >= MAX_BEGIN_TRIES) {
                    throw e;
                }
                log.info("[CheckoutCoordinator] 멱등성 키 동시 시작 감지, 재시도 - key={}, try={}, error={}",
                        key, tryCount, e.getClass().getSimpleName());
            }
        }
    }

    private void reject(CheckoutAttempt attempt, RejectionReason reason) {
        checkoutTransactionService.rejectAndRelease(attempt.getCheckoutId(), attempt.getAttemptNumber(), reason);
    }
}
