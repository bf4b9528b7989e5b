package com.hhplus.storefront.application.inventory;

import com.hhplus.storefront.application.alert.AlertService;
import com.hhplus.storefront.domain.inventory.InsufficientStockException;
import com.hhplus.storefront.domain.inventory.ProductStock;
import com.hhplus.storefront.domain.inventory.ProductStockRepository;
import com.hhplus.storefront.domain.inventory.StockNotFoundException;
import com.hhplus.storefront.domain.inventory.StockReservation;
import com.hhplus.storefront.domain.inventory.StockReservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * InventoryLedger - 재고 원장 (Application 계층)
 *
 * 역할:
 * - 상품별 available/reserved 카운터의 원자적 예약, 해제, 확정
 * - 예약 행(StockReservation) 기록과 만료 처리
 *
 * 동시성 제어:
 * - 모든 변경은 재고 행 비관적 락(SELECT ... FOR UPDATE) 안에서 수행
 * - 한 체크아웃의 여러 재고 행은 상품 ID 오름차순으로 잠근다 (교착 방지)
 * - 락 획득 실패는 제한된 지수 백오프로 재시도
 *
 * 멱등성:
 * - release/commit 은 이미 처리된 예약에 대해 아무것도 하지 않는다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryLedger {

    private final ProductStockRepository productStockRepository;
    private final StockReservationRepository stockReservationRepository;
    private final AlertService alertService;
    private final Clock clock;

    /**
     * 재고 예약
     *
     * 처리:
     * 1. 재고 행 잠금
     * 2. available >= quantity 확인
     * 3. available → reserved 이동, HELD 예약 기록
     *
     * @throws InsufficientStockException 판매 가능 수량 부족 (재고 행이 없으면 0으로 간주)
     */
    @Transactional
    @Retryable(
        retryFor = PessimisticLockingFailureException.class,
        maxAttempts = 3,
        backoff = @Backoff(delay = 50, multiplier = 2, maxDelay = 1000, random = true)
    )
    public StockReservation reserve(String checkoutId, int attemptNumber, Long productId, int quantity,
                                    LocalDateTime expiresAt) {
        LocalDateTime now = LocalDateTime.now(clock);
        ProductStock stock = productStockRepository.findByProductIdForUpdate(productId)
                .orElseThrow(() -> new InsufficientStockException(productId, quantity, 0));

        stock.reserve(quantity, now);
        StockReservation reservation = stockReservationRepository.save(
                StockReservation.hold(checkoutId, attemptNumber, productId, quantity, expiresAt, now));

        log.debug("[InventoryLedger] 예약 완료 - checkoutId={}, productId={}, quantity={}, available={}, reserved={}",
                checkoutId, productId, quantity, stock.getAvailableQuantity(), stock.getReservedQuantity());
        return reservation;
    }

    /**
     * 단일 예약 해제 (HELD 가 아니면 무시)
     */
    @Transactional
    public void release(Long reservationId) {
        stockReservationRepository.findByIdForUpdate(reservationId)
                .filter(StockReservation::isHeld)
                .ifPresent(reservation -> releaseHeld(reservation, LocalDateTime.now(clock), false));
    }

    /**
     * 단일 예약 확정 (이미 COMMITTED 면 무시)
     */
    @Transactional
    public void commit(Long reservationId) {
        stockReservationRepository.findByIdForUpdate(reservationId)
                .ifPresent(reservation -> commitLocked(reservation, LocalDateTime.now(clock)));
    }

    /**
     * 체크아웃의 HELD 예약을 모두 해제
     *
     * @return 해제한 예약 수
     */
    @Transactional
    public int releaseAll(String checkoutId) {
        LocalDateTime now = LocalDateTime.now(clock);
        int released = 0;
        for (StockReservation reservation : stockReservationRepository.findByCheckoutIdForUpdate(checkoutId)) {
            if (reservation.isHeld()) {
                releaseHeld(reservation, now, false);
                released++;
            }
        }
        if (released > 0) {
            log.info("[InventoryLedger] 체크아웃 예약 해제 - checkoutId={}, count={}", checkoutId, released);
        }
        return released;
    }

    /**
     * 체크아웃 한 회차의 HELD 예약만 해제
     * 재시작된 체크아웃에서 이전 회차 구동이 뒤늦게 잡은 예약을 정리할 때 사용한다.
     *
     * @return 해제한 예약 수
     */
    @Transactional
    public int releaseAll(String checkoutId, int attemptNumber) {
        LocalDateTime now = LocalDateTime.now(clock);
        int released = 0;
        for (StockReservation reservation : stockReservationRepository.findByCheckoutIdForUpdate(checkoutId)) {
            if (reservation.getAttemptNumber() == attemptNumber && reservation.isHeld()) {
                releaseHeld(reservation, now, false);
                released++;
            }
        }
        if (released > 0) {
            log.info("[InventoryLedger] 체크아웃 회차 예약 해제 - checkoutId={}, attemptNumber={}, count={}",
                    checkoutId, attemptNumber, released);
        }
        return released;
    }

    /**
     * 체크아웃 회차(attemptNumber)의 예약을 모두 확정
     * 예약이 만료/해제되었다면 판매 가능 재고에서 직접 재획득을 시도한다.
     *
     * @throws InsufficientStockException 재획득 불가 (알림 발송 후 전파)
     */
    @Transactional
    public void commitAll(String checkoutId, int attemptNumber) {
        LocalDateTime now = LocalDateTime.now(clock);
        for (StockReservation reservation : stockReservationRepository.findByCheckoutIdForUpdate(checkoutId)) {
            if (reservation.getAttemptNumber() == attemptNumber) {
                commitLocked(reservation, now);
            }
        }
    }

    /**
     * 만료된 단일 예약 해제 (스윕 작업에서 예약 하나당 트랜잭션 하나로 호출)
     *
     * @param retainedCheckoutIds 결제 승인 후 커밋 대기 중이라 해제하면 안 되는 체크아웃
     * @return 실제로 만료 처리했는지 여부
     */
    @Transactional
    public boolean expireReservation(Long reservationId, Set<String> retainedCheckoutIds) {
        LocalDateTime now = LocalDateTime.now(clock);
        return stockReservationRepository.findByIdForUpdate(reservationId)
                .filter(reservation -> reservation.isExpiredAt(now))
                .filter(reservation -> !retainedCheckoutIds.contains(reservation.getCheckoutId()))
                .map(reservation -> {
                    releaseHeld(reservation, now, true);
                    return true;
                })
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public ProductStock getStock(Long productId) {
        return productStockRepository.findByProductId(productId)
                .orElseThrow(() -> new StockNotFoundException(productId));
    }

    @Transactional(readOnly = true)
    public List<StockReservation> getReservations(String checkoutId) {
        return stockReservationRepository.findByCheckoutId(checkoutId);
    }

    /**
     * 입고 (재고 행이 없으면 생성)
     */
    @Transactional
    public ProductStock restock(Long productId, int quantity) {
        LocalDateTime now = LocalDateTime.now(clock);
        ProductStock stock = productStockRepository.findByProductIdForUpdate(productId)
                .orElse(null);
        if (stock == null) {
            return productStockRepository.save(ProductStock.create(productId, quantity, now));
        }
        stock.restock(quantity, now);
        return stock;
    }

    private void releaseHeld(StockReservation reservation, LocalDateTime now, boolean expired) {
        ProductStock stock = lockStock(reservation.getProductId());
        stock.release(reservation.getQuantity(), now);
        if (expired) {
            reservation.markExpired(now);
            log.info("[InventoryLedger] 만료 예약 해제 - reservationId={}, checkoutId={}, productId={}, quantity={}",
                    reservation.getReservationId(), reservation.getCheckoutId(),
                    reservation.getProductId(), reservation.getQuantity());
        } else {
            reservation.markReleased(now);
        }
    }

    private void commitLocked(StockReservation reservation, LocalDateTime now) {
        switch (reservation.getStatus()) {
            case COMMITTED:
                return;
            case HELD:
                lockStock(reservation.getProductId()).commitReserved(reservation.getQuantity(), now);
                reservation.markCommitted(now);
                return;
            default:
                reacquire(reservation, now);
        }
    }

    private void reacquire(StockReservation reservation, LocalDateTime now) {
        ProductStock stock = lockStock(reservation.getProductId());
        try {
            stock.consumeAvailable(reservation.getQuantity(), now);
        } catch (InsufficientStockException e) {
            alertService.notifyReservationReacquireFailure(reservation.getCheckoutId(),
                    reservation.getProductId(), reservation.getQuantity(), stock.getAvailableQuantity());
            throw e;
        }
        reservation.markReacquiredAndCommitted(now);
        log.warn("[InventoryLedger] 만료된 예약을 판매 가능 재고에서 재획득 - reservationId={}, checkoutId={}, productId={}",
                reservation.getReservationId(), reservation.getCheckoutId(), reservation.getProductId());
    }

    private ProductStock lockStock(Long productId) {
        return productStockRepository.findByProductIdForUpdate(productId)
                .orElseThrow(() -> new StockNotFoundException(productId));
    }
}
