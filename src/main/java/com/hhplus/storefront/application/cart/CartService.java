package com.hhplus.storefront.application.cart;

import com.hhplus.storefront.application.checkout.CheckoutSettings;
import com.hhplus.storefront.domain.cart.Cart;
import com.hhplus.storefront.domain.cart.CartItemNotFoundException;
import com.hhplus.storefront.domain.cart.CartRepository;
import com.hhplus.storefront.domain.cart.CartSnapshot;
import com.hhplus.storefront.domain.cart.CartVersionConflictException;
import com.hhplus.storefront.domain.catalog.ProductAvailability;
import com.hhplus.storefront.domain.catalog.ProductCatalog;
import com.hhplus.storefront.domain.catalog.ProductNotFoundException;
import com.hhplus.storefront.domain.catalog.ProductUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * CartService - 장바구니 저장소 (Application 계층)
 *
 * 역할:
 * - 소유자별 장바구니 라인 추가/수정/삭제/비우기/병합
 * - 체크아웃용 불변 스냅샷 제공
 * - 커밋 단계에서 구매분 정리
 *
 * 동시성 제어:
 * - 모든 변경은 장바구니 행 잠금 안에서 기대 버전(expectedVersion)을 비교한 뒤 수행
 * - 버전이 다르면 CartVersionConflictException (장바구니는 변경되지 않음)
 *
 * 아키텍처:
 * - Domain 계층의 CartRepository, ProductCatalog 포트에만 의존
 */
@Slf4j
@Service
public class CartService {

    private final CartRepository cartRepository;
    private final CartProvisioner cartProvisioner;
    private final ProductCatalog productCatalog;
    private final CheckoutSettings checkoutSettings;
    private final Clock clock;

    public CartService(CartRepository cartRepository,
                       CartProvisioner cartProvisioner,
                       ProductCatalog productCatalog,
                       CheckoutSettings checkoutSettings,
                       Clock clock) {
        this.cartRepository = cartRepository;
        this.cartProvisioner = cartProvisioner;
        this.productCatalog = productCatalog;
        this.checkoutSettings = checkoutSettings;
        this.clock = clock;
    }

    /**
     * 장바구니 조회 (없으면 버전 0 의 빈 장바구니)
     */
    @Transactional(readOnly = true)
    public CartSnapshot getCart(String ownerId) {
        return cartRepository.findByOwnerId(ownerId)
                .map(Cart::snapshot)
                .orElseGet(() -> CartSnapshot.empty(ownerId));
    }

    /**
     * 체크아웃 시작 시점의 불변 스냅샷
     */
    @Transactional(readOnly = true)
    public CartSnapshot snapshot(String ownerId) {
        return getCart(ownerId);
    }

    /**
     * 상품 추가
     *
     * 비즈니스 규칙:
     * - 상품이 존재하고 판매 중이어야 함
     * - 단가는 현재 카탈로그 가격으로 스냅샷
     * - 같은 상품은 수량 누적 (replaceQuantity=true 면 덮어쓰기)
     */
    @Transactional
    public CartSnapshot addItem(String ownerId, Long productId, int quantity, Long expectedVersion,
                                boolean replaceQuantity) {
        requirePurchasable(productId);
        long unitPrice = productCatalog.getCurrentPrice(productId);

        Cart cart = lockOrCreate(ownerId);
        cart.verifyVersion(expectedVersion);
        cart.addItem(productId, quantity, unitPrice, replaceQuantity, checkoutSettings.getMaxQuantityPerLine(), now());

        log.debug("[CartService] 상품 추가 - ownerId={}, productId={}, quantity={}, version={}",
                ownerId, productId, quantity, cart.getVersion());
        return cart.snapshot();
    }

    /**
     * 수량 변경 / 삭제 / 비우기는 장바구니가 없으면 새로 만들지 않는다.
     */
    @Transactional
    public CartSnapshot updateQuantity(String ownerId, Long productId, int quantity, Long expectedVersion) {
        Optional<Cart> locked = lockExisting(ownerId);
        if (locked.isEmpty()) {
            verifyAbsentCartVersion(ownerId, expectedVersion);
            throw new CartItemNotFoundException(ownerId, productId);
        }
        Cart cart = locked.get();
        cart.verifyVersion(expectedVersion);
        cart.updateQuantity(productId, quantity, checkoutSettings.getMaxQuantityPerLine(), now());
        return cart.snapshot();
    }

    @Transactional
    public CartSnapshot removeItem(String ownerId, Long productId, Long expectedVersion) {
        Optional<Cart> locked = lockExisting(ownerId);
        if (locked.isEmpty()) {
            verifyAbsentCartVersion(ownerId, expectedVersion);
            throw new CartItemNotFoundException(ownerId, productId);
        }
        Cart cart = locked.get();
        cart.verifyVersion(expectedVersion);
        cart.removeItem(productId, now());
        return cart.snapshot();
    }

    /**
     * 장바구니 비우기 (기대 버전이 일치할 때만)
     */
    @Transactional
    public CartSnapshot clear(String ownerId, Long expectedVersion) {
        Optional<Cart> locked = lockExisting(ownerId);
        if (locked.isEmpty()) {
            verifyAbsentCartVersion(ownerId, expectedVersion);
            return CartSnapshot.empty(ownerId);
        }
        Cart cart = locked.get();
        cart.verifyVersion(expectedVersion);
        cart.clear(now());
        return cart.snapshot();
    }

    /**
     * 비회원 세션 장바구니를 소유자 장바구니로 병합하고 세션 장바구니는 비운다
     * 두 장바구니는 소유자 ID 오름차순으로 잠근다.
     */
    @Transactional
    public CartSnapshot merge(String ownerId, String sessionOwnerId) {
        if (sessionOwnerId == null || sessionOwnerId.isBlank() || ownerId.equals(sessionOwnerId)) {
            throw new IllegalArgumentException("병합할 세션 장바구니 ID가 올바르지 않습니다: " + sessionOwnerId);
        }

        ensureCart(ownerId);
        Cart target;
        Optional<Cart> session;
        if (ownerId.compareTo(sessionOwnerId) < 0) {
            target = lockRequired(ownerId);
            session = lockExisting(sessionOwnerId);
        } else {
            session = lockExisting(sessionOwnerId);
            target = lockRequired(ownerId);
        }

        if (session.isEmpty() || session.get().isEmpty()) {
            return target.snapshot();
        }

        LocalDateTime now = now();
        target.mergeFrom(session.get(), checkoutSettings.getMaxQuantityPerLine(), now);
        session.get().clear(now);

        log.info("[CartService] 장바구니 병합 - ownerId={}, sessionId={}, version={}",
                ownerId, sessionOwnerId, target.getVersion());
        return target.snapshot();
    }

    /**
     * 커밋 단계의 장바구니 정리 (체크아웃 커밋 트랜잭션에 참여)
     *
     * - 스냅샷 이후 변경이 없으면 비우기
     * - 변경이 있었다면 구매한 수량만 차감하여 사용자의 수정분을 보존
     */
    @Transactional
    public void reduceAfterPurchase(CartSnapshot purchased) {
        Optional<Cart> locked = lockExisting(purchased.getOwnerId());
        if (locked.isEmpty()) {
            return;
        }
        Cart cart = locked.get();
        if (cart.getVersion() == purchased.getVersion()) {
            cart.clear(now());
        } else {
            log.info("[CartService] 체크아웃 중 장바구니 변경 감지, 구매분만 차감 - ownerId={}, 스냅샷 버전={}, 현재 버전={}",
                    cart.getOwnerId(), purchased.getVersion(), cart.getVersion());
            cart.deductPurchased(purchased.getLines(), now());
        }
    }

    private void requirePurchasable(Long productId) {
        ProductAvailability availability = productCatalog.getProduct(productId);
        if (!availability.isExists()) {
            throw new ProductNotFoundException(productId);
        }
        if (!availability.isActive()) {
            throw new ProductUnavailableException(productId);
        }
    }

    /**
     * 장바구니 행을 잠근다 (없으면 먼저 만든다)
     *
     * 없는 소유자 키를 FOR UPDATE 로 조회하면 MySQL(InnoDB) 은 유니크 인덱스에 갭 락을 잡고,
     * 이어지는 REQUIRES_NEW 생성 INSERT 가 그 락을 기다리며 멈춘다.
     * 그래서 생성은 어떤 잠금 조회보다 먼저 수행한다.
     */
    private Cart lockOrCreate(String ownerId) {
        ensureCart(ownerId);
        return lockRequired(ownerId);
    }

    private void ensureCart(String ownerId) {
        if (cartRepository.existsByOwnerId(ownerId)) {
            return;
        }
        try {
            cartProvisioner.createIfAbsent(ownerId);
        } catch (DataIntegrityViolationException e) {
            log.debug("[CartService] 동시 장바구니 생성 경쟁 - 기존 행 사용 (ownerId={})", ownerId);
        }
    }

    private Cart lockRequired(String ownerId) {
        return cartRepository.findByOwnerIdForUpdate(ownerId)
                .orElseThrow(() -> new IllegalStateException("장바구니 생성 후 조회 실패: " + ownerId));
    }

    private Optional<Cart> lockExisting(String ownerId) {
        if (!cartRepository.existsByOwnerId(ownerId)) {
            return Optional.empty();
        }
        return cartRepository.findByOwnerIdForUpdate(ownerId);
    }

    /**
     * 장바구니가 없는 소유자의 현재 버전은 0 으로 본다 (getCart 와 동일)
     */
    private void verifyAbsentCartVersion(String ownerId, Long expectedVersion) {
        if (expectedVersion != null && expectedVersion != 0L) {
            throw new CartVersionConflictException(ownerId, expectedVersion, 0L);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
