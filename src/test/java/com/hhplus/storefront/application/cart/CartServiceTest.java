package com.hhplus.storefront.application.cart;

import com.hhplus.storefront.application.checkout.CheckoutSettings;
import com.hhplus.storefront.domain.cart.Cart;
import com.hhplus.storefront.domain.cart.CartItemNotFoundException;
import com.hhplus.storefront.domain.cart.CartLine;
import com.hhplus.storefront.domain.cart.CartRepository;
import com.hhplus.storefront.domain.cart.CartSnapshot;
import com.hhplus.storefront.domain.cart.CartVersionConflictException;
import com.hhplus.storefront.domain.catalog.ProductAvailability;
import com.hhplus.storefront.domain.catalog.ProductCatalog;
import com.hhplus.storefront.domain.catalog.ProductNotFoundException;
import com.hhplus.storefront.domain.catalog.ProductUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * CartServiceTest - Application 계층 단위 테스트
 *
 * 테스트 대상: CartService
 * - 상품 추가 (카탈로그 검증, 가격 스냅샷, 버전 검증)
 * - 장바구니 최초 생성 경쟁
 * - 병합 / 구매 후 정리
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CartService 단위 테스트")
class CartServiceTest {

    private static final String OWNER = "user-1";
    private static final Long PRODUCT_ID = 10L;

    @Mock
    private CartRepository cartRepository;

    @Mock
    private CartProvisioner cartProvisioner;

    @Mock
    private ProductCatalog productCatalog;

    private final Clock clock = Clock.fixed(Instant.parse("2025-11-07T03:00:00Z"), ZoneId.of("Asia/Seoul"));
    private CartService cartService;

    @BeforeEach
    void setup() {
        CheckoutSettings settings = new CheckoutSettings(
                Duration.ofMinutes(5), Duration.ofMinutes(15), Duration.ofSeconds(30), 100);
        cartService = new CartService(cartRepository, cartProvisioner, productCatalog, settings, clock);
    }

    private Cart existingCart() {
        return Cart.create(OWNER, LocalDateTime.now(clock));
    }

    // ========== 상품 추가 ==========

    @Test
    @DisplayName("상품 추가 - 현재 카탈로그 가격으로 스냅샷")
    void testAddItem_Success() {
        // Given
        Cart cart = existingCart();
        when(productCatalog.getProduct(PRODUCT_ID)).thenReturn(ProductAvailability.of(true));
        when(productCatalog.getCurrentPrice(PRODUCT_ID)).thenReturn(1000L);
        when(cartRepository.existsByOwnerId(OWNER)).thenReturn(true);
        when(cartRepository.findByOwnerIdForUpdate(OWNER)).thenReturn(Optional.of(cart));

        // When
        CartSnapshot result = cartService.addItem(OWNER, PRODUCT_ID, 2, 0L, false);

        // Then
        assertThat(result.getVersion()).isEqualTo(1L);
        assertThat(result.getLines()).containsExactly(new CartLine(PRODUCT_ID, 2, 1000L));
    }

    @Test
    @DisplayName("상품 추가 - 기대 버전이 다르면 409, 장바구니 변경 없음")
    void testAddItem_VersionConflict() {
        // Given
        Cart cart = existingCart();
        cart.addItem(PRODUCT_ID, 1, 1000L, false, 100, LocalDateTime.now(clock));
        when(productCatalog.getProduct(PRODUCT_ID)).thenReturn(ProductAvailability.of(true));
        when(productCatalog.getCurrentPrice(PRODUCT_ID)).thenReturn(1000L);
        when(cartRepository.existsByOwnerId(OWNER)).thenReturn(true);
        when(cartRepository.findByOwnerIdForUpdate(OWNER)).thenReturn(Optional.of(cart));

        // When & Then
        assertThatThrownBy(() -> cartService.addItem(OWNER, PRODUCT_ID, 1, 0L, false))
                .isInstanceOf(CartVersionConflictException.class);
        assertThat(cart.getVersion()).isEqualTo(1L);
        assertThat(cart.totalQuantity()).isEqualTo(1);
    }

    @Test
    @DisplayName("상품 추가 - 없는 상품은 404, 판매 중지 상품은 400")
    void testAddItem_ProductChecks() {
        when(productCatalog.getProduct(1L)).thenReturn(ProductAvailability.missing());
        when(productCatalog.getProduct(2L)).thenReturn(ProductAvailability.of(false));

        assertThatThrownBy(() -> cartService.addItem(OWNER, 1L, 1, null, false))
                .isInstanceOf(ProductNotFoundException.class);
        assertThatThrownBy(() -> cartService.addItem(OWNER, 2L, 1, null, false))
                .isInstanceOf(ProductUnavailableException.class);
        verify(cartRepository, never()).findByOwnerIdForUpdate(anyString());
    }

    @Test
    @DisplayName("새 소유자 - 잠금 조회 전에 장바구니 행을 먼저 만든다")
    void testAddItem_NewOwner_ProvisionsBeforeLocking() {
        // Given
        Cart created = existingCart();
        when(productCatalog.getProduct(PRODUCT_ID)).thenReturn(ProductAvailability.of(true));
        when(productCatalog.getCurrentPrice(PRODUCT_ID)).thenReturn(1000L);
        when(cartRepository.existsByOwnerId(OWNER)).thenReturn(false);
        when(cartRepository.findByOwnerIdForUpdate(OWNER)).thenReturn(Optional.of(created));

        // When
        CartSnapshot result = cartService.addItem(OWNER, PRODUCT_ID, 1, null, false);

        // Then - 없는 키에 대한 잠금 조회(갭 락)는 발생하지 않는다
        InOrder inOrder = inOrder(cartRepository, cartProvisioner);
        inOrder.verify(cartRepository).existsByOwnerId(OWNER);
        inOrder.verify(cartProvisioner).createIfAbsent(OWNER);
        inOrder.verify(cartRepository).findByOwnerIdForUpdate(OWNER);
        verify(cartRepository, times(1)).findByOwnerIdForUpdate(OWNER);
        assertThat(result.getLines()).hasSize(1);
    }

    @Test
    @DisplayName("최초 생성 경쟁 - 다른 요청이 먼저 만들었으면 그 행을 사용")
    void testAddItem_CreationRace() {
        // Given
        Cart createdByOther = existingCart();
        when(productCatalog.getProduct(PRODUCT_ID)).thenReturn(ProductAvailability.of(true));
        when(productCatalog.getCurrentPrice(PRODUCT_ID)).thenReturn(1000L);
        when(cartRepository.existsByOwnerId(OWNER)).thenReturn(false);
        when(cartRepository.findByOwnerIdForUpdate(OWNER)).thenReturn(Optional.of(createdByOther));
        doThrow(new DataIntegrityViolationException("uk_cart_owner")).when(cartProvisioner).createIfAbsent(OWNER);

        // When
        CartSnapshot result = cartService.addItem(OWNER, PRODUCT_ID, 1, null, false);

        // Then
        assertThat(result.getLines()).hasSize(1);
    }

    // ========== 장바구니가 없는 소유자의 변경 ==========

    @Test
    @DisplayName("장바구니 없음 - 수량 변경/삭제는 404, 빈 장바구니 행을 만들지 않는다")
    void testUpdateAndRemove_NoCart() {
        when(cartRepository.existsByOwnerId(OWNER)).thenReturn(false);

        assertThatThrownBy(() -> cartService.updateQuantity(OWNER, PRODUCT_ID, 2, null))
                .isInstanceOf(CartItemNotFoundException.class);
        assertThatThrownBy(() -> cartService.removeItem(OWNER, PRODUCT_ID, 0L))
                .isInstanceOf(CartItemNotFoundException.class);

        verify(cartProvisioner, never()).createIfAbsent(anyString());
        verify(cartRepository, never()).findByOwnerIdForUpdate(anyString());
    }

    @Test
    @DisplayName("장바구니 없음 - 비우기는 버전 0 의 빈 스냅샷, 다른 기대 버전은 409")
    void testClear_NoCart() {
        when(cartRepository.existsByOwnerId(OWNER)).thenReturn(false);

        CartSnapshot cleared = cartService.clear(OWNER, 0L);

        assertThat(cleared.isEmpty()).isTrue();
        assertThat(cleared.getVersion()).isZero();
        assertThatThrownBy(() -> cartService.clear(OWNER, 3L))
                .isInstanceOf(CartVersionConflictException.class);
        verify(cartProvisioner, never()).createIfAbsent(anyString());
    }

    // ========== 조회 ==========

    @Test
    @DisplayName("장바구니가 없으면 버전 0 의 빈 스냅샷")
    void testSnapshot_NoCart() {
        when(cartRepository.findByOwnerId(OWNER)).thenReturn(Optional.empty());

        CartSnapshot snapshot = cartService.snapshot(OWNER);

        assertThat(snapshot.isEmpty()).isTrue();
        assertThat(snapshot.getVersion()).isZero();
    }

    // ========== 구매 후 정리 ==========

    @Test
    @DisplayName("구매 후 정리 - 버전이 같으면 비우기")
    void testReduceAfterPurchase_Clears() {
        Cart cart = existingCart();
        cart.addItem(PRODUCT_ID, 2, 1000L, false, 100, LocalDateTime.now(clock));
        CartSnapshot purchased = cart.snapshot();
        when(cartRepository.existsByOwnerId(OWNER)).thenReturn(true);
        when(cartRepository.findByOwnerIdForUpdate(OWNER)).thenReturn(Optional.of(cart));

        cartService.reduceAfterPurchase(purchased);

        assertThat(cart.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("구매 후 정리 - 체크아웃 중 변경이 있었으면 구매분만 차감")
    void testReduceAfterPurchase_Deducts() {
        Cart cart = existingCart();
        cart.addItem(PRODUCT_ID, 2, 1000L, false, 100, LocalDateTime.now(clock));
        CartSnapshot purchased = cart.snapshot();
        cart.addItem(20L, 1, 300L, false, 100, LocalDateTime.now(clock));
        when(cartRepository.existsByOwnerId(OWNER)).thenReturn(true);
        when(cartRepository.findByOwnerIdForUpdate(OWNER)).thenReturn(Optional.of(cart));

        cartService.reduceAfterPurchase(purchased);

        assertThat(cart.getLines()).containsExactly(new CartLine(20L, 1, 300L));
    }

    // ========== 병합 ==========

    @Test
    @DisplayName("병합 - 세션 장바구니를 합치고 세션 장바구니는 비운다")
    void testMerge() {
        Cart target = existingCart();
        Cart session = Cart.create("anon-1", LocalDateTime.now(clock));
        session.addItem(PRODUCT_ID, 3, 1000L, false, 100, LocalDateTime.now(clock));
        when(cartRepository.existsByOwnerId(OWNER)).thenReturn(true);
        when(cartRepository.existsByOwnerId("anon-1")).thenReturn(true);
        when(cartRepository.findByOwnerIdForUpdate(OWNER)).thenReturn(Optional.of(target));
        when(cartRepository.findByOwnerIdForUpdate("anon-1")).thenReturn(Optional.of(session));

        CartSnapshot merged = cartService.merge(OWNER, "anon-1");

        assertThat(merged.getLines()).containsExactly(new CartLine(PRODUCT_ID, 3, 1000L));
        assertThat(session.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("병합 - 세션 장바구니가 없으면 대상 장바구니만 만들고 세션 키는 잠그지 않는다")
    void testMerge_NoSessionCart() {
        Cart target = existingCart();
        when(cartRepository.existsByOwnerId(OWNER)).thenReturn(false);
        when(cartRepository.existsByOwnerId("anon-2")).thenReturn(false);
        when(cartRepository.findByOwnerIdForUpdate(OWNER)).thenReturn(Optional.of(target));

        CartSnapshot merged = cartService.merge(OWNER, "anon-2");

        assertThat(merged.isEmpty()).isTrue();
        verify(cartProvisioner).createIfAbsent(OWNER);
        verify(cartRepository, never()).findByOwnerIdForUpdate("anon-2");
    }

    @Test
    @DisplayName("병합 - 자기 자신이나 빈 세션 ID 는 400")
    void testMerge_InvalidSession() {
        assertThatThrownBy(() -> cartService.merge(OWNER, OWNER)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cartService.merge(OWNER, " ")).isInstanceOf(IllegalArgumentException.class);
    }
}
