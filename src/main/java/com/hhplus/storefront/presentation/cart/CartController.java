package com.hhplus.storefront.presentation.cart;

import com.hhplus.storefront.application.cart.CartService;
import com.hhplus.storefront.domain.cart.CartSnapshot;
import com.hhplus.storefront.presentation.cart.mapper.CartMapper;
import com.hhplus.storefront.presentation.cart.request.AddCartItemRequest;
import com.hhplus.storefront.presentation.cart.request.MergeCartRequest;
import com.hhplus.storefront.presentation.cart.request.UpdateQuantityRequest;
import com.hhplus.storefront.presentation.cart.response.CartResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * CartController - Presentation 계층
 * 장바구니 API 요청 처리
 *
 * 모든 변경 요청은 expected_version 을 받을 수 있으며, 현재 버전과 다르면 409 로 거절된다.
 */
@RestController
@RequestMapping("/cart")
public class CartController {

    private final CartService cartService;
    private final CartMapper cartMapper;

    public CartController(CartService cartService, CartMapper cartMapper) {
        this.cartService = cartService;
        this.cartMapper = cartMapper;
    }

    /**
     * GET /cart - 장바구니 조회
     */
    @GetMapping
    public ResponseEntity<CartResponse> getCart(@RequestHeader("X-USER-ID") String ownerId) {
        return ResponseEntity.ok(cartMapper.toCartResponse(cartService.getCart(ownerId)));
    }

    /**
     * POST /cart/items - 상품 추가 (같은 상품이면 수량 누적, replace_quantity=true 면 덮어쓰기)
     */
    @PostMapping("/items")
    public ResponseEntity<CartResponse> addItem(
            @RequestHeader("X-USER-ID") String ownerId,
            @RequestBody AddCartItemRequest request) {
        CartSnapshot cart = cartService.addItem(ownerId,
                cartMapper.requireProductId(request.getProductId()),
                cartMapper.requireQuantity(request.getQuantity()),
                request.getExpectedVersion(),
                Boolean.TRUE.equals(request.getReplaceQuantity()));
        return ResponseEntity.ok(cartMapper.toCartResponse(cart));
    }

    /**
     * PUT /cart/items/{product_id} - 수량 변경
     */
    @PutMapping("/items/{product_id}")
    public ResponseEntity<CartResponse> updateQuantity(
            @RequestHeader("X-USER-ID") String ownerId,
            @PathVariable("product_id") Long productId,
            @RequestBody UpdateQuantityRequest request) {
        CartSnapshot cart = cartService.updateQuantity(ownerId, productId,
                cartMapper.requireQuantity(request.getQuantity()), request.getExpectedVersion());
        return ResponseEntity.ok(cartMapper.toCartResponse(cart));
    }

    /**
     * DELETE /cart/items/{product_id} - 상품 제거
     */
    @DeleteMapping("/items/{product_id}")
    public ResponseEntity<CartResponse> removeItem(
            @RequestHeader("X-USER-ID") String ownerId,
            @PathVariable("product_id") Long productId,
            @RequestParam(value = "expected_version", required = false) Long expectedVersion) {
        return ResponseEntity.ok(cartMapper.toCartResponse(cartService.removeItem(ownerId, productId, expectedVersion)));
    }

    /**
     * DELETE /cart - 장바구니 비우기
     */
    @DeleteMapping
    public ResponseEntity<CartResponse> clear(
            @RequestHeader("X-USER-ID") String ownerId,
            @RequestParam(value = "expected_version", required = false) Long expectedVersion) {
        return ResponseEntity.ok(cartMapper.toCartResponse(cartService.clear(ownerId, expectedVersion)));
    }

    /**
     * POST /cart/merge - 비회원 세션 장바구니 병합
     */
    @PostMapping("/merge")
    public ResponseEntity<CartResponse> merge(
            @RequestHeader("X-USER-ID") String ownerId,
            @RequestBody MergeCartRequest request) {
        return ResponseEntity.ok(cartMapper.toCartResponse(cartService.merge(ownerId, request.getSessionId())));
    }
}
