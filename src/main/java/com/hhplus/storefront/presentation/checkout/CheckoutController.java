package com.hhplus.storefront.presentation.checkout;

import com.hhplus.storefront.application.checkout.CheckoutCoordinator;
import com.hhplus.storefront.application.checkout.dto.CheckoutResult;
import com.hhplus.storefront.presentation.checkout.mapper.CheckoutMapper;
import com.hhplus.storefront.presentation.checkout.request.CheckoutRequest;
import com.hhplus.storefront.presentation.checkout.response.CheckoutAttemptResponse;
import com.hhplus.storefront.presentation.checkout.response.CheckoutResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * CheckoutController - 체크아웃 API 엔드포인트
 *
 * HTTP 상태 코드:
 * - 201 Created: 새 주문 생성
 * - 200 OK: 같은 멱등성 키로 이미 만들어진 주문 재생
 * - 400: 빈 장바구니, 판매 중지 상품, 수량 범위 위반
 * - 402: 결제 거절
 * - 409: 재고 부족, 가격 변경, 진행 중인 체크아웃, 타임아웃
 * - 503: 결제 오류 (같은 키로 재시도 가능)
 */
@RestController
@RequestMapping("/checkout")
public class CheckoutController {

    private final CheckoutCoordinator checkoutCoordinator;
    private final CheckoutMapper checkoutMapper;

    public CheckoutController(CheckoutCoordinator checkoutCoordinator, CheckoutMapper checkoutMapper) {
        this.checkoutCoordinator = checkoutCoordinator;
        this.checkoutMapper = checkoutMapper;
    }

    /**
     * POST /checkout - 장바구니 체크아웃
     */
    @PostMapping
    public ResponseEntity<CheckoutResponse> checkout(
            @RequestHeader("X-USER-ID") String ownerId,
            @RequestBody(required = false) CheckoutRequest request) {
        CheckoutResult result = checkoutCoordinator.checkout(ownerId,
                checkoutMapper.toIdempotencyKey(request),
                checkoutMapper.toPaymentDetails(request));

        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(checkoutMapper.toCheckoutResponse(result));
    }

    /**
     * GET /checkout/{checkout_id} - 체크아웃 시도 상태 조회
     */
    @GetMapping("/{checkout_id}")
    public ResponseEntity<CheckoutAttemptResponse> getAttempt(
            @RequestHeader("X-USER-ID") String ownerId,
            @PathVariable("checkout_id") String checkoutId) {
        return ResponseEntity.ok(checkoutMapper.toAttemptResponse(checkoutCoordinator.getAttempt(ownerId, checkoutId)));
    }
}
