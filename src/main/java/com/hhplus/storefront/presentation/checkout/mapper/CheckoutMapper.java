package com.hhplus.storefront.presentation.checkout.mapper;

import com.hhplus.storefront.application.checkout.dto.CheckoutResult;
import com.hhplus.storefront.domain.checkout.CheckoutAttempt;
import com.hhplus.storefront.domain.checkout.CheckoutState;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.payment.PaymentDetails;
import com.hhplus.storefront.presentation.checkout.request.CheckoutRequest;
import com.hhplus.storefront.presentation.checkout.response.CheckoutAttemptResponse;
import com.hhplus.storefront.presentation.checkout.response.CheckoutResponse;
import org.springframework.stereotype.Component;

/**
 * CheckoutMapper - 체크아웃 요청/응답 DTO 변환
 */
@Component
public class CheckoutMapper {

    /**
     * 요청의 payment_details → 도메인 PaymentDetails (없으면 null)
     */
    public PaymentDetails toPaymentDetails(CheckoutRequest request) {
        if (request == null || request.getPaymentDetails() == null) {
            return null;
        }
        return PaymentDetails.builder()
                .method(request.getPaymentDetails().getMethod())
                .token(request.getPaymentDetails().getToken())
                .build();
    }

    /**
     * 빈 문자열 키는 키 없음으로 취급
     */
    public String toIdempotencyKey(CheckoutRequest request) {
        if (request == null || request.getIdempotencyKey() == null || request.getIdempotencyKey().isBlank()) {
            return null;
        }
        return request.getIdempotencyKey();
    }

    public CheckoutResponse toCheckoutResponse(CheckoutResult result) {
        Order order = result.getOrder();
        return CheckoutResponse.builder()
                .checkoutId(result.getCheckoutId())
                .orderId(order.getOrderId())
                .orderNumber(order.getOrderNumber())
                .status(CheckoutState.COMMITTED.name())
                .totalAmount(order.getTotalAmount())
                .build();
    }

    public CheckoutAttemptResponse toAttemptResponse(CheckoutAttempt attempt) {
        return CheckoutAttemptResponse.builder()
                .checkoutId(attempt.getCheckoutId())
                .idempotencyKey(attempt.getIdempotencyKey())
                .state(attempt.getState().name())
                .rejectionReason(attempt.getRejectionReason() == null ? null : attempt.getRejectionReason().name())
                .paymentOutcome(attempt.getPaymentOutcome() == null ? null : attempt.getPaymentOutcome().name())
                .orderId(attempt.getOrderId())
                .totalAmount(attempt.getTotalAmount())
                .attemptNumber(attempt.getAttemptNumber())
                .deadline(attempt.getDeadline())
                .build();
    }
}
