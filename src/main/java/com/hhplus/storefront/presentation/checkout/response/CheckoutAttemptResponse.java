package com.hhplus.storefront.presentation.checkout.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 체크아웃 시도 상태 조회 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CheckoutAttemptResponse {

    @JsonProperty("checkout_id")
    private String checkoutId;

    @JsonProperty("idempotency_key")
    private String idempotencyKey;

    private String state;

    @JsonProperty("rejection_reason")
    private String rejectionReason;

    @JsonProperty("payment_outcome")
    private String paymentOutcome;

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("total_amount")
    private Long totalAmount;

    @JsonProperty("attempt_number")
    private Integer attemptNumber;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime deadline;
}
