package com.hhplus.storefront.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 상세 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderDetailResponse {

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("order_number")
    private String orderNumber;

    @JsonProperty("checkout_id")
    private String checkoutId;

    @JsonProperty("owner_id")
    private String ownerId;

    private List<OrderLineResponse> lines;

    @JsonProperty("total_amount")
    private Long totalAmount;

    @JsonProperty("payment_outcome")
    private String paymentOutcome;

    @JsonProperty("payment_reference")
    private String paymentReference;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;
}
