package com.hhplus.storefront.presentation.order.mapper;

import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.order.OrderLine;
import com.hhplus.storefront.presentation.order.response.OrderDetailResponse;
import com.hhplus.storefront.presentation.order.response.OrderLineResponse;
import com.hhplus.storefront.presentation.order.response.OrderListResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderMapper - 주문 엔티티 → 응답 DTO 변환
 */
@Component
public class OrderMapper {

    public OrderDetailResponse toOrderDetailResponse(Order order) {
        return OrderDetailResponse.builder()
                .orderId(order.getOrderId())
                .orderNumber(order.getOrderNumber())
                .checkoutId(order.getCheckoutId())
                .ownerId(order.getOwnerId())
                .lines(order.getLines().stream()
                        .map(this::toOrderLineResponse)
                        .collect(Collectors.toList()))
                .totalAmount(order.getTotalAmount())
                .paymentOutcome(order.getPaymentOutcome() == null ? null : order.getPaymentOutcome().name())
                .paymentReference(order.getPaymentReference())
                .createdAt(order.getCreatedAt())
                .build();
    }

    public OrderListResponse toOrderListResponse(List<Order> orders) {
        return OrderListResponse.builder()
                .orders(orders.stream()
                        .map(this::toOrderDetailResponse)
                        .collect(Collectors.toList()))
                .totalCount(orders.size())
                .build();
    }

    private OrderLineResponse toOrderLineResponse(OrderLine line) {
        return OrderLineResponse.builder()
                .productId(line.getProductId())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .lineTotal(line.getLineTotal())
                .build();
    }
}
