package com.hhplus.storefront.presentation.order;

import com.hhplus.storefront.application.order.OrderLedger;
import com.hhplus.storefront.presentation.order.mapper.OrderMapper;
import com.hhplus.storefront.presentation.order.response.OrderDetailResponse;
import com.hhplus.storefront.presentation.order.response.OrderListResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * OrderController - 주문 조회 API 엔드포인트
 * 주문은 체크아웃 커밋으로만 생성되며 변경되지 않는다.
 */
@RestController
@RequestMapping("/orders")
public class OrderController {

    private final OrderLedger orderLedger;
    private final OrderMapper orderMapper;

    public OrderController(OrderLedger orderLedger, OrderMapper orderMapper) {
        this.orderLedger = orderLedger;
        this.orderMapper = orderMapper;
    }

    /**
     * GET /orders/{order_id} - 주문 상세 (본인 주문만, 아니면 404)
     */
    @GetMapping("/{order_id}")
    public ResponseEntity<OrderDetailResponse> getOrder(
            @RequestHeader("X-USER-ID") String ownerId,
            @PathVariable("order_id") Long orderId) {
        return ResponseEntity.ok(orderMapper.toOrderDetailResponse(orderLedger.getForOwner(ownerId, orderId)));
    }

    /**
     * GET /orders - 내 주문 목록
     */
    @GetMapping
    public ResponseEntity<OrderListResponse> getOrders(@RequestHeader("X-USER-ID") String ownerId) {
        return ResponseEntity.ok(orderMapper.toOrderListResponse(orderLedger.listForOwner(ownerId)));
    }
}
