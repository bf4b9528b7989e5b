package com.hhplus.storefront.presentation.checkout;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hhplus.storefront.application.checkout.CheckoutCoordinator;
import com.hhplus.storefront.application.checkout.dto.CheckoutResult;
import com.hhplus.storefront.domain.cart.CartLine;
import com.hhplus.storefront.domain.cart.CartSnapshot;
import com.hhplus.storefront.domain.cart.EmptyCartException;
import com.hhplus.storefront.domain.checkout.CheckoutAttempt;
import com.hhplus.storefront.domain.checkout.CheckoutNotFoundException;
import com.hhplus.storefront.domain.checkout.CheckoutTimeoutException;
import com.hhplus.storefront.domain.checkout.PriceChangedException;
import com.hhplus.storefront.domain.inventory.InsufficientStockException;
import com.hhplus.storefront.domain.order.Order;
import com.hhplus.storefront.domain.payment.PaymentDeclinedException;
import com.hhplus.storefront.domain.payment.PaymentDetails;
import com.hhplus.storefront.domain.payment.PaymentFailedException;
import com.hhplus.storefront.presentation.checkout.mapper.CheckoutMapper;
import com.hhplus.storefront.presentation.checkout.request.CheckoutRequest;
import com.hhplus.storefront.presentation.common.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * CheckoutControllerTest - Presentation Layer Unit Test
 *
 * 테스트 대상: CheckoutController
 * - POST /checkout: 201 (새 주문) / 200 (재생), 실패 코드 매핑
 * - GET /checkout/{checkout_id}: 시도 상태 조회
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CheckoutController 단위 테스트")
class CheckoutControllerTest {

    private static final String USER_HEADER = "X-USER-ID";
    private static final String OWNER = "user-1";

    private MockMvc mockMvc;
    private ObjectMapper objectMapper;

    @Mock
    private CheckoutCoordinator checkoutCoordinator;

    @BeforeEach
    void setup() {
        CheckoutController checkoutController = new CheckoutController(checkoutCoordinator, new CheckoutMapper());
        this.mockMvc = MockMvcBuilders.standaloneSetup(checkoutController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        this.objectMapper = new ObjectMapper();
    }

    private Order order() {
        return Order.builder()
                .orderId(10L)
                .orderNumber("ORD-20251107-1A2B3C4D")
                .checkoutId("chk-1")
                .idempotencyKey("key-1")
                .ownerId(OWNER)
                .totalAmount(2500L)
                .build();
    }

    private CheckoutRequest request(String key, String token) {
        return CheckoutRequest.builder()
                .idempotencyKey(key)
                .paymentDetails(CheckoutRequest.PaymentDetailsRequest.builder().method("CARD").token(token).build())
                .build();
    }

    // ========== POST /checkout ==========

    @Test
    @DisplayName("체크아웃 - 새 주문이면 201")
    void testCheckout_Created() throws Exception {
        // Given
        when(checkoutCoordinator.checkout(eq(OWNER), eq("key-1"), any(PaymentDetails.class)))
                .thenReturn(CheckoutResult.created("chk-1", order()));

        // When & Then
        mockMvc.perform(post("/checkout")
                        .header(USER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request("key-1", "tok_ok"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.checkout_id").value("chk-1"))
                .andExpect(jsonPath("$.order_id").value(10))
                .andExpect(jsonPath("$.order_number").value("ORD-20251107-1A2B3C4D"))
                .andExpect(jsonPath("$.status").value("COMMITTED"))
                .andExpect(jsonPath("$.total_amount").value(2500));

        ArgumentCaptor<PaymentDetails> details = ArgumentCaptor.forClass(PaymentDetails.class);
        verify(checkoutCoordinator).checkout(eq(OWNER), eq("key-1"), details.capture());
        assertThat(details.getValue().getToken()).isEqualTo("tok_ok");
    }

    @Test
    @DisplayName("체크아웃 - 같은 키 재요청이면 200 으로 같은 주문")
    void testCheckout_Replayed() throws Exception {
        when(checkoutCoordinator.checkout(eq(OWNER), eq("key-1"), any(PaymentDetails.class)))
                .thenReturn(CheckoutResult.replayed("chk-1", order()));

        mockMvc.perform(post("/checkout")
                        .header(USER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request("key-1", "tok_ok"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.order_id").value(10));
    }

    @Test
    @DisplayName("체크아웃 - 본문 없이 요청하면 키/결제수단 없이 진행")
    void testCheckout_NoBody() throws Exception {
        when(checkoutCoordinator.checkout(eq(OWNER), isNull(), isNull()))
                .thenReturn(CheckoutResult.created("chk-1", order()));

        mockMvc.perform(post("/checkout").header(USER_HEADER, OWNER))
                .andExpect(status().isCreated());
    }

    @Test
    @DisplayName("체크아웃 - 공백 키는 키 없음으로 취급")
    void testCheckout_BlankKey() throws Exception {
        when(checkoutCoordinator.checkout(eq(OWNER), isNull(), any(PaymentDetails.class)))
                .thenReturn(CheckoutResult.created("chk-1", order()));

        mockMvc.perform(post("/checkout")
                        .header(USER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request("  ", "tok_ok"))))
                .andExpect(status().isCreated());
    }

    @Test
    @DisplayName("체크아웃 - 빈 장바구니 400")
    void testCheckout_EmptyCart() throws Exception {
        when(checkoutCoordinator.checkout(eq(OWNER), isNull(), isNull())).thenThrow(new EmptyCartException(OWNER));

        mockMvc.perform(post("/checkout").header(USER_HEADER, OWNER))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_CART_EMPTY"));
    }

    @Test
    @DisplayName("체크아웃 - 재고 부족 409")
    void testCheckout_InsufficientStock() throws Exception {
        when(checkoutCoordinator.checkout(eq(OWNER), eq("key-1"), any(PaymentDetails.class)))
                .thenThrow(new InsufficientStockException(1L, 3, 2));

        mockMvc.perform(post("/checkout")
                        .header(USER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request("key-1", "tok_ok"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_INVENTORY_INSUFFICIENT_STOCK"));
    }

    @Test
    @DisplayName("체크아웃 - 가격 변경 409")
    void testCheckout_PriceChanged() throws Exception {
        when(checkoutCoordinator.checkout(eq(OWNER), eq("key-1"), any(PaymentDetails.class)))
                .thenThrow(new PriceChangedException(1L, 1000L, 1200L));

        mockMvc.perform(post("/checkout")
                        .header(USER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request("key-1", "tok_ok"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_CHECKOUT_PRICE_CHANGED"));
    }

    @Test
    @DisplayName("체크아웃 - 결제 거절 402, 결제 오류 503")
    void testCheckout_PaymentFailures() throws Exception {
        when(checkoutCoordinator.checkout(eq(OWNER), eq("key-d"), any(PaymentDetails.class)))
                .thenThrow(new PaymentDeclinedException("chk-1", "한도 초과"));
        when(checkoutCoordinator.checkout(eq(OWNER), eq("key-e"), any(PaymentDetails.class)))
                .thenThrow(new PaymentFailedException("chk-2", "timeout"));

        mockMvc.perform(post("/checkout")
                        .header(USER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request("key-d", "decline_x"))))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_PAYMENT_DECLINED"));

        mockMvc.perform(post("/checkout")
                        .header(USER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request("key-e", "error_x"))))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error_code").value("APP_PAYMENT_ERROR"));
    }

    @Test
    @DisplayName("체크아웃 - 타임아웃 409")
    void testCheckout_Timeout() throws Exception {
        when(checkoutCoordinator.checkout(eq(OWNER), eq("key-1"), any(PaymentDetails.class)))
                .thenThrow(new CheckoutTimeoutException("chk-1"));

        mockMvc.perform(post("/checkout")
                        .header(USER_HEADER, OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request("key-1", "tok_ok"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("APP_CHECKOUT_TIMEOUT"));
    }

    // ========== GET /checkout/{checkout_id} ==========

    @Test
    @DisplayName("체크아웃 시도 조회 - 상태와 마감 시각")
    void testGetAttempt_Success() throws Exception {
        // Given
        LocalDateTime now = LocalDateTime.of(2025, 11, 7, 12, 0);
        CartSnapshot snapshot = new CartSnapshot(OWNER, 3L, List.of(new CartLine(1L, 2, 1000L)));
        CheckoutAttempt attempt = CheckoutAttempt.initiate("key-1", snapshot, now.plusMinutes(5), now);
        when(checkoutCoordinator.getAttempt(OWNER, attempt.getCheckoutId())).thenReturn(attempt);

        // When & Then
        mockMvc.perform(get("/checkout/" + attempt.getCheckoutId()).header(USER_HEADER, OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.checkout_id").value(attempt.getCheckoutId()))
                .andExpect(jsonPath("$.state").value("INITIATED"))
                .andExpect(jsonPath("$.total_amount").value(2000))
                .andExpect(jsonPath("$.attempt_number").value(1))
                .andExpect(jsonPath("$.rejection_reason").doesNotExist());
    }

    @Test
    @DisplayName("체크아웃 시도 조회 - 없거나 남의 시도면 404")
    void testGetAttempt_NotFound() throws Exception {
        when(checkoutCoordinator.getAttempt(OWNER, "unknown")).thenThrow(new CheckoutNotFoundException("unknown"));

        mockMvc.perform(get("/checkout/unknown").header(USER_HEADER, OWNER))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_CHECKOUT_NOT_FOUND"));
    }
}
