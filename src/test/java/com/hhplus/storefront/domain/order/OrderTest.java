package com.hhplus.storefront.domain.order;

import com.hhplus.storefront.domain.cart.CartLine;
import com.hhplus.storefront.domain.cart.CartSnapshot;
import com.hhplus.storefront.domain.checkout.CheckoutAttempt;
import com.hhplus.storefront.domain.payment.PaymentOutcome;
import com.hhplus.storefront.domain.payment.PaymentResult;
import org.hamcrest.MatcherAssert;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.matchesPattern;

@DisplayName("Order 도메인 단위 테스트")
class OrderTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 11, 7, 12, 0);

    private CheckoutAttempt pendingAttempt() {
        CartSnapshot snapshot = new CartSnapshot("user-1", 1L,
                List.of(new CartLine(1L, 2, 1000L), new CartLine(2L, 1, 500L)));
        CheckoutAttempt attempt = CheckoutAttempt.initiate("key-1", snapshot, NOW.plusMinutes(5), NOW);
        attempt.markValidated(NOW);
        attempt.markReserved(NOW);
        attempt.markPaymentPending(NOW);
        return attempt;
    }

    @Test
    @DisplayName("승인된 체크아웃에서 주문 생성 - 라인, 합계, 결제 참조 복사")
    void testFromCheckout() {
        CheckoutAttempt attempt = pendingAttempt();
        attempt.recordPayment(PaymentResult.approved("PAY-123"), NOW);

        Order order = Order.fromCheckout(attempt, NOW);

        assertThat(order.getTotalAmount()).isEqualTo(2500L);
        assertThat(order.getLines()).extracting(OrderLine::getLineTotal).containsExactly(2000L, 500L);
        assertThat(order.getCheckoutId()).isEqualTo(attempt.getCheckoutId());
        assertThat(order.getIdempotencyKey()).isEqualTo("key-1");
        assertThat(order.getPaymentOutcome()).isEqualTo(PaymentOutcome.APPROVED);
        assertThat(order.getPaymentReference()).isEqualTo("PAY-123");
        assertThat(order.isOwnedBy("user-1")).isTrue();
        assertThat(order.isOwnedBy("user-2")).isFalse();
    }

    @Test
    @DisplayName("승인되지 않은 체크아웃은 주문이 될 수 없다")
    void testFromCheckout_NotApproved() {
        CheckoutAttempt attempt = pendingAttempt();

        assertThatThrownBy(() -> Order.fromCheckout(attempt, NOW)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("주문 번호 형식 - ORD-yyyyMMdd-XXXXXXXX")
    void testGenerateOrderNumber() {
        String orderNumber = Order.generateOrderNumber(NOW);

        MatcherAssert.assertThat(orderNumber, matchesPattern("ORD-20251107-[0-9A-F]{8}"));
    }
}
