package com.hhplus.storefront.infrastructure.payment;

import com.hhplus.storefront.domain.payment.PaymentDetails;
import com.hhplus.storefront.domain.payment.PaymentOutcome;
import com.hhplus.storefront.domain.payment.PaymentRequest;
import com.hhplus.storefront.domain.payment.PaymentResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SimulatedPaymentGateway 단위 테스트
 * - 토큰 스크립트, 접두사 규칙, 고정 seed 오류 주입, 호출 횟수
 */
@DisplayName("SimulatedPaymentGateway 단위 테스트")
class SimulatedPaymentGatewayTest {

    private SimulatedPaymentGateway gateway(PaymentOutcome defaultOutcome, double errorRate, long seed) {
        return new SimulatedPaymentGateway(defaultOutcome, "decline_", "error_", errorRate, seed, Duration.ZERO);
    }

    private PaymentRequest request(String token) {
        return PaymentRequest.builder()
                .checkoutId("chk-1")
                .ownerId("user-1")
                .amount(2500L)
                .paymentDetails(PaymentDetails.builder().method("CARD").token(token).build())
                .build();
    }

    @Test
    @DisplayName("기본 결과 APPROVED - 결제 참조번호 발급")
    void testCharge_DefaultApproved() {
        SimulatedPaymentGateway gateway = gateway(PaymentOutcome.APPROVED, 0.0, 42L);

        PaymentResult result = gateway.charge(request("tok_ok"));

        assertThat(result.isApproved()).isTrue();
        assertThat(result.getReference()).startsWith("PAY-");
    }

    @Test
    @DisplayName("거절/오류 토큰 접두사")
    void testCharge_TokenPrefixes() {
        SimulatedPaymentGateway gateway = gateway(PaymentOutcome.APPROVED, 0.0, 42L);

        assertThat(gateway.charge(request("decline_limit")).getOutcome()).isEqualTo(PaymentOutcome.DECLINED);
        assertThat(gateway.charge(request("error_timeout")).getOutcome()).isEqualTo(PaymentOutcome.ERROR);
        assertThat(gateway.charge(request("error_timeout")).getReference()).isNull();
    }

    @Test
    @DisplayName("스크립트 결과가 접두사 규칙보다 우선")
    void testCharge_ScriptWins() {
        SimulatedPaymentGateway gateway = gateway(PaymentOutcome.APPROVED, 0.0, 42L);
        gateway.script("decline_but_ok", PaymentOutcome.APPROVED);
        gateway.script("tok_bad", PaymentOutcome.DECLINED);

        assertThat(gateway.charge(request("decline_but_ok")).getOutcome()).isEqualTo(PaymentOutcome.APPROVED);
        assertThat(gateway.charge(request("tok_bad")).getOutcome()).isEqualTo(PaymentOutcome.DECLINED);

        gateway.clearScript();
        assertThat(gateway.charge(request("tok_bad")).getOutcome()).isEqualTo(PaymentOutcome.APPROVED);
    }

    @Test
    @DisplayName("결제 수단이 없으면 기본 결과")
    void testCharge_NoPaymentDetails() {
        SimulatedPaymentGateway gateway = gateway(PaymentOutcome.DECLINED, 0.0, 42L);

        PaymentResult result = gateway.charge(PaymentRequest.builder()
                .checkoutId("chk-1").ownerId("user-1").amount(100L).build());

        assertThat(result.getOutcome()).isEqualTo(PaymentOutcome.DECLINED);
    }

    @Test
    @DisplayName("error-rate=1.0 이면 항상 오류")
    void testCharge_ErrorRateAlways() {
        SimulatedPaymentGateway gateway = gateway(PaymentOutcome.APPROVED, 1.0, 7L);

        for (int i = 0; i < 5; i++) {
            assertThat(gateway.charge(request("tok_" + i)).getOutcome()).isEqualTo(PaymentOutcome.ERROR);
        }
    }

    @Test
    @DisplayName("같은 seed 면 오류 주입 순서가 재현된다")
    void testCharge_SeedIsReproducible() {
        SimulatedPaymentGateway first = gateway(PaymentOutcome.APPROVED, 0.5, 1234L);
        SimulatedPaymentGateway second = gateway(PaymentOutcome.APPROVED, 0.5, 1234L);

        List<PaymentOutcome> firstOutcomes = new ArrayList<>();
        List<PaymentOutcome> secondOutcomes = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            firstOutcomes.add(first.charge(request("tok_" + i)).getOutcome());
            secondOutcomes.add(second.charge(request("tok_" + i)).getOutcome());
        }

        assertThat(firstOutcomes).isEqualTo(secondOutcomes);
    }

    @Test
    @DisplayName("호출 횟수 집계")
    void testCharge_CountsCalls() {
        SimulatedPaymentGateway gateway = gateway(PaymentOutcome.APPROVED, 0.0, 42L);

        gateway.charge(request("tok_1"));
        gateway.charge(request("decline_1"));
        gateway.charge(request("error_1"));

        assertThat(gateway.getChargeCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("error-rate 범위 밖이면 생성 실패")
    void testConstructor_InvalidErrorRate() {
        assertThatThrownBy(() -> gateway(PaymentOutcome.APPROVED, 1.5, 42L))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
