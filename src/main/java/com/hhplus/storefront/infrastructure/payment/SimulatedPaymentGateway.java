package com.hhplus.storefront.infrastructure.payment;

import com.hhplus.storefront.domain.payment.PaymentDetails;
import com.hhplus.storefront.domain.payment.PaymentGateway;
import com.hhplus.storefront.domain.payment.PaymentOutcome;
import com.hhplus.storefront.domain.payment.PaymentRequest;
import com.hhplus.storefront.domain.payment.PaymentResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SimulatedPaymentGateway - 결정적 결제 시뮬레이터
 *
 * 결과 결정 순서:
 * 1. script(token, outcome) 로 지정된 토큰별 결과
 * 2. 거절/오류 토큰 접두사 (decline-token-prefix, error-token-prefix)
 * 3. error-rate 에 따른 오류 주입 (고정 seed 로 재현 가능)
 * 4. default-outcome
 *
 * 특징:
 * - 내부 재시도 없음
 * - latency 설정으로 네트워크 지연 흉내
 * - 호출 횟수를 세어 이중 과금 여부를 검증할 수 있게 한다
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "storefront.payment.provider", havingValue = "simulator", matchIfMissing = true)
public class SimulatedPaymentGateway implements PaymentGateway {

    private final PaymentOutcome defaultOutcome;
    private final String declineTokenPrefix;
    private final String errorTokenPrefix;
    private final double errorRate;
    private final Duration latency;
    private final Random random;

    private final Map<String, PaymentOutcome> scriptedOutcomes = new ConcurrentHashMap<>();
    private final AtomicInteger chargeCount = new AtomicInteger();

    public SimulatedPaymentGateway(
            @Value("${storefront.payment.simulator.default-outcome:APPROVED}") PaymentOutcome defaultOutcome,
            @Value("${storefront.payment.simulator.decline-token-prefix:decline_}") String declineTokenPrefix,
            @Value("${storefront.payment.simulator.error-token-prefix:error_}") String errorTokenPrefix,
            @Value("${storefront.payment.simulator.error-rate:0.0}") double errorRate,
            @Value("${storefront.payment.simulator.seed:42}") long seed,
            @Value("${storefront.payment.simulator.latency:PT0S}") Duration latency) {
        if (errorRate < 0.0 || errorRate > 1.0) {
            throw new IllegalArgumentException("error-rate 는 0.0 ~ 1.0 범위여야 합니다: " + errorRate);
        }
        this.defaultOutcome = defaultOutcome;
        this.declineTokenPrefix = declineTokenPrefix;
        this.errorTokenPrefix = errorTokenPrefix;
        this.errorRate = errorRate;
        this.latency = latency;
        this.random = new Random(seed);
    }

    @Override
    public PaymentResult charge(PaymentRequest request) {
        chargeCount.incrementAndGet();
        simulateLatency();

        PaymentOutcome outcome = decideOutcome(request.getPaymentDetails());
        PaymentResult result;
        switch (outcome) {
            case APPROVED:
                result = PaymentResult.approved(newReference());
                break;
            case DECLINED:
                result = PaymentResult.declined(newReference(), "카드사 승인 거절");
                break;
            default:
                result = PaymentResult.error("결제망 응답 오류 (시뮬레이션)");
                break;
        }

        log.info("[SimulatedPaymentGateway] 결제 요청 처리 - checkoutId={}, amount={}, outcome={}",
                request.getCheckoutId(), request.getAmount(), result.getOutcome());
        return result;
    }

    /**
     * 특정 토큰의 결과를 고정한다 (테스트/시연용)
     */
    public void script(String token, PaymentOutcome outcome) {
        scriptedOutcomes.put(token, outcome);
    }

    public void clearScript() {
        scriptedOutcomes.clear();
    }

    public int getChargeCount() {
        return chargeCount.get();
    }

    private PaymentOutcome decideOutcome(PaymentDetails details) {
        String token = details == null ? null : details.getToken();
        if (token != null) {
            PaymentOutcome scripted = scriptedOutcomes.get(token);
            if (scripted != null) {
                return scripted;
            }
            if (token.startsWith(declineTokenPrefix)) {
                return PaymentOutcome.DECLINED;
            }
            if (token.startsWith(errorTokenPrefix)) {
                return PaymentOutcome.ERROR;
            }
        }
        if (errorRate > 0.0 && nextDouble() < errorRate) {
            return PaymentOutcome.ERROR;
        }
        return defaultOutcome;
    }

    private synchronized double nextDouble() {
        return random.nextDouble();
    }

    private void simulateLatency() {
        if (latency.isZero() || latency.isNegative()) {
            return;
        }
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private String newReference() {
        return "PAY-" + UUID.randomUUID();
    }
}
