package com.hhplus.storefront.application.checkout;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 체크아웃 시간/수량 설정
 *
 * - timeout: 체크아웃 시도가 COMMITTED 에 도달해야 하는 제한 시간
 * - reservation-ttl: 재고 예약 만료 시간 (timeout 보다 길어야 함)
 * - recovery-grace: 결제 응답 대기 중인 시도에 추가로 허용하는 시간
 * - max-quantity-per-line: 라인당 최대 수량
 */
@Getter
@Component
public class CheckoutSettings {

    private final Duration timeout;
    private final Duration reservationTtl;
    private final Duration recoveryGrace;
    private final int maxQuantityPerLine;

    public CheckoutSettings(
            @Value("${storefront.checkout.timeout:PT5M}") Duration timeout,
            @Value("${storefront.inventory.reservation-ttl:PT15M}") Duration reservationTtl,
            @Value("${storefront.checkout.recovery-grace:PT30S}") Duration recoveryGrace,
            @Value("${storefront.cart.max-quantity-per-line:100}") int maxQuantityPerLine) {
        this.timeout = timeout;
        this.reservationTtl = reservationTtl;
        this.recoveryGrace = recoveryGrace;
        this.maxQuantityPerLine = maxQuantityPerLine;
    }

    @PostConstruct
    void validate() {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalStateException("storefront.checkout.timeout 은 0보다 커야 합니다: " + timeout);
        }
        if (reservationTtl.compareTo(timeout) <= 0) {
            throw new IllegalStateException(String.format(
                    "storefront.inventory.reservation-ttl(%s)은 storefront.checkout.timeout(%s)보다 길어야 합니다",
                    reservationTtl, timeout));
        }
        if (maxQuantityPerLine < 1) {
            throw new IllegalStateException("storefront.cart.max-quantity-per-line 은 1 이상이어야 합니다");
        }
    }
}
