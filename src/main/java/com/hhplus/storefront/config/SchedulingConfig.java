package com.hhplus.storefront.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * SchedulingConfig - 배치 작업 활성화
 *
 * 대상:
 * - ReservationExpiryJob: 만료된 재고 예약 해제
 * - CheckoutRecoveryService: 승인 후 미커밋 체크아웃 재실행, 마감 초과 체크아웃 타임아웃 처리
 *
 * storefront.scheduling.enabled=false 이면 스케줄링 전체를 끈다 (테스트 프로필).
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "storefront.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
