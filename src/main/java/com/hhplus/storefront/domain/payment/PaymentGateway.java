package com.hhplus.storefront.domain.payment;

/**
 * PaymentGateway - 결제 수단 포트 (Domain Layer - Port)
 *
 * 역할:
 * - 단일 메서드 charge 로 결제 결과를 돌려준다
 * - 구현체는 storefront.payment.provider 설정으로 선택된다
 *
 * 규칙:
 * - 내부 재시도를 하지 않는다 (재시도는 멱등성 키를 가진 호출자의 몫)
 * - 호출자는 어떤 트랜잭션이나 재고 락도 잡지 않은 상태로 호출한다
 */
public interface PaymentGateway {

    PaymentResult charge(PaymentRequest request);
}
