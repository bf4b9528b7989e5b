package com.hhplus.storefront.common.exception;

/**
 * ApplicationException - 애플리케이션 계층 프로세스 실패 예외
 *
 * 역할:
 * - 규칙은 만족하지만 체크아웃 프로세스가 완료되지 못한 상황
 * - 결제 게이트웨이 오류, 체크아웃 타임아웃, 진행 중 체크아웃 충돌 등
 *
 * DomainException과의 차이:
 * - DomainException: 입력 자체가 규칙을 위반 (예: 재고 부족)
 * - ApplicationException: 입력은 유효하지만 처리 과정이 실패 (예: 결제 오류)
 */
public class ApplicationException extends BizException {

    public ApplicationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ApplicationException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
