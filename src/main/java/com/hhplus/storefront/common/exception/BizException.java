package com.hhplus.storefront.common.exception;

/**
 * BizException - 스토어프론트 비즈니스 예외의 최상위 클래스
 *
 * 역할:
 * - 에러 코드(ErrorCode)와 HTTP 상태 코드를 함께 운반
 * - GlobalExceptionHandler가 이 타입 하나로 응답을 구성
 *
 * 예외 계층:
 * BizException (최상위)
 * ├─ DomainException (장바구니/재고/체크아웃 규칙 위반)
 * └─ ApplicationException (프로세스 실패: 결제 오류, 타임아웃, 중복 주문)
 *
 * 인프라 오류(DataAccessException 등)는 BizException 으로 감싸지 않고 GlobalExceptionHandler 가 직접 매핑한다.
 */
public abstract class BizException extends RuntimeException {

    private final ErrorCode errorCode;

    protected BizException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }

    protected BizException(ErrorCode errorCode, String detailMessage) {
        super(errorCode.getMessage() + " | " + detailMessage);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getStatusCode() {
        return errorCode.getStatusCode();
    }

    public String getErrorCodeValue() {
        return errorCode.getCode();
    }
}
