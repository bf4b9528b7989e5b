package com.hhplus.storefront.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 역할:
 * - 장바구니 버전 충돌, 재고 부족, 가격 변경 등 규칙 위반 시 발생
 * - 일반적으로 클라이언트 오류(4XX)로 응답
 *
 * 사용 예:
 * - CartVersionConflictException: 장바구니 버전 불일치
 * - InsufficientStockException: 예약 가능 재고 부족
 * - PriceChangedException: 장바구니 가격 스냅샷과 현재 가격 불일치
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
