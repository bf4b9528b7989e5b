package com.hhplus.storefront.presentation.common;

import com.hhplus.storefront.common.exception.BizException;
import com.hhplus.storefront.common.exception.ErrorCode;
import com.hhplus.storefront.presentation.common.response.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * GlobalExceptionHandler - 전역 예외 처리 (Presentation 계층)
 *
 * 역할:
 * - 모든 계층에서 발생하는 예외를 통일된 에러 응답으로 변환
 *
 * 에러 응답 형식:
 * {
 *   "error_code": "DOMAIN_CART_VERSION_CONFLICT",
 *   "error_message": "메시지",
 *   "timestamp": "2025-11-07T12:34:56.000Z",
 *   "request_id": "req-abc123def456"
 * }
 *
 * HTTP 상태 코드 매핑:
 * - BizException: ErrorCode 에 정의된 상태 코드 (400/402/404/409/500/503)
 * - 400 Bad Request: 헤더 누락, 본문 파싱 실패, 파라미터 타입 오류, IllegalArgumentException
 * - 409 Conflict: 무결성 제약 위반, 상태 전이 규칙 위반 (IllegalStateException)
 * - 500 Internal Server Error: 데이터베이스 오류, 그 외 예상치 못한 오류
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * 비즈니스 예외 (ErrorCode 기반)
     * 5XX 에 해당하는 예외는 정합성 문제일 수 있으므로 ERROR 로 남긴다.
     */
    @ExceptionHandler(BizException.class)
    public ResponseEntity<ErrorResponse> handleBizException(BizException e) {
        if (e.getStatusCode() >= 500) {
            logger.error("[GlobalExceptionHandler] 서버측 비즈니스 예외 - code={}, message={}",
                    e.getErrorCodeValue(), e.getMessage(), e);
        } else {
            logger.debug("[GlobalExceptionHandler] 비즈니스 예외 - code={}, message={}",
                    e.getErrorCodeValue(), e.getMessage());
        }
        ErrorResponse errorResponse = ErrorResponse.of(e.getErrorCodeValue(), e.getMessage());
        return ResponseEntity.status(e.getStatusCode()).body(errorResponse);
    }

    /**
     * 필수 헤더 누락 (X-USER-ID) (400)
     */
    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingRequestHeaderException(MissingRequestHeaderException e) {
        ErrorResponse errorResponse = ErrorResponse.of("INVALID_REQUEST",
                "필수 헤더가 없습니다: " + e.getHeaderName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 요청 본문 파싱 실패 (400)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(HttpMessageNotReadableException e) {
        ErrorResponse errorResponse = ErrorResponse.of("INVALID_REQUEST", "요청 본문을 읽을 수 없습니다");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 경로/쿼리 파라미터 타입 오류 (400)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatchException(MethodArgumentTypeMismatchException e) {
        ErrorResponse errorResponse = ErrorResponse.of("INVALID_REQUEST",
                "파라미터 형식이 올바르지 않습니다: " + e.getName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 잘못된 요청 파라미터 (400)
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
        ErrorResponse errorResponse = ErrorResponse.of("INVALID_REQUEST", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 상태 전이 규칙 위반 (409)
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalStateException(IllegalStateException e) {
        logger.warn("[GlobalExceptionHandler] 상태 충돌 - {}", e.getMessage());
        ErrorResponse errorResponse = ErrorResponse.of("CONFLICT", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse);
    }

    /**
     * 무결성 제약 위반 (409)
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrityViolationException(DataIntegrityViolationException e) {
        logger.warn("[GlobalExceptionHandler] 무결성 제약 위반 - {}", e.getMostSpecificCause().getMessage());
        ErrorResponse errorResponse = ErrorResponse.of("CONFLICT", "동시 요청과 충돌했습니다. 다시 시도하세요");
        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse);
    }

    /**
     * 데이터베이스 오류 (500)
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException e) {
        logger.error("[GlobalExceptionHandler] 데이터베이스 오류", e);
        ErrorCode code = ErrorCode.DATABASE_ERROR;
        return ResponseEntity.status(code.getStatusCode()).body(ErrorResponse.of(code.getCode(), code.getMessage()));
    }

    /**
     * 서버 내부 오류 (500)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        logger.error("Unhandled exception occurred: ", e);
        ErrorCode code = ErrorCode.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(code.getStatusCode()).body(ErrorResponse.of(code.getCode(), code.getMessage()));
    }
}
