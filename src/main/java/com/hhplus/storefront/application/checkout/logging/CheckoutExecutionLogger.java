package com.hhplus.storefront.application.checkout.logging;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * CheckoutExecutionLogger - 체크아웃 실행 흐름 추적 Aspect
 *
 * 역할:
 * - 체크아웃 요청마다 고유 traceId 를 MDC 에 등록
 * - 시작/성공/실패 로깅
 *
 * 적용 대상:
 * - CheckoutCoordinator.checkout(..)
 *
 * 로그 형식:
 * - 시작: [CHECKOUT-START] traceId={}, ownerId={}
 * - 성공: [CHECKOUT-SUCCESS] traceId={}
 * - 실패: [CHECKOUT-FAILED] traceId={}, error={}
 */
@Aspect
@Component
public class CheckoutExecutionLogger {

    private static final Logger log = LoggerFactory.getLogger(CheckoutExecutionLogger.class);
    static final String MDC_TRACE_ID_KEY = "checkoutTraceId";

    @Around("execution(* com.hhplus.storefront.application.checkout.CheckoutCoordinator.checkout(..))")
    public Object logCheckoutExecution(ProceedingJoinPoint joinPoint) throws Throwable {
        String traceId = UUID.randomUUID().toString();
        MDC.put(MDC_TRACE_ID_KEY, traceId);
        Object[] args = joinPoint.getArgs();
        Object ownerId = args.length > 0 ? args[0] : null;

        try {
            log.info("[CHECKOUT-START] traceId={}, ownerId={}", traceId, ownerId);
            Object result = joinPoint.proceed();
            log.info("[CHECKOUT-SUCCESS] traceId={}", traceId);
            return result;
        } catch (Throwable e) {
            // 예외는 삼키지 않고 그대로 전파
            log.error("[CHECKOUT-FAILED] traceId={}, error={}", traceId, e.getMessage());
            throw e;
        } finally {
            MDC.remove(MDC_TRACE_ID_KEY);
        }
    }
}
