package com.hhplus.storefront;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Storefront 애플리케이션 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableRetry: 재고 행 락 획득 실패 시 제한된 재시도
 * - @EnableAspectJAutoProxy: 체크아웃 실행 추적 Aspect
 */
@EnableRetry
@EnableAspectJAutoProxy
@SpringBootApplication
public class StorefrontApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorefrontApplication.class, args);
    }

}
