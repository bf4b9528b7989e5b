package com.hhplus.storefront.infrastructure.config.web;

import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.config.annotation.PathMatchConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * AppConfig - API 전역 설정
 * 모든 컨트롤러 요청에 /api prefix를 자동으로 추가합니다.
 */
@Configuration
public class AppConfig implements WebMvcConfigurer {

    public static final String API_PREFIX = "/api";

    @Override
    public void configurePathMatch(PathMatchConfigurer configurer) {
        configurer.addPathPrefix(API_PREFIX, c -> c.isAnnotationPresent(RestController.class)
                || c.isAnnotationPresent(Controller.class));
    }
}
