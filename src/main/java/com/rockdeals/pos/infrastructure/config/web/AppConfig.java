package com.rockdeals.pos.infrastructure.config.web;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.PathMatchConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * AppConfig - API 전역 설정
 *
 * - 모든 컨트롤러 매핑에 /api prefix 추가
 * - POS 프론트엔드 origin에 대한 CORS 허용 (pos.web.allowed-origins)
 */
@Configuration
public class AppConfig implements WebMvcConfigurer {

    static final String API_PREFIX = "/api";

    private final String[] allowedOrigins;

    public AppConfig(@Value("${pos.web.allowed-origins:http://localhost:5173}") String[] allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void configurePathMatch(PathMatchConfigurer configurer) {
        configurer.addPathPrefix(API_PREFIX, c -> c.isAnnotationPresent(RestController.class)
                || c.isAnnotationPresent(Controller.class));
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping(API_PREFIX + "/**")
                .allowedOrigins(allowedOrigins)
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*");
    }
}
