package com.rockdeals.pos.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * POS 공통 빈
 * 판매 시각과 영수증 번호 날짜는 이 Clock을 기준으로 한다.
 */
@Configuration
public class PosConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
