package com.rockdeals.pos.infrastructure.config.database;

import com.p6spy.engine.spy.P6SpyOptions;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * P6Spy 설정
 *
 * test 프로필에서만 활성화되며 판매 트랜잭션의 조건부 재고 UPDATE 등
 * 바인딩된 인자가 채워진 SQL을 SqlLogFormatter 형식으로 출력한다.
 */
@Configuration
@Profile("test")
public class P6SpyConfig {

    @PostConstruct
    public void registerFormatter() {
        P6SpyOptions.getActiveInstance().setLogMessageFormat(SqlLogFormatter.class.getName());
    }
}
