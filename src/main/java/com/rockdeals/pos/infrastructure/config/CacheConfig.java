package com.rockdeals.pos.infrastructure.config;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Redis 캐시 설정
 *
 * 캐시 전략:
 * - productCatalog: 카탈로그 검색 결과 (TTL: pos.catalog.cache-ttl-minutes, 기본 5분)
 *   판매 확정 후 전체 무효화되므로 TTL은 관리자 화면의 상품 수정 반영 지연 상한이다.
 *
 * 여러 POS 단말(서버 인스턴스)이 같은 캐시를 공유한다.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    private final RedisConnectionFactory redisConnectionFactory;
    private final long catalogTtlMinutes;

    public CacheConfig(RedisConnectionFactory redisConnectionFactory,
                       @Value("${pos.catalog.cache-ttl-minutes:5}") long catalogTtlMinutes) {
        this.redisConnectionFactory = redisConnectionFactory;
        this.catalogTtlMinutes = catalogTtlMinutes;
    }

    /**
     * 캐시 전용 ObjectMapper (타입 정보 포함)
     * 애플리케이션 기본 ObjectMapper와 분리해 HTTP 응답 직렬화에 영향을 주지 않는다.
     */
    private ObjectMapper cacheObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.activateDefaultTyping(
                BasicPolymorphicTypeValidator.builder()
                        .allowIfSubType("com.rockdeals.pos.")
                        .allowIfSubType("java.util.")
                        .allowIfSubType("java.math.")
                        .build(),
                ObjectMapper.DefaultTyping.NON_FINAL,
                JsonTypeInfo.As.PROPERTY
        );
        return mapper;
    }

    @Bean
    public CacheManager cacheManager() {
        RedisCacheConfiguration defaultConfig = RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(CacheNames.DEFAULT_TTL)
                .serializeKeysWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer())
                )
                .serializeValuesWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                                new Jackson2JsonRedisSerializer<>(cacheObjectMapper(), Object.class)
                        )
                )
                .disableCachingNullValues();

        Map<String, RedisCacheConfiguration> cacheConfigMap = new HashMap<>();
        cacheConfigMap.put(CacheNames.PRODUCT_CATALOG,
                defaultConfig.entryTtl(Duration.ofMinutes(catalogTtlMinutes)));

        return RedisCacheManager.builder(redisConnectionFactory)
                .cacheDefaults(defaultConfig)
                .withInitialCacheConfigurations(cacheConfigMap)
                .build();
    }
}
