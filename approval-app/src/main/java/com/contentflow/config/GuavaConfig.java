package com.contentflow.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Guava 缓存配置类。
 * <p>
 * 用户显示名缓存：未找到的用户同样缓存为空值，写入后按配置秒数过期。
 * </p>
 *
 * @author contentflow
 * @since 2026-03-02
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "displayNameCache")
    public Cache<String, Optional<String>> displayNameCache(
            @Value("${approval.user-directory.cache.ttl-seconds:300}") long ttlSeconds,
            @Value("${approval.user-directory.cache.maximum-size:10000}") long maximumSize) {
        return CacheBuilder.newBuilder()
                .expireAfterWrite(Math.max(ttlSeconds, 1L), TimeUnit.SECONDS)
                .maximumSize(Math.max(maximumSize, 1L))
                .build();
    }

}
