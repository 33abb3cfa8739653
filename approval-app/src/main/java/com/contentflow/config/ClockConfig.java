package com.contentflow.config;

import com.contentflow.infrastructure.typehandler.CompatibleLocalDateTimeTypeHandler;
import org.mybatis.spring.boot.autoconfigure.ConfigurationCustomizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * 时钟配置，所有审批时间戳均取自该 Clock；读库时的时区换算与之保持一致。
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${approval.clock.zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }

    @Bean
    public ConfigurationCustomizer localDateTimeTypeHandlerCustomizer(Clock clock) {
        return configuration -> configuration.getTypeHandlerRegistry()
                .register(LocalDateTime.class, new CompatibleLocalDateTimeTypeHandler(clock.getZone()));
    }
}
