package com.contentflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * 审批接口访问日志开关。默认只记录 /api/**，健康检查不记；慢请求无视采样一律输出。
 */
@Data
@Component
@ConfigurationProperties(prefix = "observability.http-log", ignoreInvalidFields = true)
public class ObservabilityHttpLogProperties {

    private boolean enabled = true;

    private List<String> includePathPatterns = Arrays.asList("/api/**");

    private List<String> excludePathPatterns = Arrays.asList("/actuator/**");

    /** 毫秒 */
    private long slowRequestThresholdMs = 1000L;

    /** 0 表示只记录慢请求与抛出异常的请求 */
    private double sampleRate = 1.0D;
}
