package com.contentflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 团队操作日志 DTO。
 */
@Data
public class ActivityLogDTO {

    private Long activityId;
    private String organizationId;
    private String userId;
    private String userName;
    private String action;
    private String resource;
    private String resourceId;
    private Map<String, Object> details;
    private LocalDateTime createdAt;
}
