package com.contentflow.domain.activity.model.entity;

import com.contentflow.types.enums.ActivityActionEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * 团队操作日志实体（只追加）
 *
 * @author contentflow
 * @since 2026-03-02
 */
@Data
public class ActivityLogEntity {

    private Long id;

    private String organizationId;

    private String userId;

    /**
     * 写入时解析的显示名，可为空
     */
    private String userName;

    private ActivityActionEnum action;

    /**
     * 资源类型：workflow 或内容类型
     */
    private String resource;

    private String resourceId;

    private Map<String, Object> details;

    private LocalDateTime createdAt;

    public void validate() {
        if (organizationId == null || organizationId.trim().isEmpty()) {
            throw new IllegalStateException("Organization ID cannot be empty");
        }
        if (action == null) {
            throw new IllegalStateException("Activity action cannot be null");
        }
        if (resource == null || resource.trim().isEmpty()) {
            throw new IllegalStateException("Activity resource cannot be empty");
        }
    }

    public Map<String, Object> getDetails() {
        if (details == null) {
            details = new HashMap<>();
        }
        return details;
    }
}
