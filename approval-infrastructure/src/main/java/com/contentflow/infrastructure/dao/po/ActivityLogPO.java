package com.contentflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 团队操作日志 PO，对应 team_activity 表。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityLogPO {

    private Long id;
    private String organizationId;
    private String userId;
    private String userName;
    private String action;
    private String resource;
    private String resourceId;
    /** JSONB */
    private String details;
    private LocalDateTime createdAt;
}
