package com.contentflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 审批流程 PO，对应 approval_workflows 表。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalWorkflowPO {

    private Long id;
    private String organizationId;
    private String name;
    private String description;
    private String type;
    /** JSONB */
    private String steps;
    private Boolean isActive;
    private String createdBy;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
