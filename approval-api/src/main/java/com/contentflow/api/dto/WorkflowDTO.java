package com.contentflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 审批流程 DTO。
 */
@Data
public class WorkflowDTO {

    private Long workflowId;
    private String organizationId;
    private String name;
    private String description;
    private String type;
    private List<WorkflowStepDTO> steps;
    private Boolean isActive;
    private String createdBy;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
