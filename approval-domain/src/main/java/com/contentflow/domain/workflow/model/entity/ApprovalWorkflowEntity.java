package com.contentflow.domain.workflow.model.entity;

import com.contentflow.domain.workflow.model.valobj.WorkflowStepVO;
import com.contentflow.types.enums.WorkflowTypeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 审批流程定义实体
 *
 * @author contentflow
 * @since 2026-03-02
 */
@Data
public class ApprovalWorkflowEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 所属组织 ID
     */
    private String organizationId;

    /**
     * 流程名称
     */
    private String name;

    /**
     * 流程描述
     */
    private String description;

    /**
     * 流程类型
     */
    private WorkflowTypeEnum type;

    /**
     * 审批步骤
     */
    private List<WorkflowStepVO> steps;

    /**
     * 是否启用
     */
    private Boolean isActive;

    /**
     * 创建人
     */
    private String createdBy;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * 校验实体有效性
     */
    public void validate() {
        if (organizationId == null || organizationId.trim().isEmpty()) {
            throw new IllegalStateException("Organization ID cannot be empty");
        }
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalStateException("Workflow name cannot be empty");
        }
        if (type == null) {
            throw new IllegalStateException("Workflow type cannot be null");
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalStateException("Workflow steps cannot be empty");
        }
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStepVO step = steps.get(i);
            if (step.getStepNumber() == null || step.getStepNumber() != i + 1) {
                throw new IllegalStateException("Workflow steps must be numbered from 1 without gaps");
            }
            if (step.getApproverIds().isEmpty()) {
                throw new IllegalStateException("Workflow step " + step.getStepNumber() + " has no approvers");
            }
        }
    }

    /**
     * 停用流程，已停用时保持不变
     */
    public boolean deactivate(LocalDateTime now) {
        if (!isActive()) {
            return false;
        }
        this.isActive = false;
        this.updatedAt = now;
        return true;
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(isActive);
    }

    public boolean belongsTo(String orgId) {
        return organizationId != null && organizationId.equals(orgId);
    }

    public int stepCount() {
        return steps == null ? 0 : steps.size();
    }

    public List<WorkflowStepVO> getSteps() {
        if (steps == null) {
            steps = new ArrayList<>();
        }
        return steps;
    }
}
