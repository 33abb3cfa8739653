package com.contentflow.domain.submission.model.entity;

import com.contentflow.types.enums.ApprovalStateEnum;
import com.contentflow.types.enums.ContentTypeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 内容审批提交实体
 *
 * @author contentflow
 * @since 2026-03-02
 */
@Data
public class ContentSubmissionEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 所属组织 ID
     */
    private String organizationId;

    /**
     * 提交时使用的流程 ID，仅用于审计
     */
    private Long workflowId;

    /**
     * 内容类型
     */
    private ContentTypeEnum contentType;

    /**
     * 内容 ID
     */
    private String contentId;

    /**
     * 内容快照 (解析后的 Map)
     */
    private Map<String, Object> contentData;

    /**
     * 提交人
     */
    private String submittedBy;

    /**
     * 提交人显示名（提交时冗余）
     */
    private String submittedByName;

    /**
     * 当前状态
     */
    private ApprovalStateEnum currentState;

    /**
     * 当前步骤序号，从 1 开始
     */
    private Integer currentStep;

    /**
     * 审批步骤副本
     */
    private List<SubmissionStepEntity> steps;

    private String finalApprovedBy;

    private String finalRejectedBy;

    private LocalDateTime approvalCompletedAt;

    private LocalDateTime publishedAt;

    /**
     * 乐观锁版本号
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * 校验实体有效性
     */
    public void validate() {
        if (organizationId == null || organizationId.trim().isEmpty()) {
            throw new IllegalStateException("Organization ID cannot be empty");
        }
        if (workflowId == null) {
            throw new IllegalStateException("Workflow ID cannot be null");
        }
        if (contentType == null) {
            throw new IllegalStateException("Content type cannot be null");
        }
        if (submittedBy == null || submittedBy.trim().isEmpty()) {
            throw new IllegalStateException("Submitter cannot be empty");
        }
        if (currentState == null) {
            throw new IllegalStateException("Current state cannot be null");
        }
        if (getSteps().isEmpty()) {
            throw new IllegalStateException("Submission steps cannot be empty");
        }
        if (currentStep == null || currentStep < 1 || currentStep > getSteps().size()) {
            throw new IllegalStateException("Current step out of range: " + currentStep);
        }
    }

    /**
     * 当前步骤
     */
    public SubmissionStepEntity currentStepEntity() {
        if (currentStep == null || currentStep < 1 || currentStep > getSteps().size()) {
            throw new IllegalStateException("Current step out of range: " + currentStep);
        }
        return getSteps().get(currentStep - 1);
    }

    public boolean isLastStep() {
        return currentStep != null && currentStep == getSteps().size();
    }

    public boolean isPending() {
        return currentState == ApprovalStateEnum.PENDING;
    }

    public boolean isApproved() {
        return currentState == ApprovalStateEnum.APPROVED;
    }

    /**
     * 深拷贝，步骤和评论均为独立副本
     */
    public ContentSubmissionEntity copy() {
        ContentSubmissionEntity copy = new ContentSubmissionEntity();
        copy.setId(id);
        copy.setOrganizationId(organizationId);
        copy.setWorkflowId(workflowId);
        copy.setContentType(contentType);
        copy.setContentId(contentId);
        copy.setContentData(contentData == null ? null : new HashMap<>(contentData));
        copy.setSubmittedBy(submittedBy);
        copy.setSubmittedByName(submittedByName);
        copy.setCurrentState(currentState);
        copy.setCurrentStep(currentStep);
        List<SubmissionStepEntity> copiedSteps = new ArrayList<>();
        for (SubmissionStepEntity step : getSteps()) {
            copiedSteps.add(step.copy());
        }
        copy.setSteps(copiedSteps);
        copy.setFinalApprovedBy(finalApprovedBy);
        copy.setFinalRejectedBy(finalRejectedBy);
        copy.setApprovalCompletedAt(approvalCompletedAt);
        copy.setPublishedAt(publishedAt);
        copy.setVersion(version);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }

    /**
     * 增加版本号
     */
    public void incrementVersion() {
        this.version = (this.version == null ? 0 : this.version) + 1;
    }

    public List<SubmissionStepEntity> getSteps() {
        if (steps == null) {
            steps = new ArrayList<>();
        }
        return steps;
    }
}
