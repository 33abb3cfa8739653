package com.contentflow.domain.submission.model.entity;

import com.contentflow.domain.submission.model.valobj.StepCommentVO;
import com.contentflow.domain.workflow.model.valobj.WorkflowStepVO;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 提交内的审批步骤（流程步骤的独立副本，附带审批进度）
 *
 * @author contentflow
 * @since 2026-03-02
 */
@Data
public class SubmissionStepEntity {

    /**
     * 步骤序号，从 1 开始
     */
    private Integer stepNumber;

    /**
     * 审批人 ID 列表
     */
    private List<String> approverIds;

    /**
     * 所需审批数
     */
    private Integer requiredApprovals;

    /**
     * 已审批人，无重复
     */
    private List<String> approvedBy;

    /**
     * 驳回人，首次驳回生效
     */
    private String rejectedBy;

    /**
     * 评论，只追加
     */
    private List<StepCommentVO> comments;

    /**
     * 由流程步骤创建副本，审批进度清空
     */
    public static SubmissionStepEntity fromDefinition(WorkflowStepVO definition) {
        SubmissionStepEntity step = new SubmissionStepEntity();
        step.setStepNumber(definition.getStepNumber());
        step.setApproverIds(new ArrayList<>(definition.getApproverIds()));
        step.setRequiredApprovals(definition.getRequiredApprovals());
        step.setApprovedBy(new ArrayList<>());
        step.setRejectedBy(null);
        step.setComments(new ArrayList<>());
        return step;
    }

    public SubmissionStepEntity copy() {
        SubmissionStepEntity step = new SubmissionStepEntity();
        step.setStepNumber(stepNumber);
        step.setApproverIds(new ArrayList<>(getApproverIds()));
        step.setRequiredApprovals(requiredApprovals);
        step.setApprovedBy(new ArrayList<>(getApprovedBy()));
        step.setRejectedBy(rejectedBy);
        List<StepCommentVO> copiedComments = new ArrayList<>();
        for (StepCommentVO comment : getComments()) {
            copiedComments.add(StepCommentVO.builder()
                    .userId(comment.getUserId())
                    .userName(comment.getUserName())
                    .comment(comment.getComment())
                    .createdAt(comment.getCreatedAt())
                    .build());
        }
        step.setComments(copiedComments);
        return step;
    }

    public boolean isApprover(String userId) {
        return userId != null && getApproverIds().contains(userId);
    }

    public boolean hasApproved(String userId) {
        return userId != null && getApprovedBy().contains(userId);
    }

    /**
     * 记录一票审批，重复审批不生效
     */
    public boolean recordApproval(String userId) {
        if (hasApproved(userId)) {
            return false;
        }
        getApprovedBy().add(userId);
        return true;
    }

    /**
     * 记录驳回人，已有驳回人时保持不变
     */
    public void recordRejection(String userId) {
        if (rejectedBy == null) {
            rejectedBy = userId;
        }
    }

    public void addComment(StepCommentVO comment) {
        if (comment != null) {
            getComments().add(comment);
        }
    }

    public boolean isQuorumMet() {
        int required = requiredApprovals == null ? 1 : requiredApprovals;
        return getApprovedBy().size() >= required;
    }

    public List<String> getApproverIds() {
        if (approverIds == null) {
            approverIds = new ArrayList<>();
        }
        return approverIds;
    }

    public List<String> getApprovedBy() {
        if (approvedBy == null) {
            approvedBy = new ArrayList<>();
        }
        return approvedBy;
    }

    public List<StepCommentVO> getComments() {
        if (comments == null) {
            comments = new ArrayList<>();
        }
        return comments;
    }
}
