package com.contentflow.domain.submission.service;

import com.contentflow.domain.submission.model.entity.ContentSubmissionEntity;
import com.contentflow.domain.submission.model.entity.SubmissionStepEntity;
import com.contentflow.domain.submission.model.valobj.StepCommentVO;
import com.contentflow.domain.submission.model.valobj.SubmissionTransition;
import com.contentflow.domain.submission.model.valobj.SubmissionTransitionKind;
import com.contentflow.domain.workflow.model.entity.ApprovalWorkflowEntity;
import com.contentflow.domain.workflow.model.valobj.WorkflowStepVO;
import com.contentflow.types.enums.ApprovalStateEnum;
import com.contentflow.types.enums.ContentTypeEnum;
import com.contentflow.types.enums.ResponseCode;
import com.contentflow.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 提交状态机领域服务：根据当前提交计算迁移结果。
 * <p>
 * 每个动作都在入参提交的副本上迁移，规则校验失败时抛出 {@link AppException}，入参提交保持不变。
 * 校验顺序：状态必须为 pending，操作人必须是当前步骤审批人，审批时不能重复审批。
 * </p>
 */
@Service
public class SubmissionTransitionDomainService {

    public void validateSubmitRequest(String organizationId,
                                      Long workflowId,
                                      ContentTypeEnum contentType,
                                      String submittedBy) {
        requireText(organizationId, "organizationId");
        if (workflowId == null) {
            throw AppException.of(ResponseCode.MISSING_REQUIRED_FIELD, "workflowId is required");
        }
        if (contentType == null) {
            throw AppException.of(ResponseCode.MISSING_REQUIRED_FIELD, "contentType is required");
        }
        requireText(submittedBy, "submittedBy");
    }

    /**
     * 按流程定义创建提交，步骤为流程步骤的独立副本。
     */
    public ContentSubmissionEntity createSubmission(ApprovalWorkflowEntity workflow,
                                                    String organizationId,
                                                    ContentTypeEnum contentType,
                                                    Map<String, Object> contentData,
                                                    String submittedBy,
                                                    String submittedByName,
                                                    String contentId,
                                                    LocalDateTime now) {
        if (workflow == null || !workflow.belongsTo(organizationId)) {
            throw AppException.of(ResponseCode.WORKFLOW_NOT_FOUND, "审批流程不存在");
        }
        if (!workflow.isActive()) {
            throw AppException.of(ResponseCode.WORKFLOW_INACTIVE, "审批流程已停用: " + workflow.getId());
        }

        List<SubmissionStepEntity> steps = new ArrayList<>();
        for (WorkflowStepVO definition : workflow.getSteps()) {
            steps.add(SubmissionStepEntity.fromDefinition(definition));
        }

        ContentSubmissionEntity submission = new ContentSubmissionEntity();
        submission.setOrganizationId(organizationId);
        submission.setWorkflowId(workflow.getId());
        submission.setContentType(contentType);
        submission.setContentId(StringUtils.trimToNull(contentId));
        submission.setContentData(contentData == null ? new HashMap<>() : new HashMap<>(contentData));
        submission.setSubmittedBy(submittedBy);
        submission.setSubmittedByName(submittedByName);
        submission.setCurrentState(ApprovalStateEnum.PENDING);
        submission.setCurrentStep(1);
        submission.setSteps(steps);
        submission.setVersion(0);
        submission.setCreatedAt(now);
        submission.setUpdatedAt(now);
        submission.validate();
        return submission;
    }

    public SubmissionTransition approve(ContentSubmissionEntity current,
                                        String userId,
                                        String comment,
                                        String commenterName,
                                        LocalDateTime now) {
        requireText(userId, "userId");
        ContentSubmissionEntity submission = current.copy();
        SubmissionStepEntity step = requireActionableStep(submission, userId);
        if (step.hasApproved(userId)) {
            throw AppException.of(ResponseCode.ALREADY_APPROVED,
                    "user " + userId + " already approved step " + step.getStepNumber());
        }

        int actedStep = submission.getCurrentStep();
        step.recordApproval(userId);
        appendComment(step, userId, commenterName, comment, now);

        SubmissionTransitionKind kind;
        if (!step.isQuorumMet()) {
            kind = SubmissionTransitionKind.APPROVAL_RECORDED;
        } else if (!submission.isLastStep()) {
            submission.setCurrentStep(actedStep + 1);
            kind = SubmissionTransitionKind.STEP_ADVANCED;
        } else {
            submission.setCurrentState(ApprovalStateEnum.APPROVED);
            submission.setFinalApprovedBy(userId);
            submission.setApprovalCompletedAt(now);
            kind = SubmissionTransitionKind.APPROVED;
        }
        submission.setUpdatedAt(now);
        return new SubmissionTransition(kind, submission, actedStep, userId, StringUtils.trimToNull(comment));
    }

    public SubmissionTransition reject(ContentSubmissionEntity current,
                                       String userId,
                                       String comment,
                                       String commenterName,
                                       LocalDateTime now) {
        requireText(userId, "userId");
        requireText(comment, "comment");
        ContentSubmissionEntity submission = current.copy();
        SubmissionStepEntity step = requireActionableStep(submission, userId);

        step.recordRejection(userId);
        appendComment(step, userId, commenterName, comment, now);
        submission.setCurrentState(ApprovalStateEnum.REJECTED);
        submission.setFinalRejectedBy(userId);
        submission.setApprovalCompletedAt(now);
        submission.setUpdatedAt(now);
        return new SubmissionTransition(SubmissionTransitionKind.REJECTED, submission,
                step.getStepNumber(), userId, comment.trim());
    }

    public SubmissionTransition requestChanges(ContentSubmissionEntity current,
                                               String userId,
                                               String comment,
                                               String commenterName,
                                               LocalDateTime now) {
        requireText(userId, "userId");
        requireText(comment, "comment");
        ContentSubmissionEntity submission = current.copy();
        SubmissionStepEntity step = requireActionableStep(submission, userId);

        appendComment(step, userId, commenterName, comment, now);
        submission.setCurrentState(ApprovalStateEnum.CHANGES_REQUESTED);
        submission.setUpdatedAt(now);
        return new SubmissionTransition(SubmissionTransitionKind.CHANGES_REQUESTED, submission,
                step.getStepNumber(), userId, comment.trim());
    }

    public SubmissionTransition publish(ContentSubmissionEntity current, String publishedBy, LocalDateTime now) {
        requireText(publishedBy, "publishedBy");
        if (!current.isApproved()) {
            throw AppException.of(ResponseCode.SUBMISSION_NOT_APPROVED,
                    "submission " + current.getId() + " is " + stateCode(current) + ", not approved");
        }
        ContentSubmissionEntity submission = current.copy();
        submission.setCurrentState(ApprovalStateEnum.PUBLISHED);
        submission.setPublishedAt(now);
        submission.setUpdatedAt(now);
        return new SubmissionTransition(SubmissionTransitionKind.PUBLISHED, submission,
                submission.getCurrentStep(), publishedBy, null);
    }

    /**
     * 用户是否为 pending 提交当前步骤的审批人。
     */
    public boolean isAwaitingApprover(ContentSubmissionEntity submission, String userId) {
        if (submission == null || !submission.isPending() || StringUtils.isBlank(userId)) {
            return false;
        }
        return submission.currentStepEntity().isApprover(userId);
    }

    private SubmissionStepEntity requireActionableStep(ContentSubmissionEntity submission, String userId) {
        if (!submission.isPending()) {
            throw AppException.of(ResponseCode.SUBMISSION_NOT_PENDING,
                    "submission " + submission.getId() + " is " + stateCode(submission) + ", not pending");
        }
        SubmissionStepEntity step = submission.currentStepEntity();
        if (!step.isApprover(userId)) {
            throw AppException.of(ResponseCode.NOT_AN_APPROVER,
                    "user " + userId + " is not an approver of step " + step.getStepNumber());
        }
        return step;
    }

    private void appendComment(SubmissionStepEntity step,
                               String userId,
                               String userName,
                               String comment,
                               LocalDateTime now) {
        String text = StringUtils.trimToNull(comment);
        if (text == null) {
            return;
        }
        step.addComment(StepCommentVO.builder()
                .userId(userId)
                .userName(userName)
                .comment(text)
                .createdAt(now)
                .build());
    }

    private String stateCode(ContentSubmissionEntity submission) {
        return submission.getCurrentState() == null ? "unknown" : submission.getCurrentState().getCode();
    }

    private void requireText(String value, String field) {
        if (StringUtils.isBlank(value)) {
            throw AppException.of(ResponseCode.MISSING_REQUIRED_FIELD, field + " is required");
        }
    }
}
