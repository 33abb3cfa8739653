package com.contentflow.trigger.application.common;

import com.contentflow.api.dto.ActivityLogDTO;
import com.contentflow.api.dto.StepCommentDTO;
import com.contentflow.api.dto.SubmissionDTO;
import com.contentflow.api.dto.SubmissionStepDTO;
import com.contentflow.api.dto.WorkflowDTO;
import com.contentflow.api.dto.WorkflowStepDTO;
import com.contentflow.domain.activity.model.entity.ActivityLogEntity;
import com.contentflow.domain.submission.model.entity.ContentSubmissionEntity;
import com.contentflow.domain.submission.model.entity.SubmissionStepEntity;
import com.contentflow.domain.submission.model.valobj.StepCommentVO;
import com.contentflow.domain.workflow.model.entity.ApprovalWorkflowEntity;
import com.contentflow.domain.workflow.model.valobj.WorkflowStepVO;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 审批视图组装器：领域实体转换为接口 DTO。
 */
@Component
public class ApprovalViewAssembler {

    public WorkflowDTO toWorkflowDTO(ApprovalWorkflowEntity workflow) {
        WorkflowDTO dto = new WorkflowDTO();
        dto.setWorkflowId(workflow.getId());
        dto.setOrganizationId(workflow.getOrganizationId());
        dto.setName(workflow.getName());
        dto.setDescription(workflow.getDescription());
        dto.setType(workflow.getType() == null ? null : workflow.getType().getCode());
        dto.setSteps(workflow.getSteps().stream().map(this::toWorkflowStepDTO).collect(Collectors.toList()));
        dto.setIsActive(workflow.getIsActive());
        dto.setCreatedBy(workflow.getCreatedBy());
        dto.setCreatedAt(workflow.getCreatedAt());
        dto.setUpdatedAt(workflow.getUpdatedAt());
        return dto;
    }

    public SubmissionDTO toSubmissionDTO(ContentSubmissionEntity submission) {
        SubmissionDTO dto = new SubmissionDTO();
        dto.setSubmissionId(submission.getId());
        dto.setOrganizationId(submission.getOrganizationId());
        dto.setWorkflowId(submission.getWorkflowId());
        dto.setContentType(submission.getContentType() == null ? null : submission.getContentType().getCode());
        dto.setContentId(submission.getContentId());
        dto.setContentData(submission.getContentData() == null ? new HashMap<>() : new HashMap<>(submission.getContentData()));
        dto.setSubmittedBy(submission.getSubmittedBy());
        dto.setSubmittedByName(submission.getSubmittedByName());
        dto.setCurrentState(submission.getCurrentState() == null ? null : submission.getCurrentState().getCode());
        dto.setCurrentStep(submission.getCurrentStep());
        dto.setSteps(submission.getSteps().stream().map(this::toSubmissionStepDTO).collect(Collectors.toList()));
        dto.setFinalApprovedBy(submission.getFinalApprovedBy());
        dto.setFinalRejectedBy(submission.getFinalRejectedBy());
        dto.setApprovalCompletedAt(submission.getApprovalCompletedAt());
        dto.setPublishedAt(submission.getPublishedAt());
        dto.setVersion(submission.getVersion());
        dto.setCreatedAt(submission.getCreatedAt());
        dto.setUpdatedAt(submission.getUpdatedAt());
        return dto;
    }

    public ActivityLogDTO toActivityLogDTO(ActivityLogEntity activity) {
        ActivityLogDTO dto = new ActivityLogDTO();
        dto.setActivityId(activity.getId());
        dto.setOrganizationId(activity.getOrganizationId());
        dto.setUserId(activity.getUserId());
        dto.setUserName(activity.getUserName());
        dto.setAction(activity.getAction() == null ? null : activity.getAction().getCode());
        dto.setResource(activity.getResource());
        dto.setResourceId(activity.getResourceId());
        dto.setDetails(new HashMap<>(activity.getDetails()));
        dto.setCreatedAt(activity.getCreatedAt());
        return dto;
    }

    private WorkflowStepDTO toWorkflowStepDTO(WorkflowStepVO step) {
        WorkflowStepDTO dto = new WorkflowStepDTO();
        dto.setStepNumber(step.getStepNumber());
        dto.setApproverIds(new ArrayList<>(step.getApproverIds()));
        dto.setRequiredApprovals(step.getRequiredApprovals());
        return dto;
    }

    private SubmissionStepDTO toSubmissionStepDTO(SubmissionStepEntity step) {
        SubmissionStepDTO dto = new SubmissionStepDTO();
        dto.setStepNumber(step.getStepNumber());
        dto.setApproverIds(new ArrayList<>(step.getApproverIds()));
        dto.setRequiredApprovals(step.getRequiredApprovals());
        dto.setApprovedBy(new ArrayList<>(step.getApprovedBy()));
        dto.setRejectedBy(step.getRejectedBy());
        List<StepCommentDTO> comments = new ArrayList<>();
        for (StepCommentVO comment : step.getComments()) {
            StepCommentDTO commentDTO = new StepCommentDTO();
            commentDTO.setUserId(comment.getUserId());
            commentDTO.setUserName(comment.getUserName());
            commentDTO.setComment(comment.getComment());
            commentDTO.setCreatedAt(comment.getCreatedAt());
            comments.add(commentDTO);
        }
        dto.setComments(comments);
        return dto;
    }
}
