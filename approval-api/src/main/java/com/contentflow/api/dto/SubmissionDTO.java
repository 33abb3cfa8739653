package com.contentflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 内容审批提交 DTO。
 */
@Data
public class SubmissionDTO {

    private Long submissionId;
    private String organizationId;
    private Long workflowId;
    private String contentType;
    private String contentId;
    private Map<String, Object> contentData;
    private String submittedBy;
    private String submittedByName;
    private String currentState;
    private Integer currentStep;
    private List<SubmissionStepDTO> steps;
    private String finalApprovedBy;
    private String finalRejectedBy;
    private LocalDateTime approvalCompletedAt;
    private LocalDateTime publishedAt;
    private Integer version;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
