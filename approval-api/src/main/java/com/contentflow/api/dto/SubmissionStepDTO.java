package com.contentflow.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 提交审批步骤 DTO。
 */
@Data
public class SubmissionStepDTO {

    private Integer stepNumber;
    private List<String> approverIds;
    private Integer requiredApprovals;
    private List<String> approvedBy;
    private String rejectedBy;
    private List<StepCommentDTO> comments;
}
