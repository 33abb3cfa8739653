package com.contentflow.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 审批流程步骤 DTO。
 */
@Data
public class WorkflowStepDTO {

    private Integer stepNumber;
    private List<String> approverIds;
    private Integer requiredApprovals;
}
