package com.contentflow.api.dto;

import lombok.Data;

/**
 * 停用审批流程请求 DTO。
 */
@Data
public class WorkflowDeactivateRequestDTO {

    private String operatorId;
}
