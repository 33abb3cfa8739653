package com.contentflow.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 创建审批流程请求 DTO。
 */
@Data
public class WorkflowCreateRequestDTO {

    private String organizationId;
    private String name;
    private String description;
    /** simple / sequential / parallel */
    private String type;
    /** 按步骤顺序排列的审批人分组 */
    private List<List<String>> approverGroups;
    private String createdBy;
}
