package com.contentflow.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 提交内容审批请求 DTO。
 */
@Data
public class SubmissionCreateRequestDTO {

    private String organizationId;
    private Long workflowId;
    /** post / campaign / media */
    private String contentType;
    private String contentId;
    private Map<String, Object> contentData;
    private String submittedBy;
}
