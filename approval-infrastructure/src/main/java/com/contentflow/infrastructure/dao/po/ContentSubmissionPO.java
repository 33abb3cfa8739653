package com.contentflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 内容提交 PO，对应 content_submissions 表。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentSubmissionPO {

    private Long id;
    private String organizationId;
    private Long workflowId;
    private String contentType;
    private String contentId;
    /** JSONB */
    private String contentData;
    private String submittedBy;
    private String submittedByName;
    private String currentState;
    private Integer currentStep;
    /** JSONB */
    private String steps;
    private String finalApprovedBy;
    private String finalRejectedBy;
    private LocalDateTime approvalCompletedAt;
    private LocalDateTime publishedAt;
    private Integer version;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
