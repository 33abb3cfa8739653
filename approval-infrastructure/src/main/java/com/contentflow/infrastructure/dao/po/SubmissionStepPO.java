package com.contentflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * content_submissions.steps 中单个步骤的 JSON 结构。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionStepPO {

    private Integer stepNumber;
    private List<String> approverIds;
    private Integer requiredApprovals;
    private List<String> approvedBy;
    private String rejectedBy;
    private List<Comment> comments;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Comment {
        private String userId;
        private String userName;
        private String comment;
        private LocalDateTime createdAt;
    }
}
