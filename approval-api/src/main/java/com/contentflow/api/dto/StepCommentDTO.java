package com.contentflow.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 审批评论 DTO。
 */
@Data
public class StepCommentDTO {

    private String userId;
    private String userName;
    private String comment;
    private LocalDateTime createdAt;
}
