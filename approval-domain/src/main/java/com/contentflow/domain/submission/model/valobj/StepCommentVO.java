package com.contentflow.domain.submission.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 审批步骤评论值对象。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepCommentVO {

    private String userId;

    /**
     * 评论时解析的显示名，解析失败为空
     */
    private String userName;

    private String comment;

    private LocalDateTime createdAt;
}
