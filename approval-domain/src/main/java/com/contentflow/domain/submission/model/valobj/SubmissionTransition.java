package com.contentflow.domain.submission.model.valobj;

import com.contentflow.domain.submission.model.entity.ContentSubmissionEntity;

/**
 * 一次状态迁移的结果：迁移后的提交、动作所在步骤与评论。
 *
 * @param kind 迁移类别
 * @param submission 迁移后的提交
 * @param actedStep 动作发生的步骤序号
 * @param actorId 操作人
 * @param comment 评论，可为空
 */
public record SubmissionTransition(SubmissionTransitionKind kind,
                                   ContentSubmissionEntity submission,
                                   Integer actedStep,
                                   String actorId,
                                   String comment) {
}
