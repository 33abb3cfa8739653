/**
 * Submission 领域 - 内容审批状态机
 *
 * <p>职责：内容提交、逐步审批、驳回、要求修改与发布确认</p>
 *
 * <h3>状态迁移</h3>
 * <ul>
 *   <li>提交后进入 pending，当前步骤为 1</li>
 *   <li>当前步骤达到所需审批数后推进到下一步，最后一步完成时进入 approved</li>
 *   <li>pending 状态下可驳回（rejected，终态）或要求修改（changes_requested）</li>
 *   <li>approved 确认发布后进入 published（终态）</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.contentflow.domain.submission.model.entity.ContentSubmissionEntity}</li>
 * </ul>
 *
 * @author contentflow
 * @since 2026-03-02
 */
package com.contentflow.domain.submission;
