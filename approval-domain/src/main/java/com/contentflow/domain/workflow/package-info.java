/**
 * Workflow 领域 - 审批流程定义域
 *
 * <p>职责：审批链模板的创建、查询与停用</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>审批流程：组织内可复用的审批链模板，类型为单人、顺序或并行会签</li>
 *   <li>审批步骤：按序号排列的审批人分组，所需审批数由流程类型推导</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.contentflow.domain.workflow.model.entity.ApprovalWorkflowEntity}</li>
 * </ul>
 *
 * @author contentflow
 * @since 2026-03-02
 */
package com.contentflow.domain.workflow;
