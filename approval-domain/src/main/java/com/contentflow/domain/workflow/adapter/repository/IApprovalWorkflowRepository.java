package com.contentflow.domain.workflow.adapter.repository;

import com.contentflow.domain.workflow.model.entity.ApprovalWorkflowEntity;

import java.util.List;

/**
 * 审批流程仓储接口
 *
 * @author contentflow
 * @since 2026-03-02
 */
public interface IApprovalWorkflowRepository {

    /**
     * 保存流程定义，返回带 ID 的实体
     */
    ApprovalWorkflowEntity save(ApprovalWorkflowEntity entity);

    /**
     * 更新流程定义（名称、描述、启用状态）
     */
    ApprovalWorkflowEntity update(ApprovalWorkflowEntity entity);

    /**
     * 根据 ID 查询
     */
    ApprovalWorkflowEntity findById(Long id);

    /**
     * 查询组织下启用的流程，按创建时间倒序
     */
    List<ApprovalWorkflowEntity> findActiveByOrganizationId(String organizationId);
}
