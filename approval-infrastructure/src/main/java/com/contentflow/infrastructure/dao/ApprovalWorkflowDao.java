package com.contentflow.infrastructure.dao;

import com.contentflow.infrastructure.dao.po.ApprovalWorkflowPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 审批流程 DAO
 *
 * @author contentflow
 * @since 2026-03-02
 */
@Mapper
public interface ApprovalWorkflowDao {

    /**
     * 插入流程，回填 ID
     */
    int insert(ApprovalWorkflowPO po);

    /**
     * 更新名称、描述与启用状态
     */
    int update(ApprovalWorkflowPO po);

    /**
     * 根据 ID 查询
     */
    ApprovalWorkflowPO selectById(@Param("id") Long id);

    /**
     * 查询组织下启用的流程
     */
    List<ApprovalWorkflowPO> selectActiveByOrganizationId(@Param("organizationId") String organizationId);
}
