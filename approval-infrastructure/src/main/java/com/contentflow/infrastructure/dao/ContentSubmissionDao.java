package com.contentflow.infrastructure.dao;

import com.contentflow.infrastructure.dao.po.ContentSubmissionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 内容提交 DAO
 *
 * @author contentflow
 * @since 2026-03-02
 */
@Mapper
public interface ContentSubmissionDao {

    /**
     * 插入提交，回填 ID
     */
    int insert(ContentSubmissionPO po);

    /**
     * 根据 ID 更新 (带乐观锁，po.version 为期望版本)
     */
    int updateWithVersion(ContentSubmissionPO po);

    /**
     * 根据 ID 查询
     */
    ContentSubmissionPO selectById(@Param("id") Long id);

    /**
     * 查询组织下 pending 的提交
     */
    List<ContentSubmissionPO> selectPendingByOrganizationId(@Param("organizationId") String organizationId);

    /**
     * 按条件查询
     */
    List<ContentSubmissionPO> selectByFilter(@Param("organizationId") String organizationId,
                                             @Param("state") String state,
                                             @Param("contentType") String contentType,
                                             @Param("submittedBy") String submittedBy,
                                             @Param("limit") int limit);
}
