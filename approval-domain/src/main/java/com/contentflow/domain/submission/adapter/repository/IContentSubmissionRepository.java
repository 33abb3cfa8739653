package com.contentflow.domain.submission.adapter.repository;

import com.contentflow.domain.submission.model.entity.ContentSubmissionEntity;
import com.contentflow.domain.submission.model.valobj.SubmissionFilter;

import java.util.List;

/**
 * 内容提交仓储接口
 *
 * @author contentflow
 * @since 2026-03-02
 */
public interface IContentSubmissionRepository {

    /**
     * 保存提交，返回带 ID 的实体
     */
    ContentSubmissionEntity save(ContentSubmissionEntity entity);

    /**
     * 按版本号更新 (乐观锁)。
     * <p>
     * 仅当存储中的版本等于 {@code entity.version} 时写入，成功后实体版本号加一。
     * </p>
     *
     * @return 版本不一致返回 false
     */
    boolean updateWithVersion(ContentSubmissionEntity entity);

    /**
     * 根据 ID 查询
     */
    ContentSubmissionEntity findById(Long id);

    /**
     * 查询组织下 pending 的提交，按创建时间倒序
     */
    List<ContentSubmissionEntity> findPendingByOrganizationId(String organizationId);

    /**
     * 按条件查询，按创建时间倒序
     */
    List<ContentSubmissionEntity> findByFilter(SubmissionFilter filter);
}
