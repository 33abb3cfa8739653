package com.contentflow.domain.activity.adapter.repository;

import com.contentflow.domain.activity.model.entity.ActivityLogEntity;

import java.util.List;

/**
 * 团队操作日志仓储接口
 */
public interface IActivityLogRepository {

    /**
     * 追加日志
     */
    ActivityLogEntity save(ActivityLogEntity entity);

    /**
     * 查询组织最近的日志，按创建时间倒序
     */
    List<ActivityLogEntity> findByOrganizationId(String organizationId, int limit);
}
