package com.contentflow.infrastructure.repository.activity;

import com.contentflow.domain.activity.adapter.repository.IActivityLogRepository;
import com.contentflow.domain.activity.model.entity.ActivityLogEntity;
import com.contentflow.infrastructure.dao.ActivityLogDao;
import com.contentflow.infrastructure.dao.po.ActivityLogPO;
import com.contentflow.infrastructure.util.JsonCodec;
import com.contentflow.types.enums.ActivityActionEnum;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 团队操作日志仓储实现类。
 */
@Repository
public class ActivityLogRepositoryImpl implements IActivityLogRepository {

    private final ActivityLogDao activityLogDao;
    private final JsonCodec jsonCodec;

    public ActivityLogRepositoryImpl(ActivityLogDao activityLogDao, JsonCodec jsonCodec) {
        this.activityLogDao = activityLogDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public ActivityLogEntity save(ActivityLogEntity entity) {
        entity.validate();
        ActivityLogPO po = ActivityLogPO.builder()
                .organizationId(entity.getOrganizationId())
                .userId(entity.getUserId())
                .userName(entity.getUserName())
                .action(entity.getAction().getCode())
                .resource(entity.getResource())
                .resourceId(entity.getResourceId())
                .details(jsonCodec.writeValue(entity.getDetails()))
                .createdAt(entity.getCreatedAt())
                .build();
        activityLogDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public List<ActivityLogEntity> findByOrganizationId(String organizationId, int limit) {
        return activityLogDao.selectByOrganizationId(organizationId, limit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private ActivityLogEntity toEntity(ActivityLogPO po) {
        ActivityLogEntity entity = new ActivityLogEntity();
        entity.setId(po.getId());
        entity.setOrganizationId(po.getOrganizationId());
        entity.setUserId(po.getUserId());
        entity.setUserName(po.getUserName());
        entity.setAction(ActivityActionEnum.fromCode(po.getAction()));
        entity.setResource(po.getResource());
        entity.setResourceId(po.getResourceId());
        if (po.getDetails() != null) {
            entity.setDetails(jsonCodec.readMap(po.getDetails()));
        }
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
