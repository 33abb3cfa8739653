package com.contentflow.infrastructure.dao;

import com.contentflow.infrastructure.dao.po.ActivityLogPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 团队操作日志 DAO
 */
@Mapper
public interface ActivityLogDao {

    int insert(ActivityLogPO po);

    List<ActivityLogPO> selectByOrganizationId(@Param("organizationId") String organizationId,
                                               @Param("limit") int limit);
}
