package com.contentflow.infrastructure.dao;

import com.contentflow.infrastructure.dao.po.TeamMemberPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 团队成员 DAO
 */
@Mapper
public interface TeamMemberDao {

    /**
     * 查询用户在组织中的成员记录
     */
    TeamMemberPO selectByOrganizationIdAndUserId(@Param("organizationId") String organizationId,
                                                 @Param("userId") String userId);
}
