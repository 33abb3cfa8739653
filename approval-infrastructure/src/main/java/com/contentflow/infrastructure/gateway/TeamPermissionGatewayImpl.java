package com.contentflow.infrastructure.gateway;

import com.contentflow.domain.workflow.adapter.gateway.ITeamPermissionGateway;
import com.contentflow.infrastructure.dao.TeamMemberDao;
import com.contentflow.infrastructure.dao.po.TeamMemberPO;
import com.contentflow.types.enums.TeamCapabilityEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * 基于 team_members 表的成员权限查询。
 */
@Component
public class TeamPermissionGatewayImpl implements ITeamPermissionGateway {

    private static final String MEMBER_STATUS_ACTIVE = "active";

    private final TeamMemberDao teamMemberDao;

    public TeamPermissionGatewayImpl(TeamMemberDao teamMemberDao) {
        this.teamMemberDao = teamMemberDao;
    }

    @Override
    public boolean isActiveMember(String userId, String organizationId) {
        return findActiveMember(userId, organizationId) != null;
    }

    @Override
    public boolean hasCapability(String userId, String organizationId, TeamCapabilityEnum capability) {
        TeamMemberPO member = findActiveMember(userId, organizationId);
        if (member == null || capability == null) {
            return false;
        }
        if (capability == TeamCapabilityEnum.APPROVE_CONTENT) {
            return Boolean.TRUE.equals(member.getCanApproveContent());
        }
        return false;
    }

    private TeamMemberPO findActiveMember(String userId, String organizationId) {
        if (StringUtils.isAnyBlank(userId, organizationId)) {
            return null;
        }
        TeamMemberPO member = teamMemberDao.selectByOrganizationIdAndUserId(organizationId, userId);
        if (member == null || !MEMBER_STATUS_ACTIVE.equalsIgnoreCase(member.getStatus())) {
            return null;
        }
        return member;
    }
}
