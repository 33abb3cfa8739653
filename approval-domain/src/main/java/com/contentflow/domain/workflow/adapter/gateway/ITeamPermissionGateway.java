package com.contentflow.domain.workflow.adapter.gateway;

import com.contentflow.types.enums.TeamCapabilityEnum;

/**
 * 团队成员权限端口：判断用户在组织内的成员身份与能力项。
 */
public interface ITeamPermissionGateway {

    /**
     * 用户是否为组织的有效成员。
     *
     * @param userId 用户 ID
     * @param organizationId 组织 ID
     * @return 有效成员返回 true
     */
    boolean isActiveMember(String userId, String organizationId);

    /**
     * 用户在组织内是否具备指定能力。
     *
     * @param userId 用户 ID
     * @param organizationId 组织 ID
     * @param capability 能力项
     * @return 具备能力返回 true
     */
    boolean hasCapability(String userId, String organizationId, TeamCapabilityEnum capability);
}
