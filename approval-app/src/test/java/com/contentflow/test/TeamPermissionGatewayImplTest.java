package com.contentflow.test;

import com.contentflow.infrastructure.dao.TeamMemberDao;
import com.contentflow.infrastructure.dao.po.TeamMemberPO;
import com.contentflow.infrastructure.gateway.TeamPermissionGatewayImpl;
import com.contentflow.types.enums.TeamCapabilityEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TeamPermissionGatewayImplTest {

    private final TeamMemberDao teamMemberDao = mock(TeamMemberDao.class);
    private final TeamPermissionGatewayImpl gateway = new TeamPermissionGatewayImpl(teamMemberDao);

    @Test
    public void shouldGrantApproveContentToActiveApprover() {
        when(teamMemberDao.selectByOrganizationIdAndUserId("org-1", "alice")).thenReturn(member("active", true));

        Assertions.assertTrue(gateway.isActiveMember("alice", "org-1"));
        Assertions.assertTrue(gateway.hasCapability("alice", "org-1", TeamCapabilityEnum.APPROVE_CONTENT));
    }

    @Test
    public void shouldDenyMemberWithoutApprovePermission() {
        when(teamMemberDao.selectByOrganizationIdAndUserId("org-1", "erin")).thenReturn(member("active", false));

        Assertions.assertTrue(gateway.isActiveMember("erin", "org-1"));
        Assertions.assertFalse(gateway.hasCapability("erin", "org-1", TeamCapabilityEnum.APPROVE_CONTENT));
    }

    @Test
    public void shouldTreatInvitedOrMissingMemberAsNotAuthorized() {
        when(teamMemberDao.selectByOrganizationIdAndUserId("org-1", "bob")).thenReturn(member("invited", true));

        Assertions.assertFalse(gateway.isActiveMember("bob", "org-1"));
        Assertions.assertFalse(gateway.hasCapability("bob", "org-1", TeamCapabilityEnum.APPROVE_CONTENT));
        Assertions.assertFalse(gateway.isActiveMember("mallory", "org-1"));
    }

    @Test
    public void shouldSkipLookupForBlankIdentifiers() {
        Assertions.assertFalse(gateway.isActiveMember(" ", "org-1"));
        Assertions.assertFalse(gateway.hasCapability("alice", null, TeamCapabilityEnum.APPROVE_CONTENT));
        verify(teamMemberDao, never()).selectByOrganizationIdAndUserId(anyString(), anyString());
    }

    private TeamMemberPO member(String status, boolean canApproveContent) {
        return TeamMemberPO.builder()
                .organizationId("org-1")
                .role("editor")
                .status(status)
                .canApproveContent(canApproveContent)
                .build();
    }
}
