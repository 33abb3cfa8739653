package com.contentflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 团队成员 PO，对应 team_members 表（只读）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamMemberPO {

    private Long id;
    private String organizationId;
    private String userId;
    private String role;
    /** active / invited / removed */
    private String status;
    private Boolean canApproveContent;
}
