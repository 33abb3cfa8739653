package com.contentflow.domain.workflow.service;

import com.contentflow.domain.workflow.adapter.gateway.ITeamPermissionGateway;
import com.contentflow.domain.workflow.model.entity.ApprovalWorkflowEntity;
import com.contentflow.domain.workflow.model.valobj.WorkflowStepVO;
import com.contentflow.types.enums.ResponseCode;
import com.contentflow.types.enums.TeamCapabilityEnum;
import com.contentflow.types.enums.WorkflowTypeEnum;
import com.contentflow.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 审批流程定义领域服务：校验入参、规范化审批人分组并构建流程实体。
 * <p>
 * 所有校验都在构建实体之前完成，校验失败时不产生任何写入。
 * </p>
 */
@Service
public class WorkflowDefinitionDomainService {

    private final ITeamPermissionGateway teamPermissionGateway;

    public WorkflowDefinitionDomainService(ITeamPermissionGateway teamPermissionGateway) {
        this.teamPermissionGateway = teamPermissionGateway;
    }

    public ApprovalWorkflowEntity buildWorkflow(String organizationId,
                                                String name,
                                                WorkflowTypeEnum type,
                                                List<List<String>> approverGroups,
                                                String createdBy,
                                                String description,
                                                LocalDateTime now) {
        requireText(organizationId, "organizationId");
        requireText(name, "name");
        requireText(createdBy, "createdBy");
        if (type == null) {
            throw AppException.of(ResponseCode.MISSING_REQUIRED_FIELD, "type is required");
        }
        if (approverGroups == null || approverGroups.isEmpty()) {
            throw AppException.of(ResponseCode.MISSING_REQUIRED_FIELD, "approverGroups is required");
        }

        List<List<String>> normalizedGroups = new ArrayList<>(approverGroups.size());
        for (int i = 0; i < approverGroups.size(); i++) {
            List<String> group = normalizeGroup(approverGroups.get(i));
            if (group.isEmpty()) {
                throw AppException.of(ResponseCode.EMPTY_APPROVER_GROUP,
                        "approver group " + (i + 1) + " is empty");
            }
            normalizedGroups.add(group);
        }
        for (List<String> group : normalizedGroups) {
            for (String approverId : group) {
                ensureAuthorizedApprover(approverId, organizationId.trim());
            }
        }

        ApprovalWorkflowEntity entity = new ApprovalWorkflowEntity();
        entity.setOrganizationId(organizationId.trim());
        entity.setName(name.trim());
        entity.setDescription(StringUtils.trimToNull(description));
        entity.setType(type);
        entity.setSteps(buildSteps(type, normalizedGroups));
        entity.setIsActive(true);
        entity.setCreatedBy(createdBy.trim());
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        entity.validate();
        return entity;
    }

    public List<WorkflowStepVO> buildSteps(WorkflowTypeEnum type, List<List<String>> approverGroups) {
        List<WorkflowStepVO> steps = new ArrayList<>(approverGroups.size());
        for (int i = 0; i < approverGroups.size(); i++) {
            List<String> approverIds = new ArrayList<>(approverGroups.get(i));
            steps.add(WorkflowStepVO.builder()
                    .stepNumber(i + 1)
                    .approverIds(approverIds)
                    .requiredApprovals(type.requiredApprovals(approverIds.size()))
                    .build());
        }
        return steps;
    }

    private List<String> normalizeGroup(List<String> group) {
        if (group == null) {
            return new ArrayList<>();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String approverId : group) {
            String trimmed = StringUtils.trimToNull(approverId);
            if (trimmed != null) {
                unique.add(trimmed);
            }
        }
        return new ArrayList<>(unique);
    }

    private void ensureAuthorizedApprover(String approverId, String organizationId) {
        if (!teamPermissionGateway.isActiveMember(approverId, organizationId)) {
            throw AppException.of(ResponseCode.UNAUTHORIZED_APPROVER,
                    "approver " + approverId + " is not an active member of the organization");
        }
        if (!teamPermissionGateway.hasCapability(approverId, organizationId, TeamCapabilityEnum.APPROVE_CONTENT)) {
            throw AppException.of(ResponseCode.UNAUTHORIZED_APPROVER,
                    "approver " + approverId + " lacks approve_content permission");
        }
    }

    private void requireText(String value, String field) {
        if (StringUtils.isBlank(value)) {
            throw AppException.of(ResponseCode.MISSING_REQUIRED_FIELD, field + " is required");
        }
    }
}
