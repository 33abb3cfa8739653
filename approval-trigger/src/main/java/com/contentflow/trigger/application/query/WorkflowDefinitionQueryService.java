package com.contentflow.trigger.application.query;

import com.contentflow.api.dto.WorkflowDTO;
import com.contentflow.domain.workflow.adapter.repository.IApprovalWorkflowRepository;
import com.contentflow.domain.workflow.model.entity.ApprovalWorkflowEntity;
import com.contentflow.trigger.application.common.ApprovalViewAssembler;
import com.contentflow.types.enums.ResponseCode;
import com.contentflow.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 审批流程查询用例。
 */
@Service
public class WorkflowDefinitionQueryService {

    private final IApprovalWorkflowRepository approvalWorkflowRepository;
    private final ApprovalViewAssembler approvalViewAssembler;

    public WorkflowDefinitionQueryService(IApprovalWorkflowRepository approvalWorkflowRepository,
                                          ApprovalViewAssembler approvalViewAssembler) {
        this.approvalWorkflowRepository = approvalWorkflowRepository;
        this.approvalViewAssembler = approvalViewAssembler;
    }

    public WorkflowDTO getWorkflow(Long workflowId) {
        ApprovalWorkflowEntity workflow = workflowId == null ? null : approvalWorkflowRepository.findById(workflowId);
        if (workflow == null) {
            throw AppException.of(ResponseCode.WORKFLOW_NOT_FOUND, "审批流程不存在");
        }
        return approvalViewAssembler.toWorkflowDTO(workflow);
    }

    /**
     * 组织下启用的流程，按创建时间倒序。
     */
    public List<WorkflowDTO> listWorkflows(String organizationId) {
        if (StringUtils.isBlank(organizationId)) {
            throw AppException.of(ResponseCode.MISSING_REQUIRED_FIELD, "organizationId is required");
        }
        return approvalWorkflowRepository.findActiveByOrganizationId(organizationId).stream()
                .filter(ApprovalWorkflowEntity::isActive)
                .sorted(Comparator.comparing(ApprovalWorkflowEntity::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .map(approvalViewAssembler::toWorkflowDTO)
                .collect(Collectors.toList());
    }
}
