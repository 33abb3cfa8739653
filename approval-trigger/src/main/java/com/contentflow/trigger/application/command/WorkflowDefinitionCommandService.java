package com.contentflow.trigger.application.command;

import com.contentflow.api.dto.WorkflowDTO;
import com.contentflow.domain.workflow.adapter.repository.IApprovalWorkflowRepository;
import com.contentflow.domain.workflow.model.entity.ApprovalWorkflowEntity;
import com.contentflow.domain.workflow.service.WorkflowDefinitionDomainService;
import com.contentflow.trigger.application.common.ApprovalViewAssembler;
import com.contentflow.types.common.Constants;
import com.contentflow.types.enums.ActivityActionEnum;
import com.contentflow.types.enums.ResponseCode;
import com.contentflow.types.enums.WorkflowTypeEnum;
import com.contentflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 审批流程写用例：创建与停用流程。
 */
@Slf4j
@Service
public class WorkflowDefinitionCommandService {

    private final IApprovalWorkflowRepository approvalWorkflowRepository;
    private final WorkflowDefinitionDomainService workflowDefinitionDomainService;
    private final ActivityLogCommandService activityLogCommandService;
    private final ApprovalViewAssembler approvalViewAssembler;
    private final Clock clock;

    public WorkflowDefinitionCommandService(IApprovalWorkflowRepository approvalWorkflowRepository,
                                            WorkflowDefinitionDomainService workflowDefinitionDomainService,
                                            ActivityLogCommandService activityLogCommandService,
                                            ApprovalViewAssembler approvalViewAssembler,
                                            Clock clock) {
        this.approvalWorkflowRepository = approvalWorkflowRepository;
        this.workflowDefinitionDomainService = workflowDefinitionDomainService;
        this.activityLogCommandService = activityLogCommandService;
        this.approvalViewAssembler = approvalViewAssembler;
        this.clock = clock;
    }

    public WorkflowDTO createWorkflow(String organizationId,
                                      String name,
                                      String typeCode,
                                      List<List<String>> approverGroups,
                                      String createdBy,
                                      String description) {
        WorkflowTypeEnum type = parseType(typeCode);
        ApprovalWorkflowEntity workflow = workflowDefinitionDomainService.buildWorkflow(
                organizationId, name, type, approverGroups, createdBy, description, LocalDateTime.now(clock));
        ApprovalWorkflowEntity saved = approvalWorkflowRepository.save(workflow);
        log.info("WORKFLOW_CREATED workflowId={}, organizationId={}, type={}, steps={}",
                saved.getId(), saved.getOrganizationId(), saved.getType().getCode(), saved.stepCount());

        Map<String, Object> details = new HashMap<>();
        details.put(Constants.DETAIL_NAME, saved.getName());
        details.put(Constants.DETAIL_TYPE, saved.getType().getCode());
        activityLogCommandService.logActivity(saved.getOrganizationId(), saved.getCreatedBy(),
                ActivityActionEnum.WORKFLOW_CREATED, Constants.RESOURCE_WORKFLOW, String.valueOf(saved.getId()), details);
        return toDTO(saved);
    }

    /**
     * 停用流程（软删除）。已停用的流程直接返回，不重复记录日志。
     */
    public WorkflowDTO deactivateWorkflow(Long workflowId, String operatorId) {
        ApprovalWorkflowEntity workflow = approvalWorkflowRepository.findById(workflowId);
        if (workflow == null) {
            throw AppException.of(ResponseCode.WORKFLOW_NOT_FOUND, "审批流程不存在");
        }
        if (!workflow.deactivate(LocalDateTime.now(clock))) {
            return toDTO(workflow);
        }
        approvalWorkflowRepository.update(workflow);
        log.info("WORKFLOW_DEACTIVATED workflowId={}, organizationId={}, operatorId={}",
                workflow.getId(), workflow.getOrganizationId(), operatorId);

        Map<String, Object> details = new HashMap<>();
        details.put(Constants.DETAIL_NAME, workflow.getName());
        activityLogCommandService.logActivity(workflow.getOrganizationId(), operatorId,
                ActivityActionEnum.WORKFLOW_DELETED, Constants.RESOURCE_WORKFLOW, String.valueOf(workflow.getId()), details);
        return toDTO(workflow);
    }

    private WorkflowDTO toDTO(ApprovalWorkflowEntity workflow) {
        return approvalViewAssembler.toWorkflowDTO(workflow);
    }

    private WorkflowTypeEnum parseType(String typeCode) {
        if (StringUtils.isBlank(typeCode)) {
            throw AppException.of(ResponseCode.MISSING_REQUIRED_FIELD, "type is required");
        }
        try {
            return WorkflowTypeEnum.fromCode(typeCode);
        } catch (IllegalArgumentException ex) {
            throw AppException.of(ResponseCode.ILLEGAL_PARAMETER, ex.getMessage());
        }
    }
}
