package com.contentflow.trigger.http;

import com.contentflow.api.dto.WorkflowCreateRequestDTO;
import com.contentflow.api.dto.WorkflowDTO;
import com.contentflow.api.dto.WorkflowDeactivateRequestDTO;
import com.contentflow.api.response.Response;
import com.contentflow.trigger.application.command.WorkflowDefinitionCommandService;
import com.contentflow.trigger.application.query.WorkflowDefinitionQueryService;
import com.contentflow.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 审批流程定义 API。
 */
@RestController
@RequestMapping("/api/workflows")
public class ApprovalWorkflowController {

    private final WorkflowDefinitionCommandService workflowDefinitionCommandService;
    private final WorkflowDefinitionQueryService workflowDefinitionQueryService;

    public ApprovalWorkflowController(WorkflowDefinitionCommandService workflowDefinitionCommandService,
                                      WorkflowDefinitionQueryService workflowDefinitionQueryService) {
        this.workflowDefinitionCommandService = workflowDefinitionCommandService;
        this.workflowDefinitionQueryService = workflowDefinitionQueryService;
    }

    @PostMapping
    public Response<WorkflowDTO> createWorkflow(@RequestBody WorkflowCreateRequestDTO request) {
        return success(workflowDefinitionCommandService.createWorkflow(
                request.getOrganizationId(),
                request.getName(),
                request.getType(),
                request.getApproverGroups(),
                request.getCreatedBy(),
                request.getDescription()));
    }

    @GetMapping("/{id}")
    public Response<WorkflowDTO> getWorkflow(@PathVariable("id") Long workflowId) {
        return success(workflowDefinitionQueryService.getWorkflow(workflowId));
    }

    @GetMapping
    public Response<List<WorkflowDTO>> listWorkflows(@RequestParam("organizationId") String organizationId) {
        return success(workflowDefinitionQueryService.listWorkflows(organizationId));
    }

    @PostMapping("/{id}/deactivate")
    public Response<WorkflowDTO> deactivateWorkflow(@PathVariable("id") Long workflowId,
                                                    @RequestBody(required = false) WorkflowDeactivateRequestDTO request) {
        String operatorId = request == null ? null : request.getOperatorId();
        return success(workflowDefinitionCommandService.deactivateWorkflow(workflowId, operatorId));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
