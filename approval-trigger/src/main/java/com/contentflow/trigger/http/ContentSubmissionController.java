package com.contentflow.trigger.http;

import com.contentflow.api.dto.SubmissionActionRequestDTO;
import com.contentflow.api.dto.SubmissionCreateRequestDTO;
import com.contentflow.api.dto.SubmissionDTO;
import com.contentflow.api.dto.SubmissionPublishRequestDTO;
import com.contentflow.api.response.Response;
import com.contentflow.trigger.application.command.SubmissionCommandService;
import com.contentflow.trigger.application.query.SubmissionQueryService;
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
 * 内容审批提交 API。
 */
@RestController
@RequestMapping("/api/submissions")
public class ContentSubmissionController {

    private final SubmissionCommandService submissionCommandService;
    private final SubmissionQueryService submissionQueryService;

    public ContentSubmissionController(SubmissionCommandService submissionCommandService,
                                       SubmissionQueryService submissionQueryService) {
        this.submissionCommandService = submissionCommandService;
        this.submissionQueryService = submissionQueryService;
    }

    @PostMapping
    public Response<SubmissionDTO> submitForApproval(@RequestBody SubmissionCreateRequestDTO request) {
        return success(submissionCommandService.submitForApproval(
                request.getOrganizationId(),
                request.getWorkflowId(),
                request.getContentType(),
                request.getContentData(),
                request.getSubmittedBy(),
                request.getContentId()));
    }

    @GetMapping("/{id}")
    public Response<SubmissionDTO> getSubmission(@PathVariable("id") Long submissionId) {
        return success(submissionQueryService.getSubmission(submissionId));
    }

    @GetMapping
    public Response<List<SubmissionDTO>> getSubmissions(
            @RequestParam("organizationId") String organizationId,
            @RequestParam(value = "state", required = false) String state,
            @RequestParam(value = "contentType", required = false) String contentType,
            @RequestParam(value = "submittedBy", required = false) String submittedBy,
            @RequestParam(value = "limit", required = false) Integer limit) {
        return success(submissionQueryService.getSubmissions(organizationId, state, contentType, submittedBy, limit));
    }

    @GetMapping("/pending")
    public Response<List<SubmissionDTO>> getPendingSubmissions(@RequestParam("organizationId") String organizationId,
                                                               @RequestParam("userId") String userId) {
        return success(submissionQueryService.getPendingSubmissions(userId, organizationId));
    }

    @PostMapping("/{id}/approve")
    public Response<SubmissionDTO> approve(@PathVariable("id") Long submissionId,
                                           @RequestBody SubmissionActionRequestDTO request) {
        return success(submissionCommandService.approveContent(submissionId, request.getUserId(), request.getComment()));
    }

    @PostMapping("/{id}/reject")
    public Response<SubmissionDTO> reject(@PathVariable("id") Long submissionId,
                                          @RequestBody SubmissionActionRequestDTO request) {
        return success(submissionCommandService.rejectContent(submissionId, request.getUserId(), request.getComment()));
    }

    @PostMapping("/{id}/request-changes")
    public Response<SubmissionDTO> requestChanges(@PathVariable("id") Long submissionId,
                                                  @RequestBody SubmissionActionRequestDTO request) {
        return success(submissionCommandService.requestChanges(submissionId, request.getUserId(), request.getComment()));
    }

    @PostMapping("/{id}/publish")
    public Response<SubmissionDTO> markAsPublished(@PathVariable("id") Long submissionId,
                                                   @RequestBody SubmissionPublishRequestDTO request) {
        return success(submissionCommandService.markAsPublished(submissionId, request.getPublishedBy()));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
