package com.contentflow.trigger.application.query;

import com.contentflow.api.dto.SubmissionDTO;
import com.contentflow.domain.submission.adapter.repository.IContentSubmissionRepository;
import com.contentflow.domain.submission.model.entity.ContentSubmissionEntity;
import com.contentflow.domain.submission.model.valobj.SubmissionFilter;
import com.contentflow.domain.submission.service.SubmissionTransitionDomainService;
import com.contentflow.trigger.application.common.ApprovalViewAssembler;
import com.contentflow.types.common.Constants;
import com.contentflow.types.enums.ApprovalStateEnum;
import com.contentflow.types.enums.ContentTypeEnum;
import com.contentflow.types.enums.ResponseCode;
import com.contentflow.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 内容审批查询用例。
 */
@Service
public class SubmissionQueryService {

    private static final Comparator<ContentSubmissionEntity> NEWEST_FIRST = Comparator.comparing(
            ContentSubmissionEntity::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final IContentSubmissionRepository contentSubmissionRepository;
    private final SubmissionTransitionDomainService submissionTransitionDomainService;
    private final ApprovalViewAssembler approvalViewAssembler;

    public SubmissionQueryService(IContentSubmissionRepository contentSubmissionRepository,
                                  SubmissionTransitionDomainService submissionTransitionDomainService,
                                  ApprovalViewAssembler approvalViewAssembler) {
        this.contentSubmissionRepository = contentSubmissionRepository;
        this.submissionTransitionDomainService = submissionTransitionDomainService;
        this.approvalViewAssembler = approvalViewAssembler;
    }

    public SubmissionDTO getSubmission(Long submissionId) {
        ContentSubmissionEntity submission = submissionId == null ? null : contentSubmissionRepository.findById(submissionId);
        if (submission == null) {
            throw AppException.of(ResponseCode.SUBMISSION_NOT_FOUND, "审批提交不存在");
        }
        return approvalViewAssembler.toSubmissionDTO(submission);
    }

    /**
     * 按组织、状态、内容类型与提交人过滤，按创建时间倒序。
     */
    public List<SubmissionDTO> getSubmissions(String organizationId,
                                              String stateCode,
                                              String contentTypeCode,
                                              String submittedBy,
                                              Integer limit) {
        requireOrganization(organizationId);
        SubmissionFilter filter = SubmissionFilter.builder()
                .organizationId(organizationId)
                .state(parse(() -> ApprovalStateEnum.fromCode(stateCode)))
                .contentType(parse(() -> ContentTypeEnum.fromCode(contentTypeCode)))
                .submittedBy(StringUtils.trimToNull(submittedBy))
                .limit(limit == null || limit <= 0 ? Constants.DEFAULT_QUERY_LIMIT : Math.min(limit, Constants.MAX_QUERY_LIMIT))
                .build();
        return contentSubmissionRepository.findByFilter(filter).stream()
                .sorted(NEWEST_FIRST)
                .limit(filter.getLimit())
                .map(approvalViewAssembler::toSubmissionDTO)
                .collect(Collectors.toList());
    }

    /**
     * 用户在当前步骤作为审批人的 pending 提交，按创建时间倒序。
     */
    public List<SubmissionDTO> getPendingSubmissions(String userId, String organizationId) {
        requireOrganization(organizationId);
        if (StringUtils.isBlank(userId)) {
            throw AppException.of(ResponseCode.MISSING_REQUIRED_FIELD, "userId is required");
        }
        return contentSubmissionRepository.findPendingByOrganizationId(organizationId).stream()
                .filter(submission -> submissionTransitionDomainService.isAwaitingApprover(submission, userId))
                .sorted(NEWEST_FIRST)
                .map(approvalViewAssembler::toSubmissionDTO)
                .collect(Collectors.toList());
    }

    private void requireOrganization(String organizationId) {
        if (StringUtils.isBlank(organizationId)) {
            throw AppException.of(ResponseCode.MISSING_REQUIRED_FIELD, "organizationId is required");
        }
    }

    private <T> T parse(Supplier<T> parser) {
        try {
            return parser.get();
        } catch (IllegalArgumentException ex) {
            throw AppException.of(ResponseCode.ILLEGAL_PARAMETER, ex.getMessage());
        }
    }
}
