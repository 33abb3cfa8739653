package com.contentflow.trigger.application.command;

import com.contentflow.api.dto.SubmissionDTO;
import com.contentflow.domain.submission.adapter.gateway.IUserDirectoryGateway;
import com.contentflow.domain.submission.adapter.repository.IContentSubmissionRepository;
import com.contentflow.domain.submission.model.entity.ContentSubmissionEntity;
import com.contentflow.domain.submission.model.valobj.SubmissionTransition;
import com.contentflow.domain.submission.model.valobj.SubmissionTransitionKind;
import com.contentflow.domain.submission.service.SubmissionTransitionDomainService;
import com.contentflow.domain.workflow.adapter.repository.IApprovalWorkflowRepository;
import com.contentflow.domain.workflow.model.entity.ApprovalWorkflowEntity;
import com.contentflow.trigger.application.common.ApprovalViewAssembler;
import com.contentflow.types.common.Constants;
import com.contentflow.types.enums.ActivityActionEnum;
import com.contentflow.types.enums.ContentTypeEnum;
import com.contentflow.types.enums.ResponseCode;
import com.contentflow.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * 内容审批写用例：提交、审批、驳回、要求修改与发布确认。
 * <p>
 * 每个审批动作按乐观锁读-改-写：读取最新提交，由领域服务计算迁移，按版本号写回；
 * 版本冲突时重新读取并重新校验全部规则，超过最大重试次数返回并发修改冲突。
 * 操作日志在迁移写入成功后记录。
 * </p>
 */
@Slf4j
@Service
public class SubmissionCommandService {

    private final IContentSubmissionRepository contentSubmissionRepository;
    private final IApprovalWorkflowRepository approvalWorkflowRepository;
    private final IUserDirectoryGateway userDirectoryGateway;
    private final SubmissionTransitionDomainService submissionTransitionDomainService;
    private final ActivityLogCommandService activityLogCommandService;
    private final ApprovalViewAssembler approvalViewAssembler;
    private final Clock clock;
    private final int maxAttempts;

    private final Map<SubmissionTransitionKind, Counter> transitionCounters;
    private final Counter optimisticLockRetryCounter;
    private final Counter optimisticLockExhaustedCounter;

    public SubmissionCommandService(IContentSubmissionRepository contentSubmissionRepository,
                                    IApprovalWorkflowRepository approvalWorkflowRepository,
                                    IUserDirectoryGateway userDirectoryGateway,
                                    SubmissionTransitionDomainService submissionTransitionDomainService,
                                    ActivityLogCommandService activityLogCommandService,
                                    ApprovalViewAssembler approvalViewAssembler,
                                    Clock clock,
                                    @Value("${approval.submission.optimistic-lock.max-attempts:5}") int maxAttempts) {
        this.contentSubmissionRepository = contentSubmissionRepository;
        this.approvalWorkflowRepository = approvalWorkflowRepository;
        this.userDirectoryGateway = userDirectoryGateway;
        this.submissionTransitionDomainService = submissionTransitionDomainService;
        this.activityLogCommandService = activityLogCommandService;
        this.approvalViewAssembler = approvalViewAssembler;
        this.clock = clock;
        this.maxAttempts = Math.max(maxAttempts, 1);
        this.transitionCounters = new EnumMap<>(SubmissionTransitionKind.class);
        for (SubmissionTransitionKind kind : SubmissionTransitionKind.values()) {
            transitionCounters.put(kind, Counter.builder("approval.submission.transition.total")
                    .tag("kind", kind.name().toLowerCase())
                    .register(Metrics.globalRegistry));
        }
        this.optimisticLockRetryCounter = Counter.builder("approval.submission.optimistic_lock.retry.total")
                .register(Metrics.globalRegistry);
        this.optimisticLockExhaustedCounter = Counter.builder("approval.submission.optimistic_lock.exhausted.total")
                .register(Metrics.globalRegistry);
    }

    public SubmissionDTO submitForApproval(String organizationId,
                                           Long workflowId,
                                           String contentTypeCode,
                                           Map<String, Object> contentData,
                                           String submittedBy,
                                           String contentId) {
        ContentTypeEnum contentType = parseContentType(contentTypeCode);
        submissionTransitionDomainService.validateSubmitRequest(organizationId, workflowId, contentType, submittedBy);

        ApprovalWorkflowEntity workflow = approvalWorkflowRepository.findById(workflowId);
        ContentSubmissionEntity submission = submissionTransitionDomainService.createSubmission(
                workflow,
                organizationId,
                contentType,
                contentData,
                submittedBy,
                userDirectoryGateway.findDisplayName(submittedBy),
                contentId,
                LocalDateTime.now(clock));
        ContentSubmissionEntity saved = contentSubmissionRepository.save(submission);
        log.info("APPROVAL_SUBMITTED submissionId={}, organizationId={}, workflowId={}, contentType={}, submittedBy={}",
                saved.getId(), saved.getOrganizationId(), saved.getWorkflowId(), contentType.getCode(), submittedBy);

        Map<String, Object> details = new HashMap<>();
        details.put(Constants.DETAIL_WORKFLOW_ID, workflow.getId());
        details.put(Constants.DETAIL_WORKFLOW_NAME, workflow.getName());
        activityLogCommandService.logActivity(saved.getOrganizationId(), submittedBy,
                ActivityActionEnum.CONTENT_SUBMITTED, contentType.getCode(), String.valueOf(saved.getId()), details);
        return approvalViewAssembler.toSubmissionDTO(saved);
    }

    public SubmissionDTO approveContent(Long submissionId, String userId, String comment) {
        String commenterName = StringUtils.isBlank(comment) ? null : userDirectoryGateway.findDisplayName(userId);
        return execute(submissionId, "approve", current -> submissionTransitionDomainService.approve(
                current, userId, comment, commenterName, LocalDateTime.now(clock)));
    }

    public SubmissionDTO rejectContent(Long submissionId, String userId, String comment) {
        requireComment(comment);
        String commenterName = userDirectoryGateway.findDisplayName(userId);
        return execute(submissionId, "reject", current -> submissionTransitionDomainService.reject(
                current, userId, comment, commenterName, LocalDateTime.now(clock)));
    }

    public SubmissionDTO requestChanges(Long submissionId, String userId, String comment) {
        requireComment(comment);
        String commenterName = userDirectoryGateway.findDisplayName(userId);
        return execute(submissionId, "request_changes", current -> submissionTransitionDomainService.requestChanges(
                current, userId, comment, commenterName, LocalDateTime.now(clock)));
    }

    public SubmissionDTO markAsPublished(Long submissionId, String publishedBy) {
        return execute(submissionId, "publish", current -> submissionTransitionDomainService.publish(
                current, publishedBy, LocalDateTime.now(clock)));
    }

    private SubmissionDTO execute(Long submissionId,
                                  String operation,
                                  Function<ContentSubmissionEntity, SubmissionTransition> transitionFunction) {
        if (submissionId == null) {
            throw AppException.of(ResponseCode.MISSING_REQUIRED_FIELD, "submissionId is required");
        }
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ContentSubmissionEntity current = contentSubmissionRepository.findById(submissionId);
            if (current == null) {
                throw AppException.of(ResponseCode.SUBMISSION_NOT_FOUND, "审批提交不存在");
            }
            SubmissionTransition transition = transitionFunction.apply(current);
            if (contentSubmissionRepository.updateWithVersion(transition.submission())) {
                onTransitionPersisted(transition, attempt);
                return approvalViewAssembler.toSubmissionDTO(transition.submission());
            }
            if (attempt < maxAttempts) {
                optimisticLockRetryCounter.increment();
                log.info("APPROVAL_RETRY submissionId={}, operation={}, attempt={}, maxAttempts={}",
                        submissionId, operation, attempt, maxAttempts);
            }
        }
        optimisticLockExhaustedCounter.increment();
        log.warn("APPROVAL_CONFLICT submissionId={}, operation={}, maxAttempts={}", submissionId, operation, maxAttempts);
        throw AppException.of(ResponseCode.CONCURRENT_MODIFICATION,
                "submission " + submissionId + " was modified concurrently, retry later");
    }

    private void onTransitionPersisted(SubmissionTransition transition, int attempt) {
        ContentSubmissionEntity submission = transition.submission();
        transitionCounters.get(transition.kind()).increment();
        log.info("APPROVAL_TRANSITION submissionId={}, kind={}, state={}, step={}, actorId={}, attempt={}",
                submission.getId(),
                transition.kind(),
                submission.getCurrentState().getCode(),
                transition.actedStep(),
                transition.actorId(),
                attempt);

        Map<String, Object> details = new HashMap<>();
        ActivityActionEnum action;
        switch (transition.kind()) {
            case APPROVAL_RECORDED, STEP_ADVANCED -> {
                action = ActivityActionEnum.STEP_APPROVED;
                details.put(Constants.DETAIL_STEP, transition.actedStep());
                details.put(Constants.DETAIL_COMMENT, transition.comment());
            }
            case APPROVED -> {
                action = ActivityActionEnum.CONTENT_APPROVED;
                details.put(Constants.DETAIL_STEP, transition.actedStep());
                details.put(Constants.DETAIL_COMMENT, transition.comment());
            }
            case REJECTED -> {
                action = ActivityActionEnum.CONTENT_REJECTED;
                details.put(Constants.DETAIL_COMMENT, transition.comment());
            }
            case CHANGES_REQUESTED -> {
                action = ActivityActionEnum.CHANGES_REQUESTED;
                details.put(Constants.DETAIL_COMMENT, transition.comment());
            }
            default -> action = ActivityActionEnum.CONTENT_PUBLISHED;
        }
        activityLogCommandService.logActivity(submission.getOrganizationId(), transition.actorId(), action,
                submission.getContentType().getCode(), String.valueOf(submission.getId()), details);
    }

    private void requireComment(String comment) {
        if (StringUtils.isBlank(comment)) {
            throw AppException.of(ResponseCode.MISSING_REQUIRED_FIELD, "comment is required");
        }
    }

    private ContentTypeEnum parseContentType(String contentTypeCode) {
        if (StringUtils.isBlank(contentTypeCode)) {
            throw AppException.of(ResponseCode.MISSING_REQUIRED_FIELD, "contentType is required");
        }
        try {
            return ContentTypeEnum.fromCode(contentTypeCode);
        } catch (IllegalArgumentException ex) {
            throw AppException.of(ResponseCode.ILLEGAL_PARAMETER, ex.getMessage());
        }
    }
}
