package com.contentflow.infrastructure.repository.submission;

import com.contentflow.domain.submission.adapter.repository.IContentSubmissionRepository;
import com.contentflow.domain.submission.model.entity.ContentSubmissionEntity;
import com.contentflow.domain.submission.model.entity.SubmissionStepEntity;
import com.contentflow.domain.submission.model.valobj.StepCommentVO;
import com.contentflow.domain.submission.model.valobj.SubmissionFilter;
import com.contentflow.infrastructure.dao.ContentSubmissionDao;
import com.contentflow.infrastructure.dao.po.ContentSubmissionPO;
import com.contentflow.infrastructure.dao.po.SubmissionStepPO;
import com.contentflow.infrastructure.util.JsonCodec;
import com.contentflow.types.common.Constants;
import com.contentflow.types.enums.ApprovalStateEnum;
import com.contentflow.types.enums.ContentTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 内容提交仓储实现类。
 * <p>
 * 负责提交的持久化操作，包括：
 * <ul>
 *   <li>提交的插入与按版本号更新（乐观锁）</li>
 *   <li>按组织、状态、内容类型、提交人条件查询</li>
 *   <li>步骤与内容快照的 JSONB 序列化/反序列化</li>
 * </ul>
 * </p>
 *
 * @author contentflow
 * @since 2026-03-02
 */
@Slf4j
@Repository
public class ContentSubmissionRepositoryImpl implements IContentSubmissionRepository {

    private final ContentSubmissionDao contentSubmissionDao;
    private final JsonCodec jsonCodec;

    public ContentSubmissionRepositoryImpl(ContentSubmissionDao contentSubmissionDao, JsonCodec jsonCodec) {
        this.contentSubmissionDao = contentSubmissionDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public ContentSubmissionEntity save(ContentSubmissionEntity entity) {
        entity.validate();
        if (entity.getVersion() == null) {
            entity.setVersion(0);
        }
        ContentSubmissionPO po = toPO(entity);
        contentSubmissionDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public boolean updateWithVersion(ContentSubmissionEntity entity) {
        entity.validate();
        int affected = contentSubmissionDao.updateWithVersion(toPO(entity));
        if (affected == 0) {
            log.debug("Optimistic lock conflict for ContentSubmission. submissionId={}, expectedVersion={}",
                    entity.getId(), entity.getVersion());
            return false;
        }
        entity.incrementVersion();
        return true;
    }

    @Override
    public ContentSubmissionEntity findById(Long id) {
        ContentSubmissionPO po = contentSubmissionDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<ContentSubmissionEntity> findPendingByOrganizationId(String organizationId) {
        return contentSubmissionDao.selectPendingByOrganizationId(organizationId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<ContentSubmissionEntity> findByFilter(SubmissionFilter filter) {
        int limit = filter.getLimit() == null ? Constants.DEFAULT_QUERY_LIMIT : filter.getLimit();
        return contentSubmissionDao.selectByFilter(
                        filter.getOrganizationId(),
                        filter.getState() == null ? null : filter.getState().getCode(),
                        filter.getContentType() == null ? null : filter.getContentType().getCode(),
                        filter.getSubmittedBy(),
                        limit).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    /**
     * PO 转换为 Entity
     */
    private ContentSubmissionEntity toEntity(ContentSubmissionPO po) {
        ContentSubmissionEntity entity = new ContentSubmissionEntity();
        entity.setId(po.getId());
        entity.setOrganizationId(po.getOrganizationId());
        entity.setWorkflowId(po.getWorkflowId());
        entity.setContentType(ContentTypeEnum.fromCode(po.getContentType()));
        entity.setContentId(po.getContentId());
        entity.setContentData(jsonCodec.readMap(po.getContentData()));
        entity.setSubmittedBy(po.getSubmittedBy());
        entity.setSubmittedByName(po.getSubmittedByName());
        entity.setCurrentState(ApprovalStateEnum.fromCode(po.getCurrentState()));
        entity.setCurrentStep(po.getCurrentStep());

        List<SubmissionStepEntity> steps = new ArrayList<>();
        for (SubmissionStepPO stepPO : jsonCodec.readList(po.getSteps(), SubmissionStepPO.class)) {
            steps.add(toStepEntity(stepPO));
        }
        entity.setSteps(steps);

        entity.setFinalApprovedBy(po.getFinalApprovedBy());
        entity.setFinalRejectedBy(po.getFinalRejectedBy());
        entity.setApprovalCompletedAt(po.getApprovalCompletedAt());
        entity.setPublishedAt(po.getPublishedAt());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    /**
     * Entity 转换为 PO
     */
    private ContentSubmissionPO toPO(ContentSubmissionEntity entity) {
        List<SubmissionStepPO> stepPOs = entity.getSteps().stream()
                .map(this::toStepPO)
                .collect(Collectors.toList());
        return ContentSubmissionPO.builder()
                .id(entity.getId())
                .organizationId(entity.getOrganizationId())
                .workflowId(entity.getWorkflowId())
                .contentType(entity.getContentType() == null ? null : entity.getContentType().getCode())
                .contentId(entity.getContentId())
                .contentData(jsonCodec.writeValue(entity.getContentData() == null ? new HashMap<>() : entity.getContentData()))
                .submittedBy(entity.getSubmittedBy())
                .submittedByName(entity.getSubmittedByName())
                .currentState(entity.getCurrentState() == null ? null : entity.getCurrentState().getCode())
                .currentStep(entity.getCurrentStep())
                .steps(jsonCodec.writeValue(stepPOs))
                .finalApprovedBy(entity.getFinalApprovedBy())
                .finalRejectedBy(entity.getFinalRejectedBy())
                .approvalCompletedAt(entity.getApprovalCompletedAt())
                .publishedAt(entity.getPublishedAt())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private SubmissionStepEntity toStepEntity(SubmissionStepPO po) {
        SubmissionStepEntity step = new SubmissionStepEntity();
        step.setStepNumber(po.getStepNumber());
        step.setApproverIds(po.getApproverIds() == null ? new ArrayList<>() : new ArrayList<>(po.getApproverIds()));
        step.setRequiredApprovals(po.getRequiredApprovals());
        step.setApprovedBy(po.getApprovedBy() == null ? new ArrayList<>() : new ArrayList<>(po.getApprovedBy()));
        step.setRejectedBy(po.getRejectedBy());
        List<StepCommentVO> comments = new ArrayList<>();
        if (po.getComments() != null) {
            for (SubmissionStepPO.Comment comment : po.getComments()) {
                comments.add(StepCommentVO.builder()
                        .userId(comment.getUserId())
                        .userName(comment.getUserName())
                        .comment(comment.getComment())
                        .createdAt(comment.getCreatedAt())
                        .build());
            }
        }
        step.setComments(comments);
        return step;
    }

    private SubmissionStepPO toStepPO(SubmissionStepEntity step) {
        List<SubmissionStepPO.Comment> comments = step.getComments().stream()
                .map(comment -> SubmissionStepPO.Comment.builder()
                        .userId(comment.getUserId())
                        .userName(comment.getUserName())
                        .comment(comment.getComment())
                        .createdAt(comment.getCreatedAt())
                        .build())
                .collect(Collectors.toList());
        return SubmissionStepPO.builder()
                .stepNumber(step.getStepNumber())
                .approverIds(new ArrayList<>(step.getApproverIds()))
                .requiredApprovals(step.getRequiredApprovals())
                .approvedBy(new ArrayList<>(step.getApprovedBy()))
                .rejectedBy(step.getRejectedBy())
                .comments(comments)
                .build();
    }
}
