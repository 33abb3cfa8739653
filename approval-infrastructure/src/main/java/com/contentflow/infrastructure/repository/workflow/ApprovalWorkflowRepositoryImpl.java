package com.contentflow.infrastructure.repository.workflow;

import com.contentflow.domain.workflow.adapter.repository.IApprovalWorkflowRepository;
import com.contentflow.domain.workflow.model.entity.ApprovalWorkflowEntity;
import com.contentflow.domain.workflow.model.valobj.WorkflowStepVO;
import com.contentflow.infrastructure.dao.ApprovalWorkflowDao;
import com.contentflow.infrastructure.dao.po.ApprovalWorkflowPO;
import com.contentflow.infrastructure.util.JsonCodec;
import com.contentflow.types.enums.WorkflowTypeEnum;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 审批流程仓储实现类。
 * <p>
 * 步骤列表以 JSONB 存储，流程类型以 code 存储。
 * </p>
 *
 * @author contentflow
 * @since 2026-03-02
 */
@Repository
public class ApprovalWorkflowRepositoryImpl implements IApprovalWorkflowRepository {

    private final ApprovalWorkflowDao approvalWorkflowDao;
    private final JsonCodec jsonCodec;

    public ApprovalWorkflowRepositoryImpl(ApprovalWorkflowDao approvalWorkflowDao, JsonCodec jsonCodec) {
        this.approvalWorkflowDao = approvalWorkflowDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public ApprovalWorkflowEntity save(ApprovalWorkflowEntity entity) {
        entity.validate();
        ApprovalWorkflowPO po = toPO(entity);
        approvalWorkflowDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public ApprovalWorkflowEntity update(ApprovalWorkflowEntity entity) {
        entity.validate();
        int affected = approvalWorkflowDao.update(toPO(entity));
        if (affected == 0) {
            throw new IllegalStateException("Approval workflow not found: " + entity.getId());
        }
        return entity;
    }

    @Override
    public ApprovalWorkflowEntity findById(Long id) {
        ApprovalWorkflowPO po = approvalWorkflowDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<ApprovalWorkflowEntity> findActiveByOrganizationId(String organizationId) {
        return approvalWorkflowDao.selectActiveByOrganizationId(organizationId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    /**
     * PO 转换为 Entity
     */
    private ApprovalWorkflowEntity toEntity(ApprovalWorkflowPO po) {
        ApprovalWorkflowEntity entity = new ApprovalWorkflowEntity();
        entity.setId(po.getId());
        entity.setOrganizationId(po.getOrganizationId());
        entity.setName(po.getName());
        entity.setDescription(po.getDescription());
        entity.setType(WorkflowTypeEnum.fromCode(po.getType()));
        entity.setSteps(jsonCodec.readList(po.getSteps(), WorkflowStepVO.class));
        entity.setIsActive(po.getIsActive());
        entity.setCreatedBy(po.getCreatedBy());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    /**
     * Entity 转换为 PO
     */
    private ApprovalWorkflowPO toPO(ApprovalWorkflowEntity entity) {
        return ApprovalWorkflowPO.builder()
                .id(entity.getId())
                .organizationId(entity.getOrganizationId())
                .name(entity.getName())
                .description(entity.getDescription())
                .type(entity.getType() == null ? null : entity.getType().getCode())
                .steps(jsonCodec.writeValue(entity.getSteps()))
                .isActive(entity.getIsActive())
                .createdBy(entity.getCreatedBy())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
