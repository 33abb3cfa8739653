package com.contentflow.test;

import com.contentflow.domain.workflow.model.entity.ApprovalWorkflowEntity;
import com.contentflow.domain.workflow.model.valobj.WorkflowStepVO;
import com.contentflow.infrastructure.dao.ApprovalWorkflowDao;
import com.contentflow.infrastructure.dao.po.ApprovalWorkflowPO;
import com.contentflow.infrastructure.repository.workflow.ApprovalWorkflowRepositoryImpl;
import com.contentflow.infrastructure.util.JsonCodec;
import com.contentflow.types.enums.WorkflowTypeEnum;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ApprovalWorkflowRepositoryImplTest {

    private final ApprovalWorkflowDao dao = mock(ApprovalWorkflowDao.class);
    private final ApprovalWorkflowRepositoryImpl repository =
            new ApprovalWorkflowRepositoryImpl(dao, new JsonCodec(new ObjectMapper().findAndRegisterModules()));

    @Test
    public void shouldReadStepsFromJsonb() {
        when(dao.selectById(7L)).thenReturn(ApprovalWorkflowPO.builder()
                .id(7L)
                .organizationId("org-1")
                .name("post review")
                .type("sequential")
                .steps("[{\"stepNumber\":1,\"approverIds\":[\"alice\",\"bob\"],\"requiredApprovals\":2}]")
                .isActive(true)
                .createdBy("alice")
                .build());

        ApprovalWorkflowEntity workflow = repository.findById(7L);

        Assertions.assertEquals(WorkflowTypeEnum.SEQUENTIAL, workflow.getType());
        Assertions.assertEquals(1, workflow.getSteps().size());
        Assertions.assertEquals(Arrays.asList("alice", "bob"), workflow.getSteps().get(0).getApproverIds());
        Assertions.assertEquals(2, workflow.getSteps().get(0).getRequiredApprovals());
    }

    @Test
    public void shouldTreatMissingStepsAsEmpty() {
        when(dao.selectById(8L)).thenReturn(ApprovalWorkflowPO.builder().id(8L).organizationId("org-1").build());

        Assertions.assertTrue(repository.findById(8L).getSteps().isEmpty());
        Assertions.assertNull(repository.findById(9L));
    }

    @Test
    public void shouldWriteStepsAndReturnGeneratedId() {
        ArgumentCaptor<ApprovalWorkflowPO> captor = ArgumentCaptor.forClass(ApprovalWorkflowPO.class);
        when(dao.insert(captor.capture())).thenAnswer(invocation -> {
            invocation.<ApprovalWorkflowPO>getArgument(0).setId(11L);
            return 1;
        });

        ApprovalWorkflowEntity saved = repository.save(workflow(List.of(WorkflowStepVO.builder()
                .stepNumber(1)
                .approverIds(Collections.singletonList("alice"))
                .requiredApprovals(1)
                .build())));

        Assertions.assertEquals(11L, saved.getId());
        Assertions.assertEquals("sequential", captor.getValue().getType());
        Assertions.assertTrue(captor.getValue().getSteps().contains("\"approverIds\":[\"alice\"]"));
    }

    @Test
    public void shouldRejectWorkflowWithoutStepsBeforeInsert() {
        Assertions.assertThrows(IllegalStateException.class, () -> repository.save(workflow(Collections.emptyList())));
        verify(dao, never()).insert(any(ApprovalWorkflowPO.class));
    }

    private ApprovalWorkflowEntity workflow(List<WorkflowStepVO> steps) {
        ApprovalWorkflowEntity entity = new ApprovalWorkflowEntity();
        entity.setOrganizationId("org-1");
        entity.setName("post review");
        entity.setType(WorkflowTypeEnum.SEQUENTIAL);
        entity.setSteps(steps);
        entity.setIsActive(true);
        entity.setCreatedBy("alice");
        return entity;
    }
}
