package com.contentflow.test;

import com.contentflow.api.dto.SubmissionDTO;
import com.contentflow.domain.activity.model.entity.ActivityLogEntity;
import com.contentflow.test.support.ApprovalTestFixture;
import com.contentflow.types.enums.ActivityActionEnum;
import com.contentflow.types.enums.ErrorKindEnum;
import com.contentflow.types.enums.ResponseCode;
import com.contentflow.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class SubmissionCommandServiceTest {

    private final ApprovalTestFixture fixture = new ApprovalTestFixture();

    @Test
    public void shouldWalkSequentialWorkflowStepByStep() {
        Long workflowId = fixture.createWorkflow("sequential", Arrays.asList(
                Collections.singletonList("alice"), Collections.singletonList("bob")));
        Long submissionId = fixture.submit(workflowId);

        SubmissionDTO afterAlice = fixture.submissionCommandService.approveContent(submissionId, "alice", null);
        Assertions.assertEquals("pending", afterAlice.getCurrentState());
        Assertions.assertEquals(2, afterAlice.getCurrentStep());
        Assertions.assertEquals(Collections.singletonList("alice"), afterAlice.getSteps().get(0).getApprovedBy());

        AppException aliceAgain = Assertions.assertThrows(AppException.class,
                () -> fixture.submissionCommandService.approveContent(submissionId, "alice", null));
        Assertions.assertEquals(ResponseCode.NOT_AN_APPROVER.getCode(), aliceAgain.getCode());

        SubmissionDTO afterBob = fixture.submissionCommandService.approveContent(submissionId, "bob", "ship it");
        Assertions.assertEquals("approved", afterBob.getCurrentState());
        Assertions.assertEquals("bob", afterBob.getFinalApprovedBy());
        Assertions.assertNotNull(afterBob.getApprovalCompletedAt());
        Assertions.assertEquals("Bob", afterBob.getSteps().get(1).getComments().get(0).getUserName());
        Assertions.assertEquals(2, afterBob.getVersion());
    }

    @Test
    public void shouldRequireEveryParallelApprover() {
        Long workflowId = fixture.createWorkflow("parallel", Collections.singletonList(
                Arrays.asList("alice", "bob", "carol")));
        Long submissionId = fixture.submit(workflowId);

        fixture.submissionCommandService.approveContent(submissionId, "alice", null);
        SubmissionDTO afterBob = fixture.submissionCommandService.approveContent(submissionId, "bob", null);
        Assertions.assertEquals("pending", afterBob.getCurrentState());
        Assertions.assertEquals(1, afterBob.getCurrentStep());

        SubmissionDTO afterCarol = fixture.submissionCommandService.approveContent(submissionId, "carol", null);
        Assertions.assertEquals("approved", afterCarol.getCurrentState());
        Assertions.assertEquals("carol", afterCarol.getFinalApprovedBy());
        Assertions.assertEquals(Arrays.asList("alice", "bob", "carol"), afterCarol.getSteps().get(0).getApprovedBy());
    }

    @Test
    public void shouldFinishSimpleWorkflowOnFirstApproval() {
        Long workflowId = fixture.createWorkflow("simple", Collections.singletonList(Arrays.asList("alice", "bob")));
        Long submissionId = fixture.submit(workflowId);

        SubmissionDTO approved = fixture.submissionCommandService.approveContent(submissionId, "bob", null);

        Assertions.assertEquals("approved", approved.getCurrentState());
        Assertions.assertEquals(1, approved.getSteps().get(0).getRequiredApprovals());
    }

    @Test
    public void shouldRejectDuplicateApprovalWithoutChangingSubmission() {
        Long workflowId = fixture.createWorkflow("parallel", Collections.singletonList(Arrays.asList("alice", "bob")));
        Long submissionId = fixture.submit(workflowId);
        fixture.submissionCommandService.approveContent(submissionId, "alice", "first");

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.submissionCommandService.approveContent(submissionId, "alice", "second"));

        Assertions.assertEquals(ResponseCode.ALREADY_APPROVED.getCode(), ex.getCode());
        Assertions.assertEquals(ErrorKindEnum.CONFLICT, ex.getKind());
        SubmissionDTO stored = fixture.submissionQueryService.getSubmission(submissionId);
        Assertions.assertEquals(1, stored.getSteps().get(0).getApprovedBy().size());
        Assertions.assertEquals(1, stored.getSteps().get(0).getComments().size());
        Assertions.assertEquals(1, stored.getVersion());
    }

    @Test
    public void shouldRejectNonApproverAndTerminateOnRejection() {
        Long workflowId = fixture.createWorkflow("sequential", Arrays.asList(
                Collections.singletonList("alice"), Collections.singletonList("bob")));
        Long submissionId = fixture.submit(workflowId);

        AppException outsider = Assertions.assertThrows(AppException.class,
                () -> fixture.submissionCommandService.rejectContent(submissionId, "erin", "no"));
        Assertions.assertEquals(ResponseCode.NOT_AN_APPROVER.getCode(), outsider.getCode());

        SubmissionDTO rejected = fixture.submissionCommandService.rejectContent(submissionId, "alice", "off brand");
        Assertions.assertEquals("rejected", rejected.getCurrentState());
        Assertions.assertEquals("alice", rejected.getFinalRejectedBy());
        Assertions.assertNull(rejected.getFinalApprovedBy());
        Assertions.assertEquals("alice", rejected.getSteps().get(0).getRejectedBy());

        for (String userId : Arrays.asList("alice", "bob")) {
            AppException approve = Assertions.assertThrows(AppException.class,
                    () -> fixture.submissionCommandService.approveContent(submissionId, userId, null));
            AppException reject = Assertions.assertThrows(AppException.class,
                    () -> fixture.submissionCommandService.rejectContent(submissionId, userId, "again"));
            Assertions.assertEquals(ResponseCode.SUBMISSION_NOT_PENDING.getCode(), approve.getCode());
            Assertions.assertEquals(ResponseCode.SUBMISSION_NOT_PENDING.getCode(), reject.getCode());
        }
        AppException publish = Assertions.assertThrows(AppException.class,
                () -> fixture.submissionCommandService.markAsPublished(submissionId, "writer"));
        Assertions.assertEquals(ResponseCode.SUBMISSION_NOT_APPROVED.getCode(), publish.getCode());
    }

    @Test
    public void shouldRequireCommentBeforeLoadingSubmission() {
        AppException reject = Assertions.assertThrows(AppException.class,
                () -> fixture.submissionCommandService.rejectContent(999L, "alice", " "));
        AppException changes = Assertions.assertThrows(AppException.class,
                () -> fixture.submissionCommandService.requestChanges(999L, "alice", null));
        AppException missing = Assertions.assertThrows(AppException.class,
                () -> fixture.submissionCommandService.approveContent(999L, "alice", null));

        Assertions.assertEquals(ResponseCode.MISSING_REQUIRED_FIELD.getCode(), reject.getCode());
        Assertions.assertEquals(ResponseCode.MISSING_REQUIRED_FIELD.getCode(), changes.getCode());
        Assertions.assertEquals(ResponseCode.SUBMISSION_NOT_FOUND.getCode(), missing.getCode());
        Assertions.assertEquals(ErrorKindEnum.NOT_FOUND, missing.getKind());
    }

    @Test
    public void shouldBlockFurtherActionsAfterChangesRequested() {
        Long workflowId = fixture.createWorkflow("simple", Collections.singletonList(Arrays.asList("alice", "bob")));
        Long submissionId = fixture.submit(workflowId);

        SubmissionDTO changed = fixture.submissionCommandService.requestChanges(submissionId, "alice", "fix the title");

        Assertions.assertEquals("changes_requested", changed.getCurrentState());
        Assertions.assertEquals("fix the title", changed.getSteps().get(0).getComments().get(0).getComment());
        AppException approve = Assertions.assertThrows(AppException.class,
                () -> fixture.submissionCommandService.approveContent(submissionId, "bob", null));
        Assertions.assertEquals(ResponseCode.SUBMISSION_NOT_PENDING.getCode(), approve.getCode());
    }

    @Test
    public void shouldPublishApprovedSubmissionOnce() {
        Long workflowId = fixture.createWorkflow("simple", Collections.singletonList(Collections.singletonList("alice")));
        Long submissionId = fixture.submit(workflowId);

        AppException early = Assertions.assertThrows(AppException.class,
                () -> fixture.submissionCommandService.markAsPublished(submissionId, "writer"));
        Assertions.assertEquals(ResponseCode.SUBMISSION_NOT_APPROVED.getCode(), early.getCode());

        fixture.submissionCommandService.approveContent(submissionId, "alice", null);
        SubmissionDTO published = fixture.submissionCommandService.markAsPublished(submissionId, "writer");

        Assertions.assertEquals("published", published.getCurrentState());
        Assertions.assertNotNull(published.getPublishedAt());
        Assertions.assertEquals("alice", published.getFinalApprovedBy());
        AppException again = Assertions.assertThrows(AppException.class,
                () -> fixture.submissionCommandService.markAsPublished(submissionId, "writer"));
        Assertions.assertEquals(ResponseCode.SUBMISSION_NOT_APPROVED.getCode(), again.getCode());
    }

    @Test
    public void shouldKeepSubmissionStepsWhenWorkflowIsDeactivated() {
        Long workflowId = fixture.createWorkflow("sequential", Arrays.asList(
                Collections.singletonList("alice"), Collections.singletonList("bob")));
        Long submissionId = fixture.submit(workflowId);

        fixture.workflowCommandService.deactivateWorkflow(workflowId, "alice");

        AppException submitAgain = Assertions.assertThrows(AppException.class, () -> fixture.submit(workflowId));
        Assertions.assertEquals(ResponseCode.WORKFLOW_INACTIVE.getCode(), submitAgain.getCode());

        fixture.submissionCommandService.approveContent(submissionId, "alice", null);
        SubmissionDTO approved = fixture.submissionCommandService.approveContent(submissionId, "bob", null);
        Assertions.assertEquals("approved", approved.getCurrentState());
        Assertions.assertEquals(2, approved.getSteps().size());
    }

    @Test
    public void shouldValidateSubmitRequest() {
        Long workflowId = fixture.createWorkflow("simple", Collections.singletonList(Collections.singletonList("alice")));

        AppException unknownType = Assertions.assertThrows(AppException.class, () -> fixture.submissionCommandService
                .submitForApproval(ApprovalTestFixture.ORG, workflowId, "podcast", null, "writer", null));
        AppException blankType = Assertions.assertThrows(AppException.class, () -> fixture.submissionCommandService
                .submitForApproval(ApprovalTestFixture.ORG, workflowId, " ", null, "writer", null));
        AppException missingWorkflow = Assertions.assertThrows(AppException.class, () -> fixture.submissionCommandService
                .submitForApproval(ApprovalTestFixture.ORG, 404L, "post", null, "writer", null));
        AppException foreignOrg = Assertions.assertThrows(AppException.class, () -> fixture.submissionCommandService
                .submitForApproval("org-2", workflowId, "post", null, "writer", null));

        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), unknownType.getCode());
        Assertions.assertEquals(ResponseCode.MISSING_REQUIRED_FIELD.getCode(), blankType.getCode());
        Assertions.assertEquals(ResponseCode.WORKFLOW_NOT_FOUND.getCode(), missingWorkflow.getCode());
        Assertions.assertEquals(ResponseCode.WORKFLOW_NOT_FOUND.getCode(), foreignOrg.getCode());
    }

    @Test
    public void shouldStoreSubmitterNameAndContent() {
        Long workflowId = fixture.createWorkflow("simple", Collections.singletonList(Collections.singletonList("alice")));

        SubmissionDTO submitted = fixture.submissionCommandService.submitForApproval(ApprovalTestFixture.ORG, workflowId,
                "campaign", Map.of("title", "Spring launch"), "writer", " camp-9 ");

        Assertions.assertEquals("Writer", submitted.getSubmittedByName());
        Assertions.assertEquals("campaign", submitted.getContentType());
        Assertions.assertEquals("camp-9", submitted.getContentId());
        Assertions.assertEquals("Spring launch", submitted.getContentData().get("title"));
        Assertions.assertEquals("pending", submitted.getCurrentState());
        Assertions.assertEquals(0, submitted.getVersion());
    }

    @Test
    public void shouldWriteActivityLogForEachTransition() {
        Long workflowId = fixture.createWorkflow("sequential", Arrays.asList(
                Collections.singletonList("alice"), Collections.singletonList("bob")));
        Long submissionId = fixture.submit(workflowId);
        fixture.submissionCommandService.approveContent(submissionId, "alice", "step one ok");
        fixture.submissionCommandService.approveContent(submissionId, "bob", null);
        fixture.submissionCommandService.markAsPublished(submissionId, "writer");

        ActivityLogEntity submitted = single(ActivityActionEnum.CONTENT_SUBMITTED);
        Assertions.assertEquals("post", submitted.getResource());
        Assertions.assertEquals(String.valueOf(submissionId), submitted.getResourceId());
        Assertions.assertEquals(workflowId, ((Number) submitted.getDetails().get("workflowId")).longValue());
        Assertions.assertEquals("sequential review", submitted.getDetails().get("workflowName"));
        Assertions.assertEquals("Writer", submitted.getUserName());

        ActivityLogEntity stepApproved = single(ActivityActionEnum.STEP_APPROVED);
        Assertions.assertEquals("alice", stepApproved.getUserId());
        Assertions.assertEquals(1, stepApproved.getDetails().get("step"));
        Assertions.assertEquals("step one ok", stepApproved.getDetails().get("comment"));

        ActivityLogEntity approved = single(ActivityActionEnum.CONTENT_APPROVED);
        Assertions.assertEquals("bob", approved.getUserId());
        Assertions.assertEquals(2, approved.getDetails().get("step"));

        ActivityLogEntity published = single(ActivityActionEnum.CONTENT_PUBLISHED);
        Assertions.assertEquals("writer", published.getUserId());

        List<ActivityLogEntity> created = fixture.activityLogRepository.findByAction(ActivityActionEnum.WORKFLOW_CREATED);
        Assertions.assertEquals(1, created.size());
        Assertions.assertEquals("workflow", created.get(0).getResource());
    }

    @Test
    public void shouldNotWriteActivityLogWhenTransitionFails() {
        Long workflowId = fixture.createWorkflow("simple", Collections.singletonList(Collections.singletonList("alice")));
        Long submissionId = fixture.submit(workflowId);
        int before = fixture.activityLogRepository.findAll().size();

        Assertions.assertThrows(AppException.class,
                () -> fixture.submissionCommandService.approveContent(submissionId, "erin", null));

        Assertions.assertEquals(before, fixture.activityLogRepository.findAll().size());
    }

    @Test
    public void shouldSucceedWhenActivityLogWriteFails() {
        Long workflowId = fixture.createWorkflow("simple", Collections.singletonList(Collections.singletonList("alice")));
        Long submissionId = fixture.submit(workflowId);
        fixture.activityLogRepository.failWrites(true);

        SubmissionDTO approved = fixture.submissionCommandService.approveContent(submissionId, "alice", null);

        Assertions.assertEquals("approved", approved.getCurrentState());
        Assertions.assertEquals("approved", fixture.submissionQueryService.getSubmission(submissionId).getCurrentState());
        Assertions.assertTrue(fixture.activityLogRepository.findByAction(ActivityActionEnum.CONTENT_APPROVED).isEmpty());
    }

    private ActivityLogEntity single(ActivityActionEnum action) {
        List<ActivityLogEntity> entries = fixture.activityLogRepository.findByAction(action);
        Assertions.assertEquals(1, entries.size(), action.getCode());
        return entries.get(0);
    }
}
