package com.contentflow.test;

import com.contentflow.api.dto.SubmissionDTO;
import com.contentflow.test.support.ApprovalTestFixture;
import com.contentflow.types.enums.ActivityActionEnum;
import com.contentflow.types.enums.ResponseCode;
import com.contentflow.types.exception.AppException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class SubmissionConcurrencyTest {

    private final ApprovalTestFixture fixture = new ApprovalTestFixture();
    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void shouldKeepEveryConcurrentParallelApproval() throws Exception {
        Long workflowId = fixture.createWorkflow("parallel", Collections.singletonList(
                Arrays.asList("alice", "bob", "carol", "dave")));
        Long submissionId = fixture.submit(workflowId);

        List<Outcome> outcomes = runTogether(Arrays.asList(
                () -> fixture.submissionCommandService.approveContent(submissionId, "alice", null),
                () -> fixture.submissionCommandService.approveContent(submissionId, "bob", null),
                () -> fixture.submissionCommandService.approveContent(submissionId, "carol", null),
                () -> fixture.submissionCommandService.approveContent(submissionId, "dave", null)));

        for (Outcome outcome : outcomes) {
            Assertions.assertNull(outcome.error);
        }
        SubmissionDTO stored = fixture.submissionQueryService.getSubmission(submissionId);
        Assertions.assertEquals("approved", stored.getCurrentState());
        Assertions.assertEquals(new HashSet<>(Arrays.asList("alice", "bob", "carol", "dave")),
                new HashSet<>(stored.getSteps().get(0).getApprovedBy()));
        Assertions.assertEquals(4, stored.getSteps().get(0).getApprovedBy().size());
        Assertions.assertEquals(4, stored.getVersion());
        Assertions.assertEquals(3, fixture.activityLogRepository.findByAction(ActivityActionEnum.STEP_APPROVED).size());
        Assertions.assertEquals(1, fixture.activityLogRepository.findByAction(ActivityActionEnum.CONTENT_APPROVED).size());
    }

    @Test
    public void shouldAcceptOnlyOneOfTwoIdenticalApprovals() throws Exception {
        Long workflowId = fixture.createWorkflow("parallel", Collections.singletonList(Arrays.asList("alice", "bob")));
        Long submissionId = fixture.submit(workflowId);

        List<Outcome> outcomes = runTogether(Arrays.asList(
                () -> fixture.submissionCommandService.approveContent(submissionId, "alice", null),
                () -> fixture.submissionCommandService.approveContent(submissionId, "alice", null)));

        Assertions.assertEquals(1, outcomes.stream().filter(outcome -> outcome.error == null).count());
        AppException error = outcomes.stream().filter(outcome -> outcome.error != null).findFirst().get().error;
        Assertions.assertEquals(ResponseCode.ALREADY_APPROVED.getCode(), error.getCode());
        SubmissionDTO stored = fixture.submissionQueryService.getSubmission(submissionId);
        Assertions.assertEquals(Collections.singletonList("alice"), stored.getSteps().get(0).getApprovedBy());
        Assertions.assertEquals("pending", stored.getCurrentState());
    }

    @Test
    public void shouldSettleApproveAndRejectRaceOnSingleOutcome() throws Exception {
        Long workflowId = fixture.createWorkflow("simple", Collections.singletonList(Arrays.asList("alice", "bob")));
        Long submissionId = fixture.submit(workflowId);

        List<Outcome> outcomes = runTogether(Arrays.asList(
                () -> fixture.submissionCommandService.approveContent(submissionId, "alice", null),
                () -> fixture.submissionCommandService.rejectContent(submissionId, "bob", "not ready")));

        Assertions.assertEquals(1, outcomes.stream().filter(outcome -> outcome.error == null).count());
        AppException error = outcomes.stream().filter(outcome -> outcome.error != null).findFirst().get().error;
        Assertions.assertEquals(ResponseCode.SUBMISSION_NOT_PENDING.getCode(), error.getCode());

        SubmissionDTO winner = outcomes.stream().filter(outcome -> outcome.error == null).findFirst().get().result;
        SubmissionDTO stored = fixture.submissionQueryService.getSubmission(submissionId);
        Assertions.assertEquals(winner.getCurrentState(), stored.getCurrentState());
        if ("approved".equals(stored.getCurrentState())) {
            Assertions.assertEquals("alice", stored.getFinalApprovedBy());
            Assertions.assertNull(stored.getFinalRejectedBy());
        } else {
            Assertions.assertEquals("rejected", stored.getCurrentState());
            Assertions.assertEquals("bob", stored.getFinalRejectedBy());
            Assertions.assertNull(stored.getFinalApprovedBy());
        }
        Assertions.assertEquals(1, stored.getVersion());
    }

    private List<Outcome> runTogether(List<Callable<SubmissionDTO>> actions) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Outcome>> futures = new ArrayList<>();
        for (Callable<SubmissionDTO> action : actions) {
            futures.add(executor.submit(() -> {
                start.await();
                try {
                    return new Outcome(action.call(), null);
                } catch (AppException ex) {
                    return new Outcome(null, ex);
                }
            }));
        }
        start.countDown();
        List<Outcome> outcomes = new ArrayList<>();
        for (Future<Outcome> future : futures) {
            try {
                outcomes.add(future.get(10, TimeUnit.SECONDS));
            } catch (ExecutionException ex) {
                throw new AssertionError("unexpected failure", ex.getCause());
            }
        }
        return outcomes;
    }

    private static class Outcome {

        private final SubmissionDTO result;
        private final AppException error;

        private Outcome(SubmissionDTO result, AppException error) {
            this.result = result;
            this.error = error;
        }
    }
}
