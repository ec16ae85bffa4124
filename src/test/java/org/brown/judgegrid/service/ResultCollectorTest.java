package org.brown.judgegrid.service;

import org.brown.judgegrid.TestSubmissions;
import org.brown.judgegrid.config.JacksonConfig;
import org.brown.judgegrid.docker.ContainerHandle;
import org.brown.judgegrid.docker.ContainerOrchestrator;
import org.brown.judgegrid.job.JobTracker;
import org.brown.judgegrid.metrics.JobMetricsPublisher;
import org.brown.judgegrid.model.OverallStatus;
import org.brown.judgegrid.model.RunnerCallback;
import org.brown.judgegrid.model.SolutionResult;
import org.brown.judgegrid.model.Submission;
import org.brown.judgegrid.model.TestCaseResult;
import org.brown.judgegrid.model.Verdict;
import org.brown.judgegrid.notify.ResultNotifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResultCollectorTest {

    private ThreadPoolTaskScheduler scheduler;
    private JobTracker jobTracker;
    private ContainerOrchestrator orchestrator;
    private ResultNotifier notifier;
    private ResultCollector collector;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.initialize();
        jobTracker = new JobTracker(scheduler, 10, Duration.ofSeconds(60));
        orchestrator = mock(ContainerOrchestrator.class);
        notifier = mock(ResultNotifier.class);
        JobFinisher finisher = new JobFinisher(orchestrator, notifier, mock(JobMetricsPublisher.class), Runnable::run);
        collector = new ResultCollector(jobTracker, finisher);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private ContainerHandle track(Submission submission) {
        ContainerHandle handle = new ContainerHandle("cid", "judge-runner-python-abc123", 41000, "runner-python");
        jobTracker.track(submission.getSubmissionId(), submission, handle, (id, s, c) -> { });
        return handle;
    }

    private static RunnerCallback.Item item(String id, Verdict status) {
        return RunnerCallback.Item.builder()
                .testCaseId(id)
                .status(status)
                .stdout("out-" + id)
                .stderr("")
                .durationMs(12L)
                .build();
    }

    private SolutionResult capturedResult(String submissionId) {
        ArgumentCaptor<SolutionResult> captor = ArgumentCaptor.forClass(SolutionResult.class);
        verify(notifier, times(1)).notify(eq(submissionId), captor.capture());
        return captor.getValue();
    }

    @Test
    void compilationFailureMarksEveryTestCase() {
        Submission submission = TestSubmissions.python("c1", 3);
        ContainerHandle handle = track(submission);

        RunnerCallback callback = RunnerCallback.builder()
                .compilationSuccess(false)
                .compilerOutput("SyntaxError: invalid syntax")
                .build();

        assertThat(collector.handleCallback("c1", callback)).isEqualTo(CallbackOutcome.ACKNOWLEDGED);

        SolutionResult result = capturedResult("c1");
        assertThat(result.getOverallStatus()).isEqualTo(OverallStatus.COMPILE_ERROR);
        assertThat(result.isCompilationSuccess()).isFalse();
        assertThat(result.getCompilerOutput()).isEqualTo("SyntaxError: invalid syntax");
        assertThat(result.getResults()).hasSize(3).allSatisfy(r -> {
            assertThat(r.getStatus()).isEqualTo(Verdict.COMPILE_ERROR);
            assertThat(r.getStdout()).isNull();
            assertThat(r.getStderr()).isNull();
            assertThat(r.getMessage()).isEqualTo(ResultCollector.COMPILE_FAILED_MESSAGE);
        });
        assertThat(result.getResults()).extracting(TestCaseResult::getTestCaseInputPath)
                .containsExactly("problems/p1/in1.txt", "problems/p1/in2.txt", "problems/p1/in3.txt");
        verify(orchestrator, times(1)).teardown(handle);
    }

    @Test
    void allAcceptedYieldsAccepted() {
        Submission submission = TestSubmissions.python("a1", 2);
        track(submission);

        collector.handleCallback("a1", RunnerCallback.builder()
                .compilationSuccess(true)
                .testCaseResults(List.of(item("t1", Verdict.ACCEPTED), item("t2", Verdict.ACCEPTED)))
                .build());

        SolutionResult result = capturedResult("a1");
        assertThat(result.getOverallStatus()).isEqualTo(OverallStatus.ACCEPTED);
        assertThat(result.getResults()).extracting(TestCaseResult::getTestCaseInputPath)
                .containsExactly("problems/p1/in1.txt", "problems/p1/in2.txt");
        assertThat(result.getResults().get(0).getStdout()).isEqualTo("out-t1");
        assertThat(result.getResults().get(0).getDurationMs()).isEqualTo(12L);
    }

    @Test
    void mixedVerdictsYieldCompletedWithIssues() {
        Submission submission = TestSubmissions.python("m1", 2);
        track(submission);

        collector.handleCallback("m1", RunnerCallback.builder()
                .compilationSuccess(true)
                .testCaseResults(List.of(item("t1", Verdict.ACCEPTED), item("t2", Verdict.WRONG_ANSWER)))
                .build());

        assertThat(capturedResult("m1").getOverallStatus()).isEqualTo(OverallStatus.COMPLETED_WITH_ISSUES);
    }

    @Test
    void emptyResultListYieldsCompleted() {
        Submission submission = TestSubmissions.python("e1", 1);
        track(submission);

        collector.handleCallback("e1", RunnerCallback.builder().compilationSuccess(true).build());

        SolutionResult result = capturedResult("e1");
        assertThat(result.getOverallStatus()).isEqualTo(OverallStatus.COMPLETED);
        assertThat(result.getResults()).isEmpty();
    }

    @Test
    void correlatesByInputPathSuffixAndLabelsUnknownResults() {
        Submission submission = TestSubmissions.python("s1", 2);
        track(submission);

        collector.handleCallback("s1", RunnerCallback.builder()
                .compilationSuccess(true)
                .testCaseResults(List.of(item("in2.txt", Verdict.ACCEPTED), item("zzz", Verdict.RUNTIME_ERROR)))
                .build());

        List<TestCaseResult> results = capturedResult("s1").getResults();
        assertThat(results.get(0).getTestCaseInputPath()).isEqualTo("problems/p1/in2.txt");
        assertThat(results.get(0).getTestCaseId()).isEqualTo("t2");
        assertThat(results.get(1).getTestCaseInputPath()).isEqualTo(ResultCollector.UNKNOWN_TEST_CASE);
        assertThat(results.get(1).getTestCaseId()).isEqualTo("zzz");
        assertThat(results.get(1).getStatus()).isEqualTo(Verdict.RUNTIME_ERROR);
    }

    @Test
    void blankIdIsNeverMatchedBySuffix() {
        Submission submission = TestSubmissions.python("b1", 1);
        track(submission);

        collector.handleCallback("b1", RunnerCallback.builder()
                .compilationSuccess(true)
                .testCaseResults(List.of(item("", Verdict.ACCEPTED)))
                .build());

        assertThat(capturedResult("b1").getResults().get(0).getTestCaseInputPath())
                .isEqualTo(ResultCollector.UNKNOWN_TEST_CASE);
    }

    @Test
    void untrackedSubmissionIsIgnored() {
        RunnerCallback callback = RunnerCallback.builder().compilationSuccess(true).build();

        assertThat(collector.handleCallback("ghost", callback)).isEqualTo(CallbackOutcome.UNKNOWN_SUBMISSION);
        verify(notifier, never()).notify(any(), any());
        verify(orchestrator, never()).teardown(any());
    }

    @Test
    void secondCallbackForSameSubmissionIsStale() {
        Submission submission = TestSubmissions.python("d1", 1);
        track(submission);
        RunnerCallback callback = RunnerCallback.builder()
                .compilationSuccess(true)
                .testCaseResults(List.of(item("t1", Verdict.ACCEPTED)))
                .build();

        assertThat(collector.handleCallback("d1", callback)).isEqualTo(CallbackOutcome.ACKNOWLEDGED);
        assertThat(collector.handleCallback("d1", callback)).isEqualTo(CallbackOutcome.UNKNOWN_SUBMISSION);

        verify(notifier, times(1)).notify(eq("d1"), any());
        verify(orchestrator, times(1)).teardown(any());
    }

    @Test
    void reservedButNotDispatchedSubmissionIsNotAcceptedAsCallback() {
        jobTracker.reserve(TestSubmissions.python("r1", 1));

        assertThat(collector.handleCallback("r1", RunnerCallback.builder().build()))
                .isEqualTo(CallbackOutcome.UNKNOWN_SUBMISSION);
        assertThat(jobTracker.count()).isEqualTo(1);
    }

    @Test
    void nullResultEntriesAreSkipped() throws Exception {
        Submission submission = TestSubmissions.python("n1", 1);
        ContainerHandle handle = track(submission);
        RunnerCallback callback = new JacksonConfig().objectMapper().readValue(
                "{\"compilationSuccess\":true,\"testCaseResults\":[null,"
                        + "{\"testCaseId\":\"t1\",\"status\":\"ACCEPTED\"}]}",
                RunnerCallback.class);

        assertThat(collector.handleCallback("n1", callback)).isEqualTo(CallbackOutcome.ACKNOWLEDGED);

        SolutionResult result = capturedResult("n1");
        assertThat(result.getOverallStatus()).isEqualTo(OverallStatus.ACCEPTED);
        assertThat(result.getResults()).hasSize(1);
        verify(orchestrator, times(1)).teardown(handle);
    }

    @Test
    void assemblyFailureStillNotifiesOnceAndTearsDown() {
        Submission submission = TestSubmissions.python("x1", 2);
        ContainerHandle handle = track(submission);
        RunnerCallback callback = mock(RunnerCallback.class);
        when(callback.isCompilationSuccess()).thenReturn(true);
        when(callback.getTestCaseResults()).thenThrow(new IllegalStateException("corrupt payload"));

        assertThat(collector.handleCallback("x1", callback)).isEqualTo(CallbackOutcome.ACKNOWLEDGED);

        SolutionResult result = capturedResult("x1");
        assertThat(result.getOverallStatus()).isEqualTo(OverallStatus.FAILED);
        assertThat(result.getCompilerOutput()).contains("corrupt payload");
        assertThat(result.getResults()).hasSize(2)
                .allSatisfy(r -> assertThat(r.getStatus()).isEqualTo(Verdict.INTERNAL_ERROR));
        verify(orchestrator, times(1)).teardown(handle);
        assertThat(jobTracker.count()).isZero();
    }

    @Test
    void overallStatusPrecedence() {
        TestCaseResult ok = TestCaseResult.builder().status(Verdict.ACCEPTED).build();
        TestCaseResult tle = TestCaseResult.builder().status(Verdict.TIME_LIMIT_EXCEEDED).build();

        assertThat(ResultCollector.overallStatus(false, List.of(ok))).isEqualTo(OverallStatus.COMPILE_ERROR);
        assertThat(ResultCollector.overallStatus(true, List.of(ok, tle))).isEqualTo(OverallStatus.COMPLETED_WITH_ISSUES);
        assertThat(ResultCollector.overallStatus(true, List.of(ok))).isEqualTo(OverallStatus.ACCEPTED);
        assertThat(ResultCollector.overallStatus(true, List.of())).isEqualTo(OverallStatus.COMPLETED);
    }
}
