package org.brown.judgegrid.service;

import lombok.extern.slf4j.Slf4j;
import org.brown.judgegrid.config.OrchestratorProperties;
import org.brown.judgegrid.docker.ContainerHandle;
import org.brown.judgegrid.docker.ContainerOrchestrator;
import org.brown.judgegrid.docker.SetupFailureException;
import org.brown.judgegrid.job.JobTracker;
import org.brown.judgegrid.model.SolutionResult;
import org.brown.judgegrid.model.Submission;
import org.brown.judgegrid.model.Verdict;
import org.brown.judgegrid.runner.HealthChecker;
import org.brown.judgegrid.runner.RunnerClient;
import org.brown.judgegrid.runner.RunnerRequestMapper;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 제출 한 건의 오케스트레이션 흐름
 *
 * PROVISIONING (이미지 확인, 포트, 컨테이너 생성)
 *  -> STARTING
 *  -> HEALTH_CHECKING (스케줄러 폴링)
 *  -> DISPATCHED (JobTracker 등록 + 타이머 + 배치 요청)
 *
 * 디스패치 이전의 모든 실패는 SETUP_FAILED로 모여 INTERNAL_ERROR 결과를 한 번 알린다.
 * DISPATCHED 이후의 종료는 콜백(ResultCollector) 또는 타임아웃이 담당한다.
 */
@Slf4j
@Service
public class EvaluationFlow {

    private final ContainerOrchestrator orchestrator;
    private final HealthChecker healthChecker;
    private final RunnerClient runnerClient;
    private final RunnerRequestMapper requestMapper;
    private final JobTracker jobTracker;
    private final JobFinisher jobFinisher;
    private final OrchestratorProperties properties;
    private final Executor executor;

    public EvaluationFlow(ContainerOrchestrator orchestrator,
                          HealthChecker healthChecker,
                          RunnerClient runnerClient,
                          RunnerRequestMapper requestMapper,
                          JobTracker jobTracker,
                          JobFinisher jobFinisher,
                          OrchestratorProperties properties,
                          @Qualifier("orchestratorExecutor") Executor executor) {
        this.orchestrator = orchestrator;
        this.healthChecker = healthChecker;
        this.runnerClient = runnerClient;
        this.requestMapper = requestMapper;
        this.jobTracker = jobTracker;
        this.jobFinisher = jobFinisher;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * 흐름을 비동기로 시작한다. 호출 전에 JobTracker 예약이 되어 있어야 한다.
     *
     * @return 흐름이 멈춘 상태 (DISPATCHED 또는 SETUP_FAILED)
     */
    public CompletableFuture<JobState> start(Submission submission) {
        String submissionId = submission.getSubmissionId();
        Instant startedAt = Instant.now();
        AtomicReference<ContainerHandle> container = new AtomicReference<>();

        return CompletableFuture
                .supplyAsync(() -> step(submissionId, JobState.PROVISIONING, () -> {
                    String image = properties.imageFor(submission.getLanguage())
                            .orElseThrow(() -> new SetupFailureException(
                                    "No runner image configured for language " + submission.getLanguage()));
                    orchestrator.ensureImage(image);
                    ContainerHandle handle = orchestrator.create(submission, image);
                    container.set(handle);
                    return handle;
                }), executor)
                .thenApplyAsync(handle -> step(submissionId, JobState.STARTING, () -> {
                    orchestrator.start(handle);
                    return handle;
                }), executor)
                .thenCompose(handle -> step(submissionId, JobState.HEALTH_CHECKING,
                        () -> healthChecker.awaitHealthy(handle)))
                .thenApplyAsync(handle -> step(submissionId, JobState.DISPATCHED,
                        () -> dispatch(submission, handle, startedAt)), executor)
                .exceptionally(ex -> handleSetupFailure(submission, container.get(), unwrap(ex), startedAt));
    }

    private JobState dispatch(Submission submission, ContainerHandle handle, Instant startedAt) {
        String submissionId = submission.getSubmissionId();

        // 콜백이 디스패치 응답보다 먼저 올 수 있으므로 요청 전에 추적을 시작한다
        boolean tracked = jobTracker.track(submissionId, submission, handle,
                (id, snapshot, timedOutContainer) -> onTimeout(snapshot, timedOutContainer, startedAt));
        if (!tracked) {
            throw new SetupFailureException("Submission " + submissionId + " could not be tracked");
        }

        runnerClient.dispatch(handle, requestMapper.toBatchRequest(submission));
        return JobState.DISPATCHED;
    }

    private JobState handleSetupFailure(Submission submission, ContainerHandle container,
                                        Throwable cause, Instant startedAt) {
        String submissionId = submission.getSubmissionId();
        MDC.put("submissionId", submissionId);
        try {
            boolean owned = jobTracker.abandon(submissionId) || jobTracker.complete(submissionId).isPresent();
            if (!owned) {
                log.warn("Setup failure for submission {} after job was already finished elsewhere, ignoring",
                        submissionId, cause);
                if (container != null && !container.isTornDown()) {
                    orchestrator.teardown(container);
                }
                return JobState.SETUP_FAILED;
            }

            if (cause instanceof SetupFailureException) {
                log.error("[FAIL][SETUP] Submission {} (container={}): {}",
                        submissionId, container != null ? container.getContainerId() : "N/A", cause.getMessage(), cause);
            } else {
                log.error("[FAIL][INTERNAL] Critical error orchestrating submission {} (container={})",
                        submissionId, container != null ? container.getContainerId() : "N/A", cause);
            }

            String message = "Orchestrator setup failure: " + cause.getMessage();
            jobFinisher.finish(submission, container,
                    SolutionResult.failure(submission, Verdict.INTERNAL_ERROR, message),
                    JobState.SETUP_FAILED, startedAt);
            return JobState.SETUP_FAILED;

        } finally {
            MDC.remove("submissionId");
        }
    }

    private void onTimeout(Submission submission, ContainerHandle container, Instant startedAt) {
        long timeoutSeconds = properties.getJobs().getTimeoutSeconds();
        String message = "Evaluation timed out after " + timeoutSeconds + " s without a result from the runner";

        jobFinisher.finish(submission, container,
                SolutionResult.failure(submission, Verdict.INTERNAL_ERROR, message),
                JobState.TIMED_OUT, startedAt);
    }

    private <T> T step(String submissionId, JobState state, Supplier<T> action) {
        MDC.put("submissionId", submissionId);
        try {
            log.info("[{}] submissionId={}", state, submissionId);
            return action.get();
        } finally {
            MDC.remove("submissionId");
        }
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
