package org.brown.judgegrid.service;

import lombok.extern.slf4j.Slf4j;
import org.brown.judgegrid.docker.ContainerHandle;
import org.brown.judgegrid.docker.ContainerOrchestrator;
import org.brown.judgegrid.metrics.JobMetricsPublisher;
import org.brown.judgegrid.model.SolutionResult;
import org.brown.judgegrid.model.Submission;
import org.brown.judgegrid.notify.ResultNotifier;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 작업 종료 처리 (알림 1회 + 컨테이너 정리 + 메트릭)
 *
 * JobTracker에서 작업 제거에 성공한 쪽만 호출한다.
 */
@Slf4j
@Component
public class JobFinisher {

    private final ContainerOrchestrator orchestrator;
    private final ResultNotifier notifier;
    private final JobMetricsPublisher metricsPublisher;
    private final Executor executor;

    public JobFinisher(ContainerOrchestrator orchestrator,
                       ResultNotifier notifier,
                       JobMetricsPublisher metricsPublisher,
                       @Qualifier("orchestratorExecutor") Executor executor) {
        this.orchestrator = orchestrator;
        this.notifier = notifier;
        this.metricsPublisher = metricsPublisher;
        this.executor = executor;
    }

    public void finish(Submission submission, ContainerHandle container, SolutionResult result,
                       JobState outcome, Instant startedAt) {
        Runnable work = () -> deliver(submission, container, result, outcome, startedAt);
        try {
            executor.execute(work);
        } catch (RejectedExecutionException e) {
            log.warn("Executor saturated, finishing submission {} on caller thread", submission.getSubmissionId());
            work.run();
        }
    }

    private void deliver(Submission submission, ContainerHandle container, SolutionResult result,
                         JobState outcome, Instant startedAt) {
        String submissionId = submission.getSubmissionId();
        MDC.put("submissionId", submissionId);
        try {
            long durationMillis = Duration.between(startedAt, Instant.now()).toMillis();
            log.info("[DONE][{}] submissionId={} overallStatus={} in {}ms",
                    outcome, submissionId, result.getOverallStatus(), durationMillis);

            try {
                notifier.notify(submissionId, result);
            } catch (Exception e) {
                log.error("[FAIL][NOTIFY] Notifier threw for submission {}", submissionId, e);
            }

            orchestrator.teardown(container);
            metricsPublisher.publishOutcome(submission.languageKey(), outcome, durationMillis);

        } finally {
            MDC.remove("submissionId");
        }
    }
}
