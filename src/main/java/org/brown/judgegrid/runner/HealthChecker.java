package org.brown.judgegrid.runner;

import lombok.extern.slf4j.Slf4j;
import org.brown.judgegrid.config.OrchestratorProperties;
import org.brown.judgegrid.docker.ContainerHandle;
import org.brown.judgegrid.docker.SetupFailureException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runner 컨테이너 준비 대기
 *
 * 고정 간격으로 헬스 경로를 찌르고, 부팅 대기 한도를 넘으면 준비 실패로 끝낸다.
 * 스케줄러는 다음 시도 시각만 잡고, 블로킹 HTTP 호출은 실행기에서 돈다.
 * (스케줄러 스레드는 작업 타임아웃 타이머와 공유된다)
 */
@Slf4j
@Component
public class HealthChecker {

    private final RunnerClient runnerClient;
    private final TaskScheduler scheduler;
    private final Executor executor;
    private final Duration interval;
    private final Duration bootBudget;

    @Autowired
    public HealthChecker(RunnerClient runnerClient,
                         @Qualifier("orchestratorScheduler") TaskScheduler scheduler,
                         @Qualifier("orchestratorExecutor") Executor executor,
                         OrchestratorProperties properties) {
        this(runnerClient, scheduler, executor,
                Duration.ofMillis(properties.getRunner().getHealthIntervalMillis()),
                Duration.ofSeconds(properties.getRunner().getMaxBootWaitSeconds()));
    }

    public HealthChecker(RunnerClient runnerClient, TaskScheduler scheduler, Executor executor,
                         Duration interval, Duration bootBudget) {
        this.runnerClient = runnerClient;
        this.scheduler = scheduler;
        this.executor = executor;
        this.interval = interval;
        this.bootBudget = bootBudget;
    }

    public CompletableFuture<ContainerHandle> awaitHealthy(ContainerHandle handle) {
        CompletableFuture<ContainerHandle> result = new CompletableFuture<>();
        Instant deadline = Instant.now().plus(bootBudget);

        log.debug("Waiting up to {} s for runner {} to become healthy", bootBudget.toSeconds(), handle.getContainerName());
        scheduleCheck(handle, deadline, result, 1, Instant.now());
        return result;
    }

    private void scheduleCheck(ContainerHandle handle, Instant deadline, CompletableFuture<ContainerHandle> result,
                               int attempt, Instant at) {
        scheduler.schedule(() -> {
            try {
                executor.execute(() -> check(handle, deadline, result, attempt));
            } catch (RejectedExecutionException e) {
                result.completeExceptionally(new SetupFailureException(
                        "Health check for " + handle.getContainerName() + " rejected by saturated executor", e));
            }
        }, at);
    }

    private void check(ContainerHandle handle, Instant deadline, CompletableFuture<ContainerHandle> result, int attempt) {
        try {
            if (runnerClient.isHealthy(handle)) {
                log.info("Runner {} healthy after {} attempt(s)", handle.getContainerName(), attempt);
                result.complete(handle);
                return;
            }

            Instant next = Instant.now().plus(interval);
            if (next.isAfter(deadline)) {
                result.completeExceptionally(new SetupFailureException(
                        "Runner container " + handle.getContainerName() + " did not become healthy within "
                                + bootBudget.toSeconds() + " s (" + attempt + " attempts)"));
                return;
            }

            scheduleCheck(handle, deadline, result, attempt + 1, next);

        } catch (Exception e) {
            result.completeExceptionally(e);
        }
    }
}
