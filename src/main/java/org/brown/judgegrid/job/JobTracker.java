package org.brown.judgegrid.job;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.brown.judgegrid.config.OrchestratorProperties;
import org.brown.judgegrid.docker.ContainerHandle;
import org.brown.judgegrid.model.Submission;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * 제출 ID -> 진행 중 작업 추적기
 *
 * 프로세스 전역에서 공유되는 유일한 가변 상태.
 * 타임아웃 경로와 정상 완료 경로는 같은 remove(key, value) 한 번으로 경쟁하며,
 * 제거에 성공한 쪽만 종료 처리(알림, 컨테이너 정리)를 진행한다.
 */
@Slf4j
@Component
public class JobTracker {

    private final ConcurrentHashMap<String, TrackedJob> jobs = new ConcurrentHashMap<>();

    // 삽입끼리만 직렬화 (용량 검사 + putIfAbsent). 제거는 락 없이 진행
    private final Object insertLock = new Object();

    private final TaskScheduler scheduler;
    private final int maxJobs;
    private final Duration timeout;

    @Autowired
    public JobTracker(@Qualifier("orchestratorScheduler") TaskScheduler scheduler,
                      OrchestratorProperties properties) {
        this(scheduler,
                properties.getJobs().getMaxConcurrentJobs(),
                Duration.ofSeconds(properties.getJobs().getTimeoutSeconds()));
    }

    public JobTracker(TaskScheduler scheduler, int maxJobs, Duration timeout) {
        this.scheduler = scheduler;
        this.maxJobs = maxJobs;
        this.timeout = timeout;
    }

    /**
     * 용량과 중복을 한 번에 검사하고 예약 레코드를 넣는다.
     */
    public Reservation reserve(Submission submission) {
        String submissionId = submission.getSubmissionId();

        synchronized (insertLock) {
            if (jobs.size() >= maxJobs) {
                log.warn("Rejecting submission {}: {} jobs tracked (max {})", submissionId, jobs.size(), maxJobs);
                return Reservation.AT_CAPACITY;
            }
            if (jobs.putIfAbsent(submissionId, TrackedJob.reserved(submission)) != null) {
                log.info("Attempted to reserve submission {} which is already being tracked.", submissionId);
                return Reservation.DUPLICATE;
            }
        }

        log.debug("Reserved slot for submission {} ({} / {})", submissionId, jobs.size(), maxJobs);
        return Reservation.RESERVED;
    }

    /**
     * 작업을 armed 상태로 등록하고 타임아웃 타이머를 건다.
     *
     * 같은 ID의 예약이 있으면 그 예약을 승격하고, 이미 armed 작업이 있으면 실패한다.
     *
     * @return 등록 성공 여부 (false면 중복)
     */
    public boolean track(String submissionId, Submission snapshot, ContainerHandle container, TimeoutHandler onTimeout) {
        TrackedJob armed;

        synchronized (insertLock) {
            TrackedJob existing = jobs.get(submissionId);
            if (existing == null) {
                if (jobs.size() >= maxJobs) {
                    log.warn("Cannot track submission {}: capacity {} reached", submissionId, maxJobs);
                    return false;
                }
                armed = TrackedJob.armed(snapshot, container, Instant.now());
                jobs.put(submissionId, armed);
            } else if (!existing.isArmed()) {
                armed = TrackedJob.armed(snapshot, container, existing.getCreatedAt());
                if (!jobs.replace(submissionId, existing, armed)) {
                    log.warn("Reservation for submission {} vanished before tracking", submissionId);
                    return false;
                }
            } else {
                log.info("Attempted to track submission {} which is already being tracked.", submissionId);
                return false;
            }
        }

        ScheduledFuture<?> future = scheduler.schedule(
                () -> expire(submissionId, armed, onTimeout),
                Instant.now().plus(timeout));
        armed.attachTimeout(future);

        log.info("Started tracking submission {} with a timeout of {} s.", submissionId, timeout.toSeconds());
        return true;
    }

    /**
     * armed 작업을 제거하고 타이머를 해제한다. 이미 없으면 아무것도 하지 않는다.
     *
     * @return 이 호출이 제거한 작업 (타임아웃에 졌거나 이미 완료됐으면 empty)
     */
    public Optional<TrackedJob> complete(String submissionId) {
        TrackedJob job = jobs.get(submissionId);
        if (job == null || !job.isArmed()) {
            return Optional.empty();
        }
        if (!jobs.remove(submissionId, job)) {
            return Optional.empty();
        }

        job.dispose();
        log.info("Completing tracking for submission {}.", submissionId);
        return Optional.of(job);
    }

    /**
     * 아직 armed 되지 않은 예약을 해제한다 (디스패치 이전 준비 실패).
     */
    public boolean abandon(String submissionId) {
        TrackedJob job = jobs.get(submissionId);
        if (job == null || job.isArmed()) {
            return false;
        }
        boolean removed = jobs.remove(submissionId, job);
        if (removed) {
            log.info("Released reservation for submission {}.", submissionId);
        }
        return removed;
    }

    public boolean isTracked(String submissionId) {
        TrackedJob job = jobs.get(submissionId);
        return job != null && job.isArmed();
    }

    public Optional<TrackedJob> get(String submissionId) {
        return Optional.ofNullable(jobs.get(submissionId));
    }

    public int count() {
        return jobs.size();
    }

    public int capacity() {
        return maxJobs;
    }

    private void expire(String submissionId, TrackedJob job, TimeoutHandler onTimeout) {
        if (!jobs.remove(submissionId, job)) {
            log.debug("Timer fired for submission {} after completion, ignoring", submissionId);
            return;
        }

        job.dispose();
        log.warn("[TIMEOUT] Submission {} exceeded {} s without callback", submissionId, timeout.toSeconds());

        try {
            onTimeout.onTimeout(submissionId, job.getSubmission(), job.getContainer());
        } catch (Exception e) {
            log.error("[FAIL][TIMEOUT] Timeout handler failed for submission {}", submissionId, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Cancelling {} tracked job timer(s)", jobs.size());
        jobs.values().forEach(TrackedJob::dispose);
    }
}
