package org.brown.judgegrid.job;

import lombok.Getter;
import org.brown.judgegrid.docker.ContainerHandle;
import org.brown.judgegrid.model.Submission;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * 진행 중인 제출 한 건의 추적 레코드
 *
 * - reserved: Admission 통과 후 컨테이너 준비 중 (container == null)
 * - armed: 컨테이너 준비 완료, 타임아웃 타이머 동작 중
 *
 * armed 인스턴스는 교체되지 않으므로 Map.remove(key, value)로 소유권을 가른다.
 */
@Getter
public class TrackedJob {

    private final Submission submission;
    private final ContainerHandle container;
    private final Instant createdAt;

    private volatile ScheduledFuture<?> timeout;
    private volatile boolean disposed;

    private TrackedJob(Submission submission, ContainerHandle container, Instant createdAt) {
        this.submission = submission;
        this.container = container;
        this.createdAt = createdAt;
    }

    static TrackedJob reserved(Submission submission) {
        return new TrackedJob(submission, null, Instant.now());
    }

    static TrackedJob armed(Submission submission, ContainerHandle container, Instant createdAt) {
        return new TrackedJob(submission, container, createdAt);
    }

    public boolean isArmed() {
        return container != null;
    }

    void attachTimeout(ScheduledFuture<?> future) {
        this.timeout = future;
        if (disposed) {
            future.cancel(false);
        }
    }

    void dispose() {
        disposed = true;
        ScheduledFuture<?> future = timeout;
        if (future != null) {
            future.cancel(false);
        }
    }

    @Override
    public String toString() {
        return String.format("TrackedJob[submissionId=%s, container=%s, createdAt=%s, armed=%s]",
                submission.getSubmissionId(), container, createdAt, isArmed());
    }
}
