package org.brown.judgegrid.job;

import org.brown.judgegrid.TestSubmissions;
import org.brown.judgegrid.docker.ContainerHandle;
import org.brown.judgegrid.model.Submission;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class JobTrackerTest {

    private ThreadPoolTaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private static ContainerHandle container(String id) {
        return new ContainerHandle("cid-" + id, "judge-runner-python-" + id, 40000, "runner-python:latest");
    }

    private static final TimeoutHandler NO_OP = (id, snapshot, container) -> { };

    @Test
    void trackedJobIsVisibleUntilCompleted() {
        JobTracker tracker = new JobTracker(scheduler, 10, Duration.ofSeconds(60));
        Submission submission = TestSubmissions.python("s1", 2);

        assertThat(tracker.track("s1", submission, container("s1"), NO_OP)).isTrue();
        assertThat(tracker.isTracked("s1")).isTrue();

        assertThat(tracker.complete("s1")).isPresent()
                .get().extracting(TrackedJob::getSubmission).isEqualTo(submission);
        assertThat(tracker.isTracked("s1")).isFalse();
        assertThat(tracker.complete("s1")).isEmpty();
        assertThat(tracker.count()).isZero();
    }

    @Test
    void secondTrackForSameIdFails() {
        JobTracker tracker = new JobTracker(scheduler, 10, Duration.ofSeconds(60));
        Submission submission = TestSubmissions.python("dup", 1);

        assertThat(tracker.track("dup", submission, container("a"), NO_OP)).isTrue();
        assertThat(tracker.track("dup", submission, container("b"), NO_OP)).isFalse();
        assertThat(tracker.get("dup")).get()
                .extracting(job -> job.getContainer().getContainerId()).isEqualTo("cid-a");
    }

    @Test
    void reserveRejectsDuplicatesAndCountsTowardCapacity() {
        JobTracker tracker = new JobTracker(scheduler, 2, Duration.ofSeconds(60));

        assertThat(tracker.reserve(TestSubmissions.python("a", 1))).isEqualTo(Reservation.RESERVED);
        assertThat(tracker.reserve(TestSubmissions.python("a", 1))).isEqualTo(Reservation.DUPLICATE);
        assertThat(tracker.reserve(TestSubmissions.python("b", 1))).isEqualTo(Reservation.RESERVED);
        assertThat(tracker.reserve(TestSubmissions.python("c", 1))).isEqualTo(Reservation.AT_CAPACITY);

        // 예약만 된 작업은 콜백 대상이 아니다
        assertThat(tracker.isTracked("a")).isFalse();
        assertThat(tracker.count()).isEqualTo(2);
    }

    @Test
    void trackUpgradesReservationAndAbandonOnlyReleasesReservations() {
        JobTracker tracker = new JobTracker(scheduler, 1, Duration.ofSeconds(60));
        Submission submission = TestSubmissions.python("r1", 1);

        tracker.reserve(submission);
        assertThat(tracker.track("r1", submission, container("r1"), NO_OP)).isTrue();
        assertThat(tracker.isTracked("r1")).isTrue();
        assertThat(tracker.count()).isEqualTo(1);

        assertThat(tracker.abandon("r1")).isFalse();
        assertThat(tracker.complete("r1")).isPresent();

        tracker.reserve(submission);
        assertThat(tracker.complete("r1")).isEmpty();
        assertThat(tracker.abandon("r1")).isTrue();
        assertThat(tracker.count()).isZero();
    }

    @Test
    void timeoutFiresOnceAndRemovesEntry() throws InterruptedException {
        JobTracker tracker = new JobTracker(scheduler, 10, Duration.ofSeconds(1));
        Submission submission = TestSubmissions.python("slow", 1);
        ContainerHandle handle = container("slow");

        AtomicInteger calls = new AtomicInteger();
        CountDownLatch fired = new CountDownLatch(1);
        List<ContainerHandle> seen = new CopyOnWriteArrayList<>();
        long start = System.nanoTime();
        long[] firedAfterMillis = new long[1];

        tracker.track("slow", submission, handle, (id, snapshot, timedOut) -> {
            firedAfterMillis[0] = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            calls.incrementAndGet();
            seen.add(timedOut);
            fired.countDown();
        });

        assertThat(fired.await(3, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(200);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(firedAfterMillis[0]).isBetween(950L, 2000L);
        assertThat(seen).containsExactly(handle);
        assertThat(tracker.isTracked("slow")).isFalse();
        assertThat(tracker.complete("slow")).isEmpty();
    }

    @Test
    void completedJobNeverTimesOut() throws InterruptedException {
        JobTracker tracker = new JobTracker(scheduler, 10, Duration.ofMillis(300));
        AtomicInteger calls = new AtomicInteger();

        tracker.track("fast", TestSubmissions.python("fast", 1), container("fast"),
                (id, snapshot, c) -> calls.incrementAndGet());
        assertThat(tracker.complete("fast")).isPresent();

        Thread.sleep(600);
        assertThat(calls.get()).isZero();
    }

    @Test
    void completeAndTimeoutRaceHasExactlyOneWinner() throws InterruptedException {
        for (int i = 0; i < 200; i++) {
            JobTracker tracker = new JobTracker(scheduler, 10, Duration.ofMillis(5));
            String id = "race-" + i;
            AtomicInteger timeouts = new AtomicInteger();
            CountDownLatch timeoutDone = new CountDownLatch(1);

            tracker.track(id, TestSubmissions.python(id, 1), container(id), (sid, snapshot, c) -> {
                timeouts.incrementAndGet();
                timeoutDone.countDown();
            });

            Thread.sleep(5);
            boolean completed = tracker.complete(id).isPresent();

            if (!completed) {
                assertThat(timeoutDone.await(1, TimeUnit.SECONDS)).isTrue();
            } else {
                Thread.sleep(10);
            }

            assertThat(timeouts.get() + (completed ? 1 : 0))
                    .as("iteration %d", i)
                    .isEqualTo(1);
            assertThat(tracker.isTracked(id)).isFalse();
        }
    }
}
