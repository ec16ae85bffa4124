package org.brown.judgegrid.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.judgegrid.job.JobTracker;
import org.brown.judgegrid.job.TrackedJob;
import org.brown.judgegrid.model.OverallStatus;
import org.brown.judgegrid.model.RunnerCallback;
import org.brown.judgegrid.model.SolutionResult;
import org.brown.judgegrid.model.Submission;
import org.brown.judgegrid.model.TestCase;
import org.brown.judgegrid.model.TestCaseResult;
import org.brown.judgegrid.model.Verdict;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runner 콜백 처리
 *
 * 1. 추적 중이 아닌 제출이면 무시 (타임아웃 이후 도착한 콜백 등)
 * 2. JobTracker.complete로 종료 권한 획득. 실패하면 무시
 * 3. 원본 테스트 케이스와 결과를 매칭하고 전체 판정 계산
 * 4. 알림 1회 + 컨테이너 정리
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResultCollector {

    static final String UNKNOWN_TEST_CASE = "Unknown";
    static final String COMPILE_FAILED_MESSAGE = "Compilation failed (see compiler output).";

    private final JobTracker jobTracker;
    private final JobFinisher jobFinisher;

    public CallbackOutcome handleCallback(String submissionId, RunnerCallback callback) {
        MDC.put("submissionId", submissionId);
        try {
            if (!jobTracker.isTracked(submissionId)) {
                log.info("Ignoring callback for untracked submission {} (stale or duplicate)", submissionId);
                return CallbackOutcome.UNKNOWN_SUBMISSION;
            }

            Optional<TrackedJob> completed = jobTracker.complete(submissionId);
            if (completed.isEmpty()) {
                log.info("Callback for submission {} lost the race to another terminal event, ignoring", submissionId);
                return CallbackOutcome.UNKNOWN_SUBMISSION;
            }

            // 여기부터는 이 호출이 작업을 소유한다. 어떤 경우에도 finish까지 가야 한다
            TrackedJob job = completed.get();
            SolutionResult result;
            try {
                result = assemble(job.getSubmission(), callback);
                log.info("Runner callback for submission {}: compilation={}, results={}, overall={}",
                        submissionId, callback.isCompilationSuccess(), result.getResults().size(), result.getOverallStatus());
            } catch (RuntimeException e) {
                log.error("[FAIL][CALLBACK] Could not assemble result for submission {}", submissionId, e);
                result = SolutionResult.failure(job.getSubmission(), Verdict.INTERNAL_ERROR,
                        "Malformed runner callback: " + e.getMessage());
            }

            jobFinisher.finish(job.getSubmission(), job.getContainer(), result, JobState.COMPLETED, job.getCreatedAt());
            return CallbackOutcome.ACKNOWLEDGED;

        } finally {
            MDC.remove("submissionId");
        }
    }

    SolutionResult assemble(Submission submission, RunnerCallback callback) {
        List<TestCaseResult> results;

        if (callback.isCompilationSuccess()) {
            List<RunnerCallback.Item> reported = callback.getTestCaseResults() != null
                    ? callback.getTestCaseResults()
                    : List.of();
            results = new ArrayList<>(reported.size());
            for (RunnerCallback.Item item : reported) {
                if (item == null) {
                    log.warn("Skipping null test case result from runner for submission {}", submission.getSubmissionId());
                    continue;
                }
                results.add(correlate(submission.getTestCases(), item));
            }
        } else {
            log.warn("Compilation failed for submission {}. Compiler Output: {}",
                    submission.getSubmissionId(), callback.getCompilerOutput());
            // 실행 결과를 만들어내지 않는다: stdout/stderr 없음
            results = submission.getTestCases().stream()
                    .map(tc -> TestCaseResult.builder()
                            .testCaseInputPath(tc.getInputFilePath())
                            .testCaseId(tc.getTestCaseId())
                            .status(Verdict.COMPILE_ERROR)
                            .message(COMPILE_FAILED_MESSAGE)
                            .build())
                    .collect(Collectors.toList());
        }

        return SolutionResult.builder()
                .overallStatus(overallStatus(callback.isCompilationSuccess(), results))
                .compilationSuccess(callback.isCompilationSuccess())
                .compilerOutput(callback.getCompilerOutput())
                .results(results)
                .build();
    }

    /**
     * id 일치 -> 입력 경로 suffix 일치 -> "Unknown" 순으로 원본 테스트 케이스를 찾는다.
     */
    TestCaseResult correlate(List<TestCase> originals, RunnerCallback.Item item) {
        String reportedId = item.getTestCaseId();
        Optional<TestCase> match = Optional.empty();

        if (reportedId != null && !reportedId.isBlank()) {
            match = originals.stream()
                    .filter(tc -> reportedId.equals(tc.getTestCaseId()))
                    .findFirst();
            if (match.isEmpty()) {
                match = originals.stream()
                        .filter(tc -> tc.getInputFilePath() != null && tc.getInputFilePath().endsWith(reportedId))
                        .findFirst();
            }
        }

        if (match.isEmpty()) {
            log.warn("Runner reported result for unknown test case id '{}'", reportedId);
        }

        return TestCaseResult.builder()
                .testCaseInputPath(match.map(TestCase::getInputFilePath).orElse(UNKNOWN_TEST_CASE))
                .testCaseId(match.map(TestCase::getTestCaseId).orElse(reportedId))
                .status(item.getStatus() != null ? item.getStatus() : Verdict.INTERNAL_ERROR)
                .stdout(item.getStdout())
                .stderr(item.getStderr())
                .message(item.getMessage())
                .durationMs(item.getDurationMs())
                .maximumMemoryException(item.isMaximumMemoryException())
                .build();
    }

    static OverallStatus overallStatus(boolean compilationSuccess, List<TestCaseResult> results) {
        if (!compilationSuccess) {
            return OverallStatus.COMPILE_ERROR;
        }
        if (results.stream().anyMatch(r -> r.getStatus() != Verdict.ACCEPTED)) {
            return OverallStatus.COMPLETED_WITH_ISSUES;
        }
        if (!results.isEmpty()) {
            return OverallStatus.ACCEPTED;
        }
        return OverallStatus.COMPLETED;
    }
}
