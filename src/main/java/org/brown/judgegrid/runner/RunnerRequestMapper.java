package org.brown.judgegrid.runner;

import org.brown.judgegrid.model.Submission;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Submission -> Runner 배치 요청 변환. 테스트 케이스 순서와 id를 그대로 유지한다.
 */
@Component
public class RunnerRequestMapper {

    public RunnerBatchRequest toBatchRequest(Submission submission) {
        return RunnerBatchRequest.builder()
                .language(submission.languageKey())
                .codeFilePath(submission.getCodeFilePath())
                .submissionId(submission.getSubmissionId())
                .testCases(submission.getTestCases().stream()
                        .map(tc -> RunnerBatchRequest.Item.builder()
                                .inputFilePath(tc.getInputFilePath())
                                .expectedOutputFilePath(tc.getExpectedOutputFilePath())
                                .timeLimitMs(tc.getTimeLimitMs())
                                .maxRamMB(tc.getMemoryLimitMb())
                                .testCaseId(tc.getTestCaseId())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }
}
