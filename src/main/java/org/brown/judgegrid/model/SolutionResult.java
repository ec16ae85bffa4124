package org.brown.judgegrid.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 제출 최종 결과 (백엔드 알림 페이로드)
 *
 * JSON 예시:
 * {
 *   "overallStatus": "CompletedWithIssues",
 *   "compilationSuccess": true,
 *   "compilerOutput": "",
 *   "results": [ { "testCaseInputPath": "p1/in1.txt", "status": "WRONG_ANSWER", ... } ]
 * }
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SolutionResult {

    @JsonProperty("overallStatus")
    private OverallStatus overallStatus;

    @JsonProperty("compilationSuccess")
    private boolean compilationSuccess;

    @JsonProperty("compilerOutput")
    private String compilerOutput;

    @JsonProperty("results")
    private List<TestCaseResult> results;

    /**
     * 모든 테스트 케이스를 같은 판정으로 채운 실패 결과 (준비 실패, 타임아웃, 미지원 언어)
     */
    public static SolutionResult failure(Submission submission, Verdict verdict, String message) {
        List<TestCaseResult> results = submission.getTestCases().stream()
                .map(tc -> TestCaseResult.builder()
                        .testCaseInputPath(tc.getInputFilePath())
                        .testCaseId(tc.getTestCaseId())
                        .status(verdict)
                        .message(message)
                        .build())
                .collect(Collectors.toList());

        return SolutionResult.builder()
                .overallStatus(OverallStatus.FAILED)
                .compilationSuccess(false)
                .compilerOutput(message)
                .results(results)
                .build();
    }

    @Override
    public String toString() {
        return String.format("SolutionResult[overallStatus=%s, compilationSuccess=%s, results=%d]",
                overallStatus, compilationSuccess, results == null ? 0 : results.size());
    }
}
