package org.brown.judgegrid.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 채점 요청 DTO (HTTP 본문 및 SQS 메시지 공용)
 *
 * JSON 스키마 예시:
 * {
 *   "language": "python",
 *   "codeFilePath": "submissions/42/main.py",
 *   "submissionId": "42",
 *   "testCases": [
 *     { "inputFilePath": "p1/in1.txt", "expectedOutputFilePath": "p1/out1.txt",
 *       "maxExecutionTimeMs": 2000, "maxRamMB": 128, "testCaseId": "t1" }
 *   ]
 * }
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitRequest {

    @JsonProperty("language")
    private String language;

    @JsonProperty("codeFilePath")
    private String codeFilePath;

    @JsonProperty("submissionId")
    private String submissionId;

    @Builder.Default
    @JsonProperty("testCases")
    private List<TestCaseItem> testCases = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TestCaseItem {

        @JsonProperty("inputFilePath")
        private String inputFilePath;

        @JsonProperty("expectedOutputFilePath")
        private String expectedOutputFilePath;

        @JsonProperty("testCaseId")
        private String testCaseId;

        @Builder.Default
        @JsonProperty("maxExecutionTimeMs")
        private int maxExecutionTimeMs = 2000;

        @Builder.Default
        @JsonProperty("maxRamMB")
        private int maxRamMB = 128;
    }

    @Override
    public String toString() {
        return String.format("SubmitRequest[submissionId=%s, language=%s, codeFilePath=%s, testCases=%d]",
                submissionId, language, codeFilePath, testCases == null ? 0 : testCases.size());
    }
}
