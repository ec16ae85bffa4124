package org.brown.judgegrid.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Runner 컨테이너 execute 엔드포인트로 보내는 배치 요청
 *
 * Runner는 컴파일 후 모든 테스트 케이스를 실행하고, 끝나면 콜백 URL로 결과를 보낸다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunnerBatchRequest {

    @JsonProperty("language")
    private String language;

    @JsonProperty("codeFilePath")
    private String codeFilePath;

    @JsonProperty("submissionId")
    private String submissionId;

    @JsonProperty("testCases")
    private List<Item> testCases;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {

        @JsonProperty("inputFilePath")
        private String inputFilePath;

        @JsonProperty("expectedOutputFilePath")
        private String expectedOutputFilePath;

        @JsonProperty("timeLimitMs")
        private int timeLimitMs;

        @JsonProperty("maxRamMB")
        private int maxRamMB;

        @JsonProperty("testCaseId")
        private String testCaseId;
    }
}
