package org.brown.judgegrid.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 백엔드로 전달하는 테스트 케이스별 결과
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestCaseResult {

    /**
     * 원본 테스트 케이스의 입력 경로 (매칭 실패 시 Runner가 보낸 id 또는 "Unknown")
     */
    @JsonProperty("testCaseInputPath")
    private String testCaseInputPath;

    @JsonProperty("testCaseId")
    private String testCaseId;

    @JsonProperty("status")
    private Verdict status;

    @JsonProperty("stdout")
    private String stdout;

    @JsonProperty("stderr")
    private String stderr;

    @JsonProperty("message")
    private String message;

    @JsonProperty("durationMs")
    private Long durationMs;

    @JsonProperty("maximumMemoryException")
    private boolean maximumMemoryException;
}
