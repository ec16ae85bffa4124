package org.brown.judgegrid.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Runner 컨테이너가 실행을 마치고 보내는 콜백 본문
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunnerCallback {

    @JsonProperty("compilationSuccess")
    private boolean compilationSuccess;

    @JsonProperty("compilerOutput")
    private String compilerOutput;

    @Builder.Default
    @JsonProperty("testCaseResults")
    private List<Item> testCaseResults = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {

        @JsonProperty("testCaseId")
        private String testCaseId;

        @Builder.Default
        @JsonProperty("status")
        private Verdict status = Verdict.INTERNAL_ERROR;

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
}
