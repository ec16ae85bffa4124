package org.brown.judgegrid.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 제출 전체 판정
 */
public enum OverallStatus {

    ACCEPTED("Accepted"),
    COMPLETED_WITH_ISSUES("CompletedWithIssues"),
    COMPILE_ERROR("CompileError"),
    COMPLETED("Completed"),
    /**
     * 컨테이너 준비 실패, 타임아웃, 내부 오류
     */
    FAILED("Failed");

    private final String value;

    OverallStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
