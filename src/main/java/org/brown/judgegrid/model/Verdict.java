package org.brown.judgegrid.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 테스트 케이스 단위 판정
 *
 * Runner가 모르는 값을 보내면 INTERNAL_ERROR로 읽는다.
 */
public enum Verdict {

    ACCEPTED("ACCEPTED"),
    WRONG_ANSWER("WRONG_ANSWER"),
    COMPILE_ERROR("COMPILE_ERROR"),
    RUNTIME_ERROR("RUNTIME_ERROR"),
    TIME_LIMIT_EXCEEDED("TIME_LIMIT_EXCEEDED"),
    MEMORY_LIMIT_EXCEEDED("MEMORY_LIMIT_EXCEEDED"),
    FILE_ERROR("FILE_ERROR"),
    LANGUAGE_NOT_SUPPORTED("LANGUAGE_NOT_SUPPORTED"),
    @JsonEnumDefaultValue
    INTERNAL_ERROR("INTERNAL_ERROR");

    private final String value;

    Verdict(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
