package org.brown.judgegrid.service;

import lombok.Getter;

import java.util.List;

/**
 * 요청 본문 검증 실패
 */
@Getter
public class InvalidSubmissionException extends RuntimeException {

    private final List<String> errors;

    public InvalidSubmissionException(List<String> errors) {
        super("Invalid submission: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }
}
