package org.brown.judgegrid.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 채점 요청 한 건 (Admission 이후 불변)
 */
@Value
@Builder
public class Submission {

    String submissionId;

    String language;

    String codeFilePath;

    @Singular
    List<TestCase> testCases;

    public String languageKey() {
        return language == null ? "" : language.toLowerCase();
    }

    @Override
    public String toString() {
        return String.format("Submission[submissionId=%s, language=%s, codeFilePath=%s, testCases=%d]",
                submissionId, language, codeFilePath, testCases.size());
    }
}
