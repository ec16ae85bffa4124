package org.brown.judgegrid.service;

import org.brown.judgegrid.model.Submission;
import org.brown.judgegrid.model.SubmitRequest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubmissionValidatorTest {

    private final SubmissionValidator validator = new SubmissionValidator();

    private static SubmitRequest.TestCaseItem item(String id) {
        return SubmitRequest.TestCaseItem.builder()
                .inputFilePath("p1/" + id + ".in")
                .expectedOutputFilePath("p1/" + id + ".out")
                .testCaseId(id)
                .build();
    }

    @Test
    void convertsValidRequestWithDefaults() {
        SubmitRequest request = SubmitRequest.builder()
                .language(" python ")
                .codeFilePath("submissions/42/main.py")
                .submissionId("42")
                .testCases(List.of(item("t1"), item("t2")))
                .build();

        Submission submission = validator.toSubmission(request);

        assertThat(submission.getLanguage()).isEqualTo("python");
        assertThat(submission.getTestCases()).hasSize(2);
        assertThat(submission.getTestCases().get(0).getTimeLimitMs()).isEqualTo(2000);
        assertThat(submission.getTestCases().get(0).getMemoryLimitMb()).isEqualTo(128);
        assertThat(submission.getTestCases().get(1).getTestCaseId()).isEqualTo("t2");
    }

    @Test
    void collectsAllErrors() {
        SubmitRequest.TestCaseItem bad = SubmitRequest.TestCaseItem.builder()
                .inputFilePath(" ")
                .expectedOutputFilePath("out")
                .maxExecutionTimeMs(50)
                .maxRamMB(1024)
                .build();
        SubmitRequest request = SubmitRequest.builder()
                .language("")
                .codeFilePath("main.py")
                .testCases(List.of(bad))
                .build();

        assertThatThrownBy(() -> validator.toSubmission(request))
                .isInstanceOfSatisfying(InvalidSubmissionException.class, e -> assertThat(e.getErrors())
                        .hasSize(5)
                        .anyMatch(msg -> msg.startsWith("language"))
                        .anyMatch(msg -> msg.startsWith("submissionId"))
                        .anyMatch(msg -> msg.contains("inputFilePath"))
                        .anyMatch(msg -> msg.contains("maxExecutionTimeMs"))
                        .anyMatch(msg -> msg.contains("maxRamMB")));
    }

    @Test
    void requiresAtLeastOneTestCase() {
        SubmitRequest request = SubmitRequest.builder()
                .language("python")
                .codeFilePath("main.py")
                .submissionId("1")
                .build();

        assertThatThrownBy(() -> validator.toSubmission(request))
                .isInstanceOf(InvalidSubmissionException.class)
                .hasMessageContaining("at least one test case");
    }

    @Test
    void acceptsLimitsAtBoundaries() {
        SubmitRequest request = SubmitRequest.builder()
                .language("cpp")
                .codeFilePath("main.cpp")
                .submissionId("edge")
                .testCases(List.of(
                        SubmitRequest.TestCaseItem.builder().inputFilePath("a").expectedOutputFilePath("b")
                                .maxExecutionTimeMs(100).maxRamMB(32).build(),
                        SubmitRequest.TestCaseItem.builder().inputFilePath("c").expectedOutputFilePath("d")
                                .maxExecutionTimeMs(10_000).maxRamMB(512).build()))
                .build();

        assertThat(validator.toSubmission(request).getTestCases()).hasSize(2);
    }
}
