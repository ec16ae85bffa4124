package org.brown.judgegrid.service;

import org.brown.judgegrid.model.Submission;
import org.brown.judgegrid.model.SubmitRequest;
import org.brown.judgegrid.model.TestCase;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * SubmitRequest 검증 및 Submission 변환
 */
@Component
public class SubmissionValidator {

    static final int MIN_TIME_MS = 100;
    static final int MAX_TIME_MS = 10_000;
    static final int MIN_RAM_MB = 32;
    static final int MAX_RAM_MB = 512;

    /**
     * @throws InvalidSubmissionException 하나 이상의 필드가 잘못된 경우 (모든 오류를 모아서)
     */
    public Submission toSubmission(SubmitRequest request) {
        if (request == null) {
            throw new InvalidSubmissionException(List.of("request body is required"));
        }

        List<String> errors = new ArrayList<>();
        requireText(request.getLanguage(), "language", errors);
        requireText(request.getCodeFilePath(), "codeFilePath", errors);
        requireText(request.getSubmissionId(), "submissionId", errors);

        List<SubmitRequest.TestCaseItem> items = request.getTestCases();
        if (items == null || items.isEmpty()) {
            errors.add("testCases: at least one test case must be provided");
            items = List.of();
        }

        for (int i = 0; i < items.size(); i++) {
            SubmitRequest.TestCaseItem item = items.get(i);
            String prefix = "testCases[" + i + "].";
            if (item == null) {
                errors.add(prefix + ": must not be null");
                continue;
            }
            requireText(item.getInputFilePath(), prefix + "inputFilePath", errors);
            requireText(item.getExpectedOutputFilePath(), prefix + "expectedOutputFilePath", errors);
            if (item.getMaxExecutionTimeMs() < MIN_TIME_MS || item.getMaxExecutionTimeMs() > MAX_TIME_MS) {
                errors.add(prefix + "maxExecutionTimeMs: must be between " + MIN_TIME_MS + " and " + MAX_TIME_MS);
            }
            if (item.getMaxRamMB() < MIN_RAM_MB || item.getMaxRamMB() > MAX_RAM_MB) {
                errors.add(prefix + "maxRamMB: must be between " + MIN_RAM_MB + " and " + MAX_RAM_MB);
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidSubmissionException(errors);
        }

        Submission.SubmissionBuilder builder = Submission.builder()
                .submissionId(request.getSubmissionId().trim())
                .language(request.getLanguage().trim())
                .codeFilePath(request.getCodeFilePath());

        for (SubmitRequest.TestCaseItem item : items) {
            builder.testCase(TestCase.builder()
                    .inputFilePath(item.getInputFilePath())
                    .expectedOutputFilePath(item.getExpectedOutputFilePath())
                    .timeLimitMs(item.getMaxExecutionTimeMs())
                    .memoryLimitMb(item.getMaxRamMB())
                    .testCaseId(item.getTestCaseId())
                    .build());
        }
        return builder.build();
    }

    private void requireText(String value, String field, List<String> errors) {
        if (value == null || value.isBlank()) {
            errors.add(field + ": must not be blank");
        }
    }
}
