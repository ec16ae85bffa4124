package org.brown.judgegrid.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.judgegrid.model.RunnerCallback;
import org.brown.judgegrid.model.SolutionResult;
import org.brown.judgegrid.model.Submission;
import org.brown.judgegrid.model.SubmitRequest;
import org.brown.judgegrid.model.Verdict;
import org.brown.judgegrid.service.AdmissionController;
import org.brown.judgegrid.service.AdmissionDecision;
import org.brown.judgegrid.service.CallbackOutcome;
import org.brown.judgegrid.service.ResultCollector;
import org.brown.judgegrid.service.SubmissionValidator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 채점 API
 *
 * 엔드포인트:
 * - POST /api/evaluate/orchestrate: 제출 접수 (202 / 429 / 409 / 400)
 * - POST /api/evaluate/callback/{submissionId}: Runner 결과 콜백 (200 / 404)
 */
@Slf4j
@RestController
@RequestMapping("/api/evaluate")
@RequiredArgsConstructor
public class EvaluateController {

    private final SubmissionValidator submissionValidator;
    private final AdmissionController admissionController;
    private final ResultCollector resultCollector;

    @PostMapping("/orchestrate")
    public ResponseEntity<Object> orchestrate(@RequestBody SubmitRequest request) {
        Submission submission = submissionValidator.toSubmission(request);
        AdmissionDecision decision = admissionController.admit(submission);

        return switch (decision) {
            case ACCEPTED -> ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(body(submission.getSubmissionId(), "Submission accepted for evaluation"));
            case CAPACITY_EXCEEDED -> ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(body(submission.getSubmissionId(), "Orchestrator is at capacity, retry later"));
            case DUPLICATE -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(body(submission.getSubmissionId(), "Submission is already being evaluated"));
            case LANGUAGE_NOT_SUPPORTED -> ResponseEntity.badRequest()
                    .body(SolutionResult.failure(submission, Verdict.LANGUAGE_NOT_SUPPORTED,
                            "Language '" + submission.getLanguage() + "' is not supported"));
        };
    }

    @PostMapping("/callback/{submissionId}")
    public ResponseEntity<Map<String, Object>> callback(@PathVariable String submissionId,
                                                        @RequestBody RunnerCallback callback) {
        CallbackOutcome outcome = resultCollector.handleCallback(submissionId, callback);
        if (outcome == CallbackOutcome.ACKNOWLEDGED) {
            return ResponseEntity.ok(body(submissionId, "Result received"));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(body(submissionId, "Submission is not being tracked"));
    }

    private Map<String, Object> body(String submissionId, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("submissionId", submissionId);
        body.put("message", message);
        return body;
    }
}
