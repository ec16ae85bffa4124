package org.brown.judgegrid.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.judgegrid.config.OrchestratorProperties;
import org.brown.judgegrid.job.JobTracker;
import org.brown.judgegrid.job.Reservation;
import org.brown.judgegrid.model.Submission;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * 새 제출의 입장 심사
 *
 * 언어 -> 용량 -> 중복 순으로 검사하고, 통과하면 오케스트레이션을 비동기로 시작한 뒤 바로 반환한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdmissionController {

    private final JobTracker jobTracker;
    private final EvaluationFlow evaluationFlow;
    private final OrchestratorProperties properties;

    public AdmissionDecision admit(Submission submission) {
        String submissionId = submission.getSubmissionId();
        MDC.put("submissionId", submissionId);
        try {
            if (properties.imageFor(submission.getLanguage()).isEmpty()) {
                log.warn("[REJECT][LANGUAGE] No runner image for language {} (submission {})",
                        submission.getLanguage(), submissionId);
                return AdmissionDecision.LANGUAGE_NOT_SUPPORTED;
            }

            Reservation reservation = jobTracker.reserve(submission);
            switch (reservation) {
                case AT_CAPACITY -> {
                    log.warn("[REJECT][CAPACITY] submission {} ({} / {} jobs)",
                            submissionId, jobTracker.count(), jobTracker.capacity());
                    return AdmissionDecision.CAPACITY_EXCEEDED;
                }
                case DUPLICATE -> {
                    log.warn("[REJECT][DUPLICATE] submission {} is already being evaluated", submissionId);
                    return AdmissionDecision.DUPLICATE;
                }
                default -> {
                }
            }

            try {
                evaluationFlow.start(submission);
            } catch (RuntimeException e) {
                // 실행기 큐가 가득 차 흐름을 시작조차 못한 경우. 예약을 풀고 용량 초과로 돌려보낸다
                jobTracker.abandon(submissionId);
                log.error("[REJECT][EXECUTOR] Could not start orchestration for submission {}", submissionId, e);
                return AdmissionDecision.CAPACITY_EXCEEDED;
            }

            log.info("Accepted {}", submission);
            return AdmissionDecision.ACCEPTED;

        } finally {
            MDC.remove("submissionId");
        }
    }
}
