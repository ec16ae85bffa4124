package org.brown.judgegrid.sqs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.judgegrid.config.OrchestratorProperties;
import org.brown.judgegrid.model.Submission;
import org.brown.judgegrid.model.SubmitRequest;
import org.brown.judgegrid.service.AdmissionController;
import org.brown.judgegrid.service.AdmissionDecision;
import org.brown.judgegrid.service.InvalidSubmissionException;
import org.brown.judgegrid.service.SubmissionValidator;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;

import java.util.List;

/**
 * SQS Long Polling 기반 제출 수신
 *
 * 메시지 본문은 HTTP 제출과 같은 JSON이다.
 * - 접수/중복/검증 실패/미지원 언어: 메시지 삭제
 * - 용량 초과: 삭제하지 않음 (visibility timeout 후 재전달)
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "orchestrator.queue.enabled", havingValue = "true")
public class SubmissionQueuePoller {

    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final OrchestratorProperties properties;
    private final SubmissionValidator submissionValidator;
    private final AdmissionController admissionController;

    @Scheduled(fixedDelayString = "${orchestrator.queue.fixed-delay-millis:1000}")
    public void pollQueue() {
        String queueUrl = properties.getQueue().getQueueUrl();
        if (queueUrl == null || queueUrl.isBlank()) {
            log.warn("SQS Queue URL이 설정되지 않았습니다");
            return;
        }

        List<Message> messages;
        try {
            messages = sqsClient.receiveMessage(ReceiveMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .maxNumberOfMessages(properties.getQueue().getMaxNumberOfMessages())
                    .waitTimeSeconds(properties.getQueue().getWaitTimeSeconds())
                    .build()).messages();
        } catch (SdkException e) {
            // 다음 주기에 다시 시도한다
            log.error("[FAIL][POLLING] SQS 폴링 중 오류 발생", e);
            return;
        }

        if (messages == null || messages.isEmpty()) {
            log.debug("수신된 메시지가 없습니다");
            return;
        }

        log.info("SQS 메시지 {} 개 수신", messages.size());
        for (Message message : messages) {
            processMessage(queueUrl, message);
        }
    }

    /**
     * @return 메시지를 삭제했으면 true
     */
    boolean processMessage(String queueUrl, Message message) {
        try {
            SubmitRequest request = objectMapper.readValue(message.body(), SubmitRequest.class);
            Submission submission = submissionValidator.toSubmission(request);
            MDC.put("submissionId", submission.getSubmissionId());

            AdmissionDecision decision = admissionController.admit(submission);
            if (decision == AdmissionDecision.CAPACITY_EXCEEDED) {
                log.info("[QUEUE][DEFER] submission {} left on the queue until capacity frees up",
                        submission.getSubmissionId());
                return false;
            }

            log.info("[QUEUE][{}] submission {}", decision, submission.getSubmissionId());
            return deleteMessage(queueUrl, message.receiptHandle());

        } catch (JsonProcessingException e) {
            log.error("[FAIL][JSON_PARSE] 메시지 파싱 실패: {}", message.body(), e);
            return deleteMessage(queueUrl, message.receiptHandle());

        } catch (InvalidSubmissionException e) {
            log.error("[FAIL][VALIDATION] {}", e.getMessage());
            return deleteMessage(queueUrl, message.receiptHandle());

        } catch (Exception e) {
            // 같은 배치의 나머지 메시지는 계속 처리한다. 이 메시지는 가시성 만료 후 재수신된다
            log.error("[FAIL][ADMISSION] 제출 처리 중 오류 발생 (메시지는 큐에 남음): messageId={}",
                    message.messageId(), e);
            return false;

        } finally {
            MDC.remove("submissionId");
        }
    }

    private boolean deleteMessage(String queueUrl, String receiptHandle) {
        try {
            sqsClient.deleteMessage(DeleteMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .receiptHandle(receiptHandle)
                    .build());
            log.debug("메시지 삭제 완료");
            return true;
        } catch (SdkException e) {
            log.warn("메시지 삭제 실패 (재처리 가능성 있음)", e);
            return false;
        }
    }
}
