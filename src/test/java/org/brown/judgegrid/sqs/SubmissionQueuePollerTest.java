package org.brown.judgegrid.sqs;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.brown.judgegrid.config.OrchestratorProperties;
import org.brown.judgegrid.service.AdmissionController;
import org.brown.judgegrid.service.AdmissionDecision;
import org.brown.judgegrid.service.SubmissionValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SubmissionQueuePollerTest {

    private static final String QUEUE_URL = "https://sqs.us-east-1.amazonaws.com/123/judge";
    private static final String BODY = """
            {"language":"python","codeFilePath":"main.py","submissionId":"q1",
             "testCases":[{"inputFilePath":"in1","expectedOutputFilePath":"out1","testCaseId":"t1"}]}
            """;

    private SqsClient sqsClient;
    private AdmissionController admissionController;
    private SubmissionQueuePoller poller;

    @BeforeEach
    void setUp() {
        sqsClient = mock(SqsClient.class);
        admissionController = mock(AdmissionController.class);
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getQueue().setEnabled(true);
        properties.getQueue().setQueueUrl(QUEUE_URL);
        poller = new SubmissionQueuePoller(sqsClient, new ObjectMapper(), properties,
                new SubmissionValidator(), admissionController);
    }

    private static Message message(String body) {
        return Message.builder().body(body).receiptHandle("rh-1").build();
    }

    @Test
    void acceptedMessageIsDeleted() {
        when(admissionController.admit(any())).thenReturn(AdmissionDecision.ACCEPTED);

        assertThat(poller.processMessage(QUEUE_URL, message(BODY))).isTrue();
        verify(sqsClient).deleteMessage(any(DeleteMessageRequest.class));
    }

    @Test
    void capacityRejectedMessageStaysOnQueue() {
        when(admissionController.admit(any())).thenReturn(AdmissionDecision.CAPACITY_EXCEEDED);

        assertThat(poller.processMessage(QUEUE_URL, message(BODY))).isFalse();
        verify(sqsClient, never()).deleteMessage(any(DeleteMessageRequest.class));
    }

    @Test
    void unparsableAndInvalidMessagesAreDeleted() {
        assertThat(poller.processMessage(QUEUE_URL, message("{oops"))).isTrue();
        assertThat(poller.processMessage(QUEUE_URL, message("{\"language\":\"python\"}"))).isTrue();

        verify(sqsClient, times(2)).deleteMessage(any(DeleteMessageRequest.class));
        verify(admissionController, never()).admit(any());
    }

    @Test
    void pollProcessesEveryReceivedMessage() {
        when(sqsClient.receiveMessage(any(ReceiveMessageRequest.class))).thenReturn(ReceiveMessageResponse.builder()
                .messages(message(BODY), message(BODY.replace("q1", "q2")))
                .build());
        when(admissionController.admit(any())).thenReturn(AdmissionDecision.ACCEPTED);

        poller.pollQueue();

        verify(admissionController, times(2)).admit(any());
        verify(sqsClient, times(2)).deleteMessage(any(DeleteMessageRequest.class));
    }

    @Test
    void unexpectedAdmissionErrorLeavesMessageAndContinuesBatch() {
        when(sqsClient.receiveMessage(any(ReceiveMessageRequest.class))).thenReturn(ReceiveMessageResponse.builder()
                .messages(message(BODY), message(BODY.replace("q1", "q2")))
                .build());
        when(admissionController.admit(any()))
                .thenThrow(new IllegalStateException("tracker unavailable"))
                .thenReturn(AdmissionDecision.ACCEPTED);

        poller.pollQueue();

        verify(admissionController, times(2)).admit(any());
        verify(sqsClient, times(1)).deleteMessage(any(DeleteMessageRequest.class));
    }
}
