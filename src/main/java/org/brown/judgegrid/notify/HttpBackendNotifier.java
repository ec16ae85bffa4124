package org.brown.judgegrid.notify;

import lombok.extern.slf4j.Slf4j;
import org.brown.judgegrid.config.OrchestratorProperties;
import org.brown.judgegrid.model.SolutionResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

/**
 * 백엔드 REST API로 결과 POST
 *
 * POST {address}{endpointBase}/{submissionId}/submit
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "orchestrator.backend.channel", havingValue = "http", matchIfMissing = true)
public class HttpBackendNotifier implements ResultNotifier {

    private final RestClient restClient;
    private final OrchestratorProperties properties;

    public HttpBackendNotifier(RestClient.Builder restClientBuilder, OrchestratorProperties properties) {
        this.properties = properties;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getBackend().getConnectTimeoutMillis());
        requestFactory.setReadTimeout(properties.getBackend().getReadTimeoutMillis());

        this.restClient = restClientBuilder
                .baseUrl(properties.getBackend().getAddress())
                .requestFactory(requestFactory)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public void notify(String submissionId, SolutionResult result) {
        String path = properties.getBackend().getEndpointBase() + "/{submissionId}/submit";

        try {
            log.info("Sending evaluation result to backend for submission {}: {}", submissionId, result);

            restClient.post()
                    .uri(path, submissionId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(result)
                    .retrieve()
                    .toBodilessEntity();

            log.info("[NOTIFY] Result delivered for submission {}", submissionId);

        } catch (Exception e) {
            log.error("[FAIL][NOTIFY] Failed to deliver result for submission {} to backend", submissionId, e);
        }
    }
}
