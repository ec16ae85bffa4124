package org.brown.judgegrid.runner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.judgegrid.config.OrchestratorProperties;
import org.brown.judgegrid.docker.ContainerHandle;
import org.brown.judgegrid.docker.SetupFailureException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * RestClient 기반 Runner API 클라이언트
 *
 * 컨테이너마다 포트가 다르므로 호출마다 전용 RestClient를 만든다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpRunnerClient implements RunnerClient {

    private final RestClient.Builder restClientBuilder;
    private final OrchestratorProperties properties;

    @Override
    public boolean isHealthy(ContainerHandle handle) {
        try {
            ResponseEntity<Void> response = clientFor(handle).get()
                    .uri(properties.getRunner().getHealthPath())
                    .retrieve()
                    .toBodilessEntity();
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            log.debug("Health check to {} failed: {}", handle.getContainerName(), e.getMessage());
            return false;
        }
    }

    @Override
    public void dispatch(ContainerHandle handle, RunnerBatchRequest request) {
        log.info("Sending batch evaluation request to runner {} via port {} ({} test cases)...",
                handle.getContainerName(), handle.getHostPort(), request.getTestCases().size());

        try {
            clientFor(handle).post()
                    .uri(properties.getRunner().getExecutePath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientResponseException e) {
            throw new SetupFailureException("Runner rejected batch request: " + e.getStatusCode()
                    + " " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new SetupFailureException("Runner API communication failed: " + e.getMessage(), e);
        }

        log.info("Runner {} accepted submission {}", handle.getContainerName(), request.getSubmissionId());
    }

    private RestClient clientFor(ContainerHandle handle) {
        OrchestratorProperties.RunnerConfig runner = properties.getRunner();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(runner.getConnectTimeoutMillis());
        requestFactory.setReadTimeout(runner.getReadTimeoutMillis());

        return restClientBuilder.clone()
                .baseUrl("http://" + runner.getHost() + ":" + handle.getHostPort())
                .requestFactory(requestFactory)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
