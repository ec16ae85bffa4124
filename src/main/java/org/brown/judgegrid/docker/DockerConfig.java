package org.brown.judgegrid.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.judgegrid.config.OrchestratorProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Docker Client 설정
 *
 * orchestrator.engine.host가 없으면 DOCKER_HOST 환경 변수, 그것도 없으면 기본 소켓 (/var/run/docker.sock)
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class DockerConfig {

    private final OrchestratorProperties properties;

    @Bean
    public DockerClient dockerClient() {
        OrchestratorProperties.EngineConfig engine = properties.getEngine();

        DefaultDockerClientConfig.Builder builder = DefaultDockerClientConfig.createDefaultConfigBuilder();
        if (engine.getHost() != null && !engine.getHost().isBlank()) {
            builder.withDockerHost(engine.getHost());
        }
        DefaultDockerClientConfig config = builder.build();

        log.info("Using Docker endpoint: {} (maxConnections={})", config.getDockerHost(), engine.getMaxConnections());

        // 컨테이너 수만큼 동시 호출이 생기므로 커넥션 상한은 동시 작업 수 이상이어야 한다
        ApacheDockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .maxConnections(Math.max(engine.getMaxConnections(), properties.getJobs().getMaxConcurrentJobs()))
                .connectionTimeout(Duration.ofSeconds(engine.getConnectTimeoutSeconds()))
                .responseTimeout(Duration.ofSeconds(engine.getResponseTimeoutSeconds()))
                .build();

        return DockerClientImpl.getInstance(config, httpClient);
    }
}
