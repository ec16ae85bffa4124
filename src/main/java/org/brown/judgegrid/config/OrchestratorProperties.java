package org.brown.judgegrid.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 오케스트레이터 통합 설정 프로퍼티
 *
 * application.yml의 orchestrator.* 설정을 바인딩
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    private JobsConfig jobs = new JobsConfig();
    private ContainerConfig container = new ContainerConfig();
    private EngineConfig engine = new EngineConfig();
    private RunnerConfig runner = new RunnerConfig();
    private BackendConfig backend = new BackendConfig();
    private RedisConfig redis = new RedisConfig();
    private AwsConfig aws = new AwsConfig();
    private QueueConfig queue = new QueueConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private ExecutorConfig executor = new ExecutorConfig();

    /**
     * 외부에서 Runner가 이 오케스트레이터를 호출할 때 사용하는 주소
     * (콜백 URL 생성용)
     */
    private String callbackBaseUrl = "http://host.docker.internal:8080";

    @Data
    public static class JobsConfig {
        private int maxConcurrentJobs = 10;
        private long timeoutSeconds = 120;
    }

    @Data
    public static class ContainerConfig {
        private long memoryLimitMb = 512;
        private long memoryOverheadMb = 128;   // Runner 프로세스 자체가 쓰는 여유분
        private double cpuQuotaFraction = 1.0;
        private long cpuPeriodMicros = 100_000;
        private long pidsLimit = 128;
        private String scratchPath = "/tmp";
        private long scratchSizeMb = 64;
        private List<String> capAdd = new ArrayList<>(List.of("KILL"));
        private String networkMode = "bridge";
        private int stopGraceSeconds = 3;
        private long imagePullTimeoutSeconds = 300;
    }

    /**
     * Docker Engine 연결 (host가 비어 있으면 DOCKER_HOST 또는 기본 소켓)
     */
    @Data
    public static class EngineConfig {
        private String host;
        private int maxConnections = 100;
        private long connectTimeoutSeconds = 30;
        private long responseTimeoutSeconds = 45;
    }

    @Data
    public static class RunnerConfig {
        private Map<String, String> images = new HashMap<>();
        private int internalPort = 5000;
        private String host = "localhost";
        private String healthPath = "/health";
        private String executePath = "/execute";
        private long healthIntervalMillis = 1000;
        private long maxBootWaitSeconds = 30;
        private int connectTimeoutMillis = 2000;
        private int readTimeoutMillis = 10000;
        private Map<String, String> environment = new HashMap<>();  // Runner 컨테이너에 그대로 전달
    }

    @Data
    public static class BackendConfig {
        private String channel = "http";  // http | redis
        private String address = "http://localhost:8081";
        private String endpointBase = "/api/submissions";
        private int connectTimeoutMillis = 2000;
        private int readTimeoutMillis = 10000;
    }

    @Data
    public static class RedisConfig {
        private String host = "127.0.0.1";
        private int port = 6379;
        private String password = "";
        private String resultPrefix = "result:";
    }

    @Data
    public static class AwsConfig {
        private String region = "us-east-1";
    }

    @Data
    public static class QueueConfig {
        private boolean enabled = false;
        private String queueUrl;
        private int waitTimeSeconds = 20;
        private int maxNumberOfMessages = 10;
        private long fixedDelayMillis = 1000;
    }

    @Data
    public static class MetricsConfig {
        private boolean enabled = false;
        private String namespace = "JudgeGrid/Orchestrator";
    }

    @Data
    public static class ExecutorConfig {
        private int corePoolSize = 8;
        private int maxPoolSize = 32;
        private int queueCapacity = 100;
        private int schedulerPoolSize = 4;
    }

    // Convenience methods
    public Optional<String> imageFor(String language) {
        if (language == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(runner.getImages().get(language.toLowerCase()));
    }
}
