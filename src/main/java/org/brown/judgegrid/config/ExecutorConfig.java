package org.brown.judgegrid.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 오케스트레이션용 스레드 풀 설정
 *
 * - orchestratorExecutor: 컨테이너 준비/전달, 알림 전송 등 I/O 단계
 * - orchestratorScheduler: 헬스체크 폴링, 작업 타임아웃 타이머
 */
@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final OrchestratorProperties properties;

    @Bean(name = "orchestratorExecutor")
    public ThreadPoolTaskExecutor orchestratorExecutor() {
        OrchestratorProperties.ExecutorConfig config = properties.getExecutor();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("orchestrator-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "orchestratorScheduler")
    public ThreadPoolTaskScheduler orchestratorScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getExecutor().getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("orchestrator-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
