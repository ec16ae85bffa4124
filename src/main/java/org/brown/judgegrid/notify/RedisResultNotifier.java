package org.brown.judgegrid.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.judgegrid.config.OrchestratorProperties;
import org.brown.judgegrid.model.SolutionResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Redis Pub/Sub으로 결과 전송
 * 백엔드는 result:{submissionId} 채널을 구독하며 결과를 대기함
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "orchestrator.backend.channel", havingValue = "redis")
public class RedisResultNotifier implements ResultNotifier {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final OrchestratorProperties properties;

    @Override
    public void notify(String submissionId, SolutionResult result) {
        String channel = properties.getRedis().getResultPrefix() + submissionId;

        try {
            String jsonMessage = objectMapper.writeValueAsString(buildPayload(submissionId, result));

            log.info("[REDIS] Publishing result to channel: {} (submissionId={})", channel, submissionId);
            log.debug("   Payload: {}", jsonMessage);

            Long subscriberCount = redisTemplate.convertAndSend(channel, jsonMessage);

            if (subscriberCount != null && subscriberCount > 0) {
                log.info("[REDIS] Result published for submissionId={}, subscribers={}", submissionId, subscriberCount);
            } else {
                log.warn("[REDIS] Result published but NO SUBSCRIBERS on channel: {} (submissionId={})", channel, submissionId);
            }

        } catch (Exception e) {
            log.error("[FAIL][REDIS] Failed to publish result for submissionId={} to channel={}",
                    submissionId, channel, e);
        }
    }

    /**
     * 구독자가 채널 이름 없이도 제출을 식별할 수 있도록 submissionId를 함께 싣는다.
     */
    private Map<String, Object> buildPayload(String submissionId, SolutionResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("submissionId", submissionId);
        payload.put("overallStatus", result.getOverallStatus());
        payload.put("compilationSuccess", result.isCompilationSuccess());
        payload.put("compilerOutput", result.getCompilerOutput());
        payload.put("results", result.getResults());
        return payload;
    }
}
