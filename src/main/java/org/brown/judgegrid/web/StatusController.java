package org.brown.judgegrid.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.judgegrid.config.OrchestratorProperties;
import org.brown.judgegrid.job.JobTracker;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 오케스트레이터 상태 확인 API
 *
 * 엔드포인트:
 * - GET /health: 간단한 헬스체크
 * - GET /status: 추적 중인 작업 수, 용량, 이미지, 알림 채널, 큐 상태
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class StatusController {

    private final OrchestratorProperties properties;
    private final JobTracker jobTracker;

    /**
     * @return "OK"
     */
    @GetMapping("/health")
    public String health() {
        return "OK";
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> status = new HashMap<>();

        status.put("status", "UP");
        status.put("application", "JudgeGrid Orchestrator");
        status.put("region", properties.getAws().getRegion());

        // 작업 정보
        Map<String, Object> jobs = new HashMap<>();
        jobs.put("tracked", jobTracker.count());
        jobs.put("capacity", jobTracker.capacity());
        jobs.put("timeoutSeconds", properties.getJobs().getTimeoutSeconds());
        status.put("jobs", jobs);

        status.put("images", new TreeMap<>(properties.getRunner().getImages()));
        status.put("notificationChannel", properties.getBackend().getChannel());

        // SQS 정보
        Map<String, Object> queue = new HashMap<>();
        queue.put("enabled", properties.getQueue().isEnabled());
        queue.put("queueUrl", maskSensitiveUrl(properties.getQueue().getQueueUrl()));
        status.put("queue", queue);

        log.debug("Status check requested");
        return status;
    }

    private String maskSensitiveUrl(String url) {
        if (url == null || url.isBlank()) return "N/A";
        int lastSlash = url.lastIndexOf('/');
        if (lastSlash > 0) {
            return url.substring(0, lastSlash + 1) + "***";
        }
        return "***";
    }
}
