package org.brown.judgegrid.metrics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.judgegrid.config.OrchestratorProperties;
import org.brown.judgegrid.service.JobState;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.MetricDatum;
import software.amazon.awssdk.services.cloudwatch.model.PutMetricDataRequest;
import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;

import java.time.Instant;

/**
 * CloudWatch 커스텀 메트릭 퍼블리셔
 *
 * 작업이 끝날 때마다 종료 유형(COMPLETED / TIMED_OUT / SETUP_FAILED)별 소요 시간을 보낸다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobMetricsPublisher {

    private static final String METRIC_NAME_DURATION = "JobDurationMillis";

    private final CloudWatchClient cloudWatchClient;
    private final OrchestratorProperties properties;

    public void publishOutcome(String language, JobState outcome, long durationMillis) {
        if (!properties.getMetrics().isEnabled()) {
            return;
        }

        try {
            log.debug("Publishing job metric: language={}, outcome={}, durationMillis={}",
                    language, outcome, durationMillis);

            Dimension languageDimension = Dimension.builder()
                    .name("Language")
                    .value(language)
                    .build();

            Dimension outcomeDimension = Dimension.builder()
                    .name("Outcome")
                    .value(outcome.name())
                    .build();

            MetricDatum datum = MetricDatum.builder()
                    .metricName(METRIC_NAME_DURATION)
                    .unit(StandardUnit.MILLISECONDS)
                    .value((double) durationMillis)
                    .timestamp(Instant.now())
                    .dimensions(languageDimension, outcomeDimension)
                    .build();

            PutMetricDataRequest request = PutMetricDataRequest.builder()
                    .namespace(properties.getMetrics().getNamespace())
                    .metricData(datum)
                    .build();

            cloudWatchClient.putMetricData(request);

        } catch (Exception e) {
            // 메트릭 실패는 작업 결과에 영향을 주지 않는다
            log.warn("Failed to publish job metric to CloudWatch for language={}, outcome={}",
                    language, outcome, e);
        }
    }
}
