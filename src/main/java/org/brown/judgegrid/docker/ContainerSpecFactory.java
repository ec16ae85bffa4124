package org.brown.judgegrid.docker;

import lombok.RequiredArgsConstructor;
import org.brown.judgegrid.config.OrchestratorProperties;
import org.brown.judgegrid.model.Submission;
import org.brown.judgegrid.model.TestCase;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 제출 + 설정 -> ContainerSpec 변환 (부수 효과 없음)
 */
@Component
@RequiredArgsConstructor
public class ContainerSpecFactory {

    static final String LABEL_SUBMISSION = "judgegrid.submission-id";
    static final String LABEL_LANGUAGE = "judgegrid.language";

    private static final long MB = 1024L * 1024L;

    private final OrchestratorProperties properties;

    public ContainerSpec build(Submission submission, String image, String containerName, int hostPort) {
        OrchestratorProperties.ContainerConfig container = properties.getContainer();
        OrchestratorProperties.RunnerConfig runner = properties.getRunner();

        long memoryBytes = containerMemoryMb(submission) * MB;
        long cpuPeriod = container.getCpuPeriodMicros();
        long cpuQuota = Math.max(1000L, Math.round(cpuPeriod * container.getCpuQuotaFraction()));

        ContainerSpec.ContainerSpecBuilder spec = ContainerSpec.builder()
                .containerName(containerName)
                .image(image)
                .internalPort(runner.getInternalPort())
                .hostPort(hostPort)
                .memoryBytes(memoryBytes)
                .memorySwapBytes(memoryBytes)  // swap 추가 허용 안 함
                .cpuPeriodMicros(cpuPeriod)
                .cpuQuotaMicros(cpuQuota)
                .pidsLimit(container.getPidsLimit())
                .tmpfs(container.getScratchPath(),
                        "rw,noexec,nosuid,size=" + container.getScratchSizeMb() + "m")
                .readOnlyRootFs(true)
                .capDrop("ALL")
                .capAdds(container.getCapAdd())
                .securityOpt("no-new-privileges")
                .networkMode(container.getNetworkMode())
                .autoRemove(true)
                .label(LABEL_SUBMISSION, submission.getSubmissionId())
                .label(LABEL_LANGUAGE, submission.languageKey());

        spec.env("RUNNER_PORT=" + runner.getInternalPort())
                .env("RUNNER_LANGUAGE=" + submission.languageKey())
                .env("SUBMISSION_ID=" + submission.getSubmissionId())
                .env("CALLBACK_URL=" + callbackUrl(submission.getSubmissionId()));

        for (Map.Entry<String, String> entry : runner.getEnvironment().entrySet()) {
            spec.env(entry.getKey() + "=" + entry.getValue());
        }

        return spec.build();
    }

    /**
     * 설정된 상한과 (가장 큰 테스트 메모리 + Runner 여유분) 중 큰 값
     */
    long containerMemoryMb(Submission submission) {
        OrchestratorProperties.ContainerConfig container = properties.getContainer();
        int largestTestMb = submission.getTestCases().stream()
                .mapToInt(TestCase::getMemoryLimitMb)
                .max()
                .orElse(0);
        return Math.max(container.getMemoryLimitMb(), largestTestMb + container.getMemoryOverheadMb());
    }

    String callbackUrl(String submissionId) {
        String base = properties.getCallbackBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/api/evaluate/callback/" + submissionId;
    }
}
