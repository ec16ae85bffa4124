package org.brown.judgegrid.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Capability;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.PortBinding;
import com.github.dockerjava.api.model.Ports;
import com.github.dockerjava.api.model.PullResponseItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.judgegrid.config.OrchestratorProperties;
import org.brown.judgegrid.model.Submission;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Docker Engine 기반 Runner 컨테이너 오케스트레이터
 *
 * - 이미지 확인 및 pull
 * - 임시 포트 할당 + 샌드박스 HostConfig로 컨테이너 생성
 * - 시작 / 정리 (stop -> 실패 시 force remove)
 *
 * 컨테이너는 autoRemove로 생성되므로 정리 실패 시에도 종료되면 Docker가 삭제한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DockerContainerOrchestrator implements ContainerOrchestrator {

    private static final String NAME_CHARS = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final DockerClient dockerClient;
    private final OrchestratorProperties properties;
    private final ContainerSpecFactory specFactory;
    private final PortAllocator portAllocator;

    @Override
    public void ensureImage(String image) {
        if (image == null || image.isBlank()) {
            throw new SetupFailureException("Runner image is not configured");
        }

        try {
            log.debug("Checking if image {} exists locally...", image);
            dockerClient.inspectImageCmd(image).exec();
            log.debug("Image {} found locally.", image);
            return;
        } catch (NotFoundException e) {
            log.info("Image {} not found locally. Pulling...", image);
        } catch (Exception e) {
            throw new SetupFailureException("Failed to inspect image: " + image, e);
        }

        String[] reference = splitImageReference(image);
        long pullTimeout = properties.getContainer().getImagePullTimeoutSeconds();

        try (PullImageResultCallback callback = dockerClient.pullImageCmd(reference[0])
                .withTag(reference[1])
                .exec(new PullImageResultCallback() {
                    @Override
                    public void onNext(PullResponseItem item) {
                        if (item.getStatus() != null) {
                            log.debug("Pull status for {}: {} {}", image, item.getStatus(),
                                    item.getProgress() != null ? item.getProgress() : "");
                        }
                        super.onNext(item);
                    }
                })) {

            // 타임아웃이면 try-with-resources가 스트림을 닫아 풀을 중단한다
            if (!callback.awaitCompletion(pullTimeout, TimeUnit.SECONDS)) {
                throw new SetupFailureException("Timed out after " + pullTimeout + " s pulling image: " + image);
            }
            log.info("Image {} pulled successfully.", image);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SetupFailureException("Image pull interrupted: " + image, e);
        } catch (SetupFailureException e) {
            throw e;
        } catch (Exception e) {
            throw new SetupFailureException("Failed to pull image: " + image, e);
        }
    }

    @Override
    public ContainerHandle create(Submission submission, String image) {
        int hostPort = portAllocator.allocate();
        String containerName = generateContainerName(submission.languageKey());
        ContainerSpec spec = specFactory.build(submission, image, containerName, hostPort);

        ExposedPort exposedPort = ExposedPort.tcp(spec.getInternalPort());

        HostConfig hostConfig = HostConfig.newHostConfig()
                .withPortBindings(new PortBinding(Ports.Binding.bindPort(spec.getHostPort()), exposedPort))
                .withMemory(spec.getMemoryBytes())
                .withMemorySwap(spec.getMemorySwapBytes())
                .withCpuPeriod(spec.getCpuPeriodMicros())
                .withCpuQuota(spec.getCpuQuotaMicros())
                .withPidsLimit(spec.getPidsLimit())
                .withTmpFs(spec.getTmpfsMounts())
                .withReadonlyRootfs(spec.isReadOnlyRootFs())
                .withCapDrop(toCapabilities(spec.getCapDrops()))
                .withCapAdd(toCapabilities(spec.getCapAdds()))
                .withSecurityOpts(spec.getSecurityOpts())
                .withNetworkMode(spec.getNetworkMode())
                .withAutoRemove(spec.isAutoRemove());

        log.info("Creating runner container '{}' from {} on host port {}...", containerName, image, hostPort);

        try {
            CreateContainerResponse response = dockerClient.createContainerCmd(spec.getImage())
                    .withName(spec.getContainerName())
                    .withEnv(spec.getEnvironment())
                    .withLabels(spec.getLabels())
                    .withExposedPorts(exposedPort)
                    .withHostConfig(hostConfig)
                    .exec();

            return new ContainerHandle(response.getId(), containerName, hostPort, image);

        } catch (Exception e) {
            throw new SetupFailureException("Failed to create container " + containerName, e);
        }
    }

    @Override
    public void start(ContainerHandle handle) {
        log.info("Starting runner container '{}' ({})...", handle.getContainerName(), handle.getContainerId());
        try {
            dockerClient.startContainerCmd(handle.getContainerId()).exec();
        } catch (Exception e) {
            throw new SetupFailureException("Failed to start container " + handle.getContainerName()
                    + " on host port " + handle.getHostPort(), e);
        }
    }

    @Override
    public void teardown(ContainerHandle handle) {
        if (handle == null) {
            return;
        }
        if (!handle.markTornDown()) {
            log.debug("Container {} already torn down", handle.getContainerId());
            return;
        }

        String containerId = handle.getContainerId();
        try {
            dockerClient.stopContainerCmd(containerId)
                    .withTimeout(properties.getContainer().getStopGraceSeconds())
                    .exec();
            log.info("Stopped runner container {}.", containerId);
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", containerId);
        } catch (NotModifiedException e) {
            // 이미 멈췄거나 시작된 적 없는 컨테이너. 제거는 여전히 필요하다
            log.debug("Container {} was not running, removing", containerId);
            forceRemove(containerId);
        } catch (Exception e) {
            log.warn("Failed to stop container {}, forcing removal", containerId, e);
            forceRemove(containerId);
        }
    }

    private void forceRemove(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId)
                    .withForce(true)
                    .exec();
            log.info("Force-removed runner container {}.", containerId);
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", containerId);
        } catch (Exception e) {
            log.error("Failed to remove container {}", containerId, e);
        }
    }

    private Capability[] toCapabilities(List<String> names) {
        return names.stream()
                .map(name -> Capability.valueOf(name.toUpperCase()))
                .toArray(Capability[]::new);
    }

    private String generateContainerName(String language) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder();
        for (int i = 0; i < 6; i++) {
            suffix.append(NAME_CHARS.charAt(random.nextInt(NAME_CHARS.length())));
        }
        // "c++" 같은 언어 키는 컨테이너 이름에 쓸 수 없는 문자를 포함한다
        String safeLanguage = language.replaceAll("[^a-z0-9_.-]", "p");
        return "judge-runner-" + safeLanguage + "-" + suffix;
    }

    /**
     * "registry:5000/runner-python:3.12" -> ["registry:5000/runner-python", "3.12"]
     * 태그가 없으면 latest
     */
    static String[] splitImageReference(String image) {
        int slash = image.lastIndexOf('/');
        int colon = image.lastIndexOf(':');
        if (colon > slash) {
            return new String[]{image.substring(0, colon), image.substring(colon + 1)};
        }
        return new String[]{image, "latest"};
    }
}
