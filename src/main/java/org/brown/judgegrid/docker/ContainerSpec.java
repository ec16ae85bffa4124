package org.brown.judgegrid.docker;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Runner 컨테이너 생성 사양
 *
 * docker create 옵션 중 샌드박스에 필요한 항목을 모두 명시적으로 가진다.
 */
@Value
@Builder
public class ContainerSpec {

    String containerName;
    String image;

    @Singular("env")
    List<String> environment;

    @Singular
    Map<String, String> labels;

    int internalPort;
    int hostPort;

    // 리소스 상한
    long memoryBytes;
    long memorySwapBytes;
    long cpuPeriodMicros;
    long cpuQuotaMicros;
    long pidsLimit;

    /**
     * tmpfs 마운트 경로 -> 옵션 (예: "/tmp" -> "rw,noexec,nosuid,size=64m")
     */
    @Singular("tmpfs")
    Map<String, String> tmpfsMounts;

    boolean readOnlyRootFs;

    @Singular("capDrop")
    List<String> capDrops;

    @Singular("capAdd")
    List<String> capAdds;

    @Singular
    List<String> securityOpts;

    String networkMode;
    boolean autoRemove;
}
