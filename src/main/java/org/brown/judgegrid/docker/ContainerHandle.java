package org.brown.judgegrid.docker;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 제출 한 건에 할당된 Runner 컨테이너
 *
 * 한 작업의 오케스트레이션 흐름만 소유하며 다른 작업과 공유하지 않는다.
 */
@Getter
@RequiredArgsConstructor
public class ContainerHandle {

    private final String containerId;
    private final String containerName;
    private final int hostPort;
    private final String imageName;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean tornDown = new AtomicBoolean(false);

    /**
     * 정리 권한 획득. 처음 호출한 쪽만 true
     */
    public boolean markTornDown() {
        return tornDown.compareAndSet(false, true);
    }

    public boolean isTornDown() {
        return tornDown.get();
    }

    @Override
    public String toString() {
        return String.format("ContainerHandle[id=%s, name=%s, hostPort=%d, image=%s]",
                containerId, containerName, hostPort, imageName);
    }
}
