package org.brown.judgegrid.runner;

import org.brown.judgegrid.docker.ContainerHandle;

/**
 * Runner 컨테이너 HTTP API 클라이언트
 */
public interface RunnerClient {

    /**
     * 헬스 경로가 2xx를 돌려주면 true. 연결 실패 등은 false.
     */
    boolean isHealthy(ContainerHandle handle);

    /**
     * 배치 요청을 보낸다. 2xx는 "작업 수락"일 뿐 완료를 뜻하지 않는다.
     *
     * @throws org.brown.judgegrid.docker.SetupFailureException 2xx가 아니거나 전송 실패
     */
    void dispatch(ContainerHandle handle, RunnerBatchRequest request);
}
