package org.brown.judgegrid.docker;

import org.brown.judgegrid.model.Submission;

/**
 * Runner 컨테이너 수명 주기 관리 인터페이스
 *
 * 제출 하나당 컨테이너 하나를 만들고, 작업이 끝나면 정확히 한 번 정리한다.
 */
public interface ContainerOrchestrator {

    /**
     * 이미지가 로컬에 없으면 pull 한다.
     *
     * @param image name:tag 형식의 이미지 참조
     * @throws SetupFailureException pull 실패 또는 시간 초과
     */
    void ensureImage(String image);

    /**
     * 포트를 할당하고 샌드박스 설정으로 컨테이너를 생성한다 (시작하지 않음).
     *
     * @throws SetupFailureException 생성 실패
     */
    ContainerHandle create(Submission submission, String image);

    /**
     * @throws SetupFailureException 시작 실패 (포트 충돌 포함)
     */
    void start(ContainerHandle handle);

    /**
     * 컨테이너를 중지하고, 실패하면 강제 삭제한다.
     * 실패는 로그만 남기며 예외를 던지지 않는다. 같은 핸들에 두 번째 호출은 무시된다.
     */
    void teardown(ContainerHandle handle);
}
