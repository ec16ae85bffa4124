package org.brown.judgegrid.job;

import org.brown.judgegrid.docker.ContainerHandle;
import org.brown.judgegrid.model.Submission;

/**
 * 작업 타임아웃 콜백
 *
 * 타이머가 작업을 추적 목록에서 실제로 제거한 경우에만 호출된다.
 */
@FunctionalInterface
public interface TimeoutHandler {

    void onTimeout(String submissionId, Submission snapshot, ContainerHandle container);
}
