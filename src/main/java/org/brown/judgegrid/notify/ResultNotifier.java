package org.brown.judgegrid.notify;

import org.brown.judgegrid.model.SolutionResult;

/**
 * 백엔드로 최종 결과를 전달하는 채널
 *
 * best-effort, 재시도 없음. 구현체는 실패를 로그로만 남기고 예외를 던지지 않는다.
 */
public interface ResultNotifier {

    void notify(String submissionId, SolutionResult result);
}
