package org.brown.judgegrid.model;

import lombok.Builder;
import lombok.Value;

/**
 * 제출에 포함된 테스트 케이스 한 건 (불변)
 *
 * 입력/기대 출력 파일 경로는 Runner가 직접 스토리지에서 가져온다.
 */
@Value
@Builder
public class TestCase {

    String inputFilePath;

    String expectedOutputFilePath;

    int timeLimitMs;

    int memoryLimitMb;

    /**
     * 호출자가 지정한 식별자 (결과 매칭용, 없을 수 있음)
     */
    String testCaseId;
}
