package org.brown.judgegrid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * JudgeGrid Orchestrator
 *
 * 채점 파이프라인용 샌드박스 오케스트레이터
 *
 * 주요 기능:
 * - 제출 수신 및 Admission Control (용량 / 중복 / 언어 검사)
 * - 제출마다 격리된 Runner 컨테이너 생성, 시작, 헬스체크, 작업 전달
 * - Runner 콜백 수신 후 결과 정규화 및 판정 계산
 * - 타임아웃 기반 작업 회수
 * - 백엔드로 최종 결과 1회 전송 (HTTP 또는 Redis)
 *
 * @author JudgeGrid Team
 * @version 0.1
 */
@SpringBootApplication
public class JudgeGridApplication {

    public static void main(String[] args) {
        SpringApplication.run(JudgeGridApplication.class, args);
    }

}
