package org.brown.judgegrid.docker;

/**
 * 컨테이너가 작업을 받기 전에 실패한 경우
 * (이미지 pull, 생성/시작, 헬스체크 시간 초과, 작업 전달 실패)
 */
public class SetupFailureException extends RuntimeException {

    public SetupFailureException(String message) {
        super(message);
    }

    public SetupFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
