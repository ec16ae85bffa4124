package org.brown.judgegrid.service;

public enum CallbackOutcome {
    ACKNOWLEDGED,
    /**
     * 추적 중이 아닌 제출 (이미 타임아웃 / 완료되었거나 알 수 없는 ID)
     */
    UNKNOWN_SUBMISSION
}
