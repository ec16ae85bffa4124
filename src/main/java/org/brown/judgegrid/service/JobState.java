package org.brown.judgegrid.service;

/**
 * 제출 한 건의 오케스트레이션 상태
 *
 * PROVISIONING -> STARTING -> HEALTH_CHECKING -> DISPATCHED -> {COMPLETED | TIMED_OUT | SETUP_FAILED}
 */
public enum JobState {
    PROVISIONING,
    STARTING,
    HEALTH_CHECKING,
    DISPATCHED,
    COMPLETED,
    TIMED_OUT,
    SETUP_FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == TIMED_OUT || this == SETUP_FAILED;
    }
}
