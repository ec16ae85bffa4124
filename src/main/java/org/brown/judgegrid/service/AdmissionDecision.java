package org.brown.judgegrid.service;

/**
 * Admission 결과
 */
public enum AdmissionDecision {
    /**
     * 수락. 판정은 나중에 백엔드 알림으로 전달된다.
     */
    ACCEPTED,
    CAPACITY_EXCEEDED,
    DUPLICATE,
    LANGUAGE_NOT_SUPPORTED
}
