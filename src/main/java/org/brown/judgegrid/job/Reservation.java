package org.brown.judgegrid.job;

/**
 * {@link JobTracker#reserve} 결과
 */
public enum Reservation {
    RESERVED,
    AT_CAPACITY,
    DUPLICATE
}
