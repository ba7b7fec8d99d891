package org.carball.iolatency.model.snapshot;

/**
 * What the counters of a report row measure.
 */
public enum CounterBasis {
    /** Difference between two consecutive snapshots. */
    INTERVAL,
    /** Raw counters accumulated since the engine last started. */
    CUMULATIVE_SINCE_STARTUP
}
