package io.proofproxy.model;

/**
 * Availability of a worker as seen by the proxy.
 */
public enum WorkerStatus {
    IDLE,      // eligible for the next job
    BUSY,      // holds exactly one job
    UNHEALTHY, // crossed the failed-probe threshold, waits for a successful probe
    DRAINING   // deregistered while busy, removed once its job finishes
}
