package io.proofproxy.model;

/**
 * Lifecycle of a proof job inside the proxy. COMPLETED and FAILED are terminal.
 */
public enum JobState {
    QUEUED,
    DISPATCHED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
