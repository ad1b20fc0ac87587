package io.proofproxy.proxy.exception;

/**
 * Communication with a worker failed: connection refused, timeout, unexpected status or body.
 */
public class TransportException extends Exception {
    private final boolean timeout;

    public TransportException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public TransportException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
