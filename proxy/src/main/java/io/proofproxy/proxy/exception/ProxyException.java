package io.proofproxy.proxy.exception;

import io.proofproxy.model.ErrorCode;
import lombok.Getter;

/**
 * Base of the failures the proxy reports to its callers.
 */
@Getter
public class ProxyException extends RuntimeException {
    private final ErrorCode errorCode;

    public ProxyException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
