package com.riskscan.connect.exception;

import com.riskscan.connect.service.AuthorizationStage;

/**
 * Failure of a token or profile call against the OAuth provider.
 * Keeps the upstream status and body so the caller can diagnose the rejection.
 * An upstream status of -1 means no HTTP response was received (I/O error or timeout).
 */
public class ExchangeException extends RuntimeException {

    private final AuthorizationStage stage;
    private final int upstreamStatus;
    private final String upstreamBody;

    public ExchangeException(AuthorizationStage stage, String message, int upstreamStatus, String upstreamBody) {
        super(message);
        this.stage = stage;
        this.upstreamStatus = upstreamStatus;
        this.upstreamBody = upstreamBody;
    }

    public ExchangeException(AuthorizationStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.upstreamStatus = -1;
        this.upstreamBody = null;
    }

    public AuthorizationStage getStage() {
        return stage;
    }

    public int getUpstreamStatus() {
        return upstreamStatus;
    }

    public String getUpstreamBody() {
        return upstreamBody;
    }
}
