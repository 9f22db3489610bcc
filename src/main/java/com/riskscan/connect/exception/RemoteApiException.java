package com.riskscan.connect.exception;

/**
 * The remote content API rejected the list call. The whole ingestion run is abandoned
 * before anything is persisted, so it is safe to retry later.
 */
public class RemoteApiException extends RuntimeException {

    private final int upstreamStatus;
    private final String upstreamBody;

    public RemoteApiException(String message, int upstreamStatus, String upstreamBody) {
        super(message);
        this.upstreamStatus = upstreamStatus;
        this.upstreamBody = upstreamBody;
    }

    public RemoteApiException(String message, Throwable cause) {
        super(message, cause);
        this.upstreamStatus = -1;
        this.upstreamBody = null;
    }

    public int getUpstreamStatus() {
        return upstreamStatus;
    }

    public String getUpstreamBody() {
        return upstreamBody;
    }
}
