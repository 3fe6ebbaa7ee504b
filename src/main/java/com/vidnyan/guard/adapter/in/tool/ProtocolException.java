package com.vidnyan.guard.adapter.in.tool;

/**
 * A request the protocol layer rejects before any validation runs.
 */
public abstract class ProtocolException extends RuntimeException {
    
    private final RequestState failedAt;
    
    protected ProtocolException(String message, RequestState failedAt) {
        super(message);
        this.failedAt = failedAt;
    }
    
    /**
     * Last state the request reached before failing.
     */
    public RequestState failedAt() {
        return failedAt;
    }
}
