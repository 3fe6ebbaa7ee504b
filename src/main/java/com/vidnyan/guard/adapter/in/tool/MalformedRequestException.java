package com.vidnyan.guard.adapter.in.tool;

/**
 * Request envelope or arguments are unusable: bad JSON, missing name, missing required parameters.
 */
public class MalformedRequestException extends ProtocolException {
    
    public MalformedRequestException(String message) {
        super(message, RequestState.PARSED);
    }
    
    public MalformedRequestException(String message, RequestState failedAt) {
        super(message, failedAt);
    }
}
