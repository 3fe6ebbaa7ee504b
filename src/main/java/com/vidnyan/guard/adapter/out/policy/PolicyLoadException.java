package com.vidnyan.guard.adapter.out.policy;

/**
 * The dependency policy document is missing or malformed.
 */
public class PolicyLoadException extends RuntimeException {
    
    public PolicyLoadException(String message) {
        super(message);
    }
    
    public PolicyLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
