package com.vidnyan.guard.adapter.in.tool;

/**
 * A second tool was registered under a name that is already taken.
 */
public class DuplicateToolException extends IllegalStateException {
    
    public DuplicateToolException(String toolName) {
        super("Tool already registered: " + toolName);
    }
}
