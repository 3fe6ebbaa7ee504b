package com.vidnyan.guard.adapter.in.tool;

/**
 * Well-formed request naming a tool that is not registered or is disabled.
 */
public class UnknownToolException extends ProtocolException {
    
    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName, RequestState.DISPATCHED);
    }
}
