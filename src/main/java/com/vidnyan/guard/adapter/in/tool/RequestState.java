package com.vidnyan.guard.adapter.in.tool;

/**
 * Stages a tool request passes through. {@code ERROR} can follow any stage before {@code RESPONDED}.
 */
public enum RequestState {
    RECEIVED,
    PARSED,
    DISPATCHED,
    EXECUTING,
    RESPONDED,
    ERROR
}
