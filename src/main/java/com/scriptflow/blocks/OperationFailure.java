package com.scriptflow.blocks;

/**
 * Recoverable reasons a structural edit is rejected. The forest is never
 * changed when one of these is reported.
 */
public enum OperationFailure {
    NOT_FOUND,
    INVALID_CONTAINER,
    WOULD_CREATE_CYCLE,
    VALIDATION_FAILED
}
