package com.condortrader.exception;

/**
 * A fill or status update refers to an order this process does not know. Never applied;
 * the caller logs and drops it.
 */
public class ReconciliationConflictException extends BaseException {

    public ReconciliationConflictException(String message) {
        super(ErrorCode.RECONCILIATION_CONFLICT, message);
    }
}
