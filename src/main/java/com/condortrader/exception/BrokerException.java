package com.condortrader.exception;

import com.condortrader.domain.enums.RejectCode;
import lombok.Getter;

/**
 * A broker call failed. The {@link RejectCode} classifies the failure so the execution
 * layer can decide between another attempt and a terminal rejection.
 */
@Getter
public class BrokerException extends BaseException {

    private final RejectCode rejectCode;

    public BrokerException(RejectCode rejectCode, String message) {
        super(ErrorCode.BROKER_ERROR, message);
        this.rejectCode = rejectCode;
    }

    public BrokerException(RejectCode rejectCode, String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, cause);
        this.rejectCode = rejectCode;
    }

    public boolean isRetryable() {
        return rejectCode.isRetryable();
    }
}
