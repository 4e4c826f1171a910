package com.condortrader.exception;

import com.condortrader.domain.enums.RejectCode;
import java.util.Map;
import lombok.Getter;

/** An order reached the REJECTED terminal state. */
@Getter
public class OrderRejectedException extends BaseException {

    private final RejectCode rejectCode;
    private final String orderId;

    public OrderRejectedException(String orderId, RejectCode rejectCode, String message) {
        super(
                rejectCode == RejectCode.AUTH_EXPIRED ? ErrorCode.AUTH_EXPIRED : ErrorCode.ORDER_REJECTED,
                message,
                Map.of("orderId", orderId, "rejectCode", rejectCode.name()),
                null);
        this.rejectCode = rejectCode;
        this.orderId = orderId;
    }
}
