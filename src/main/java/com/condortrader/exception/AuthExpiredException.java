package com.condortrader.exception;

/** Fatal: the broker session handle expired and cannot be renewed by the core. */
public class AuthExpiredException extends BaseException {

    public AuthExpiredException(String message) {
        super(ErrorCode.AUTH_EXPIRED, message);
    }
}
