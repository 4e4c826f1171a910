package com.condortrader.exception;

import java.util.Map;
import lombok.Getter;
import org.springframework.boot.ExitCodeGenerator;

/**
 * Root of all domain exceptions. Unchecked; the {@link ErrorCode} decides whether and how
 * the process exits when the exception reaches the launcher: Spring Boot finds the exit code
 * through {@link ExitCodeGenerator} even when the context failed to start.
 */
@Getter
public abstract class BaseException extends RuntimeException implements ExitCodeGenerator {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, Map.of(), cause);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    @Override
    public int getExitCode() {
        return errorCode.getExitCode();
    }
}
