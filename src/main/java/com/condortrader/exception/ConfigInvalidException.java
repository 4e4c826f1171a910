package com.condortrader.exception;

import java.util.List;
import java.util.Map;

/** Startup-only configuration failure. */
public class ConfigInvalidException extends BaseException {

    public ConfigInvalidException(List<String> violations) {
        super(
                ErrorCode.CONFIG_INVALID,
                "Invalid configuration: " + String.join("; ", violations),
                Map.of("violations", List.copyOf(violations)),
                null);
    }
}
