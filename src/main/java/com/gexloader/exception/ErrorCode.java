package com.gexloader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Failure categories of a loader run, each mapped to the process exit code the
 * command surface reports.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INTERNAL_ERROR("INTERNAL_ERROR", 1),
    MISSING_TOKEN("MISSING_TOKEN", 2),
    NO_SOURCE_DATE("NO_SOURCE_DATE", 3),
    FETCH_FAILURE("FETCH_FAILURE", 4),
    AUTHENTICATION_FAILURE("AUTHENTICATION_FAILURE", 5);

    private final String code;
    private final int exitCode;
}
