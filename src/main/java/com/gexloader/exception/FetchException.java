package com.gexloader.exception;

import java.util.Map;

/**
 * Non-401 HTTP error (or transport failure) from the strikes endpoint.
 */
public class FetchException extends BaseException {

    public FetchException(String endpoint, int status, String body) {
        super(
                ErrorCode.FETCH_FAILURE,
                "Fetch from " + endpoint + " failed with status " + status + ": " + body,
                Map.of("endpoint", endpoint, "status", status, "body", body));
    }

    public FetchException(String endpoint, Throwable cause) {
        super(
                ErrorCode.FETCH_FAILURE,
                "Fetch from " + endpoint + " failed: " + cause.getMessage(),
                Map.of("endpoint", endpoint),
                cause);
    }
}
