package com.gexloader.exception;

import java.util.Map;

/**
 * The provider rejected the token (HTTP 401). Never retried.
 */
public class AuthenticationException extends BaseException {

    public AuthenticationException(String endpoint, String body) {
        super(
                ErrorCode.AUTHENTICATION_FAILURE,
                "Provider rejected the API token on " + endpoint,
                Map.of("endpoint", endpoint, "status", 401, "body", body));
    }
}
