package com.gexloader.exception;

public class MissingTokenException extends BaseException {

    public MissingTokenException() {
        super(ErrorCode.MISSING_TOKEN, "ORATS_TOKEN is not set and no --token was given");
    }
}
