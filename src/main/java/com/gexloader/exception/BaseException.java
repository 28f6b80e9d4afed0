package com.gexloader.exception;

import java.util.Map;
import lombok.Getter;
import org.springframework.boot.ExitCodeGenerator;

/**
 * Root of the loader's failures. The {@link ErrorCode} decides the process exit code;
 * details carry the endpoint, status or dates involved, for the final error log.
 *
 * <p>As an {@link ExitCodeGenerator}, an instance escaping {@code SpringApplication.run}
 * still sets the process exit code.
 */
@Getter
public abstract class BaseException extends RuntimeException implements ExitCodeGenerator {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    @Override
    public int getExitCode() {
        return errorCode.getExitCode();
    }
}
