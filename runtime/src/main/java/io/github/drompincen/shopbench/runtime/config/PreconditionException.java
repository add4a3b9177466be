package io.github.drompincen.shopbench.runtime.config;

/**
 * Configuration problem that makes work impossible: missing platform
 * credentials, unknown platform or dataset, missing input workbook.
 * Never retried.
 */
public class PreconditionException extends RuntimeException {

    public PreconditionException(String message) {
        super(message);
    }
}
