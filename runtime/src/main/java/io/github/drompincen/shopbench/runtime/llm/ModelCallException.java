package io.github.drompincen.shopbench.runtime.llm;

/**
 * A model call that failed in transport or was answered with a non-2xx
 * status. Retryable.
 */
public class ModelCallException extends RuntimeException {

    private final int statusCode;
    private final String responseBody;

    public ModelCallException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.responseBody = null;
    }

    public ModelCallException(String message, int statusCode, String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /** HTTP status, or -1 when no response was received. */
    public int statusCode() {
        return statusCode;
    }

    public String responseBody() {
        return responseBody;
    }
}
