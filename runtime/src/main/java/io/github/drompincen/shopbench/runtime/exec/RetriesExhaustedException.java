package io.github.drompincen.shopbench.runtime.exec;

/** Every attempt of a step failed; the cause is the last failure. */
public class RetriesExhaustedException extends RuntimeException {

    private final int attempts;

    public RetriesExhaustedException(String message, int attempts, Throwable lastFailure) {
        super(message, lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
