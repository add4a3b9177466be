package io.github.drompincen.shopbench.protocol.api;

/**
 * Lifecycle of a single step inside a platform task. Every step ends in
 * {@link #RECORDED}, including failed ones.
 */
public enum StepStatus {
    PENDING,
    EXECUTING,
    SUCCEEDED,
    FAILED,
    SCORING,
    SCORED,
    RECORDED
}
