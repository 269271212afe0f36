package com.meltwater.rxinflight;

/**
 * The result of processing a {@link Delivery}, as reported through a {@link CompletionHandle}.
 */
public enum ProcessingOutcome {
    SUCCESS,
    FAILURE,
    /**
     * No signal yet.
     */
    PENDING
}
