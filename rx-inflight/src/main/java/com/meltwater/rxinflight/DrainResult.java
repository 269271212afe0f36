package com.meltwater.rxinflight;

/**
 * How stopping a consumer ended.
 */
public enum DrainResult {
    /**
     * Every outstanding delivery was acked or nacked before the channel was closed.
     */
    DRAINED,
    /**
     * The wait ceiling was reached and the channel was closed with deliveries still outstanding.
     * Those deliveries will be re-delivered by the broker.
     */
    TIMED_OUT,
    /**
     * The consumer was already stopping or stopped, nothing was done.
     */
    ALREADY_STOPPED
}
