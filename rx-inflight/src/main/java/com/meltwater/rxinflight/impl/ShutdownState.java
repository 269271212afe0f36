package com.meltwater.rxinflight.impl;

/**
 * Only ever moves forward: RUNNING, DRAINING, CLOSED.
 */
public enum ShutdownState {
    RUNNING,
    DRAINING,
    CLOSED
}
