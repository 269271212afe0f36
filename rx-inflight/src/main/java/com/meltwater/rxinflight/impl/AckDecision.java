package com.meltwater.rxinflight.impl;

public enum AckDecision {
    ACK,
    NACK,
    /**
     * Nothing to do yet, wait for the outcome to settle.
     */
    DEFER
}
