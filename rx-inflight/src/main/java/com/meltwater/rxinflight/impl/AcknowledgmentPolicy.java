package com.meltwater.rxinflight.impl;

import com.meltwater.rxinflight.AcknowledgeMode;
import com.meltwater.rxinflight.ProcessingOutcome;

/**
 * Decides what to do with a delivery given the consumer's {@link AcknowledgeMode} and the reported outcome.
 *
 * <pre>
 * mode                          SUCCESS  FAILURE  PENDING
 * IMMEDIATELY                   ACK      ACK      ACK
 * AFTER_PROCESSING              ACK      ACK      DEFER
 * AFTER_SUCCESSFUL_PROCESSING   ACK      NACK     DEFER
 * ON_EXPLICIT_SIGNAL            ACK      NACK     DEFER
 * </pre>
 *
 * In {@link AcknowledgeMode#ON_EXPLICIT_SIGNAL} the outcome is the explicit ack or reject, not the processing result.
 * In {@link AcknowledgeMode#IMMEDIATELY} the ack was sent on receipt, whatever happens later.
 */
public final class AcknowledgmentPolicy {

    private AcknowledgmentPolicy() {}

    public static AckDecision decide(AcknowledgeMode mode, ProcessingOutcome outcome) {
        if (mode == null || outcome == null) {
            throw new IllegalArgumentException("mode and outcome are required");
        }
        if (mode == AcknowledgeMode.IMMEDIATELY) {
            return AckDecision.ACK;
        }
        switch (outcome) {
            case SUCCESS:
                return AckDecision.ACK;
            case FAILURE:
                return mode == AcknowledgeMode.AFTER_PROCESSING ? AckDecision.ACK : AckDecision.NACK;
            default:
                return AckDecision.DEFER;
        }
    }
}
