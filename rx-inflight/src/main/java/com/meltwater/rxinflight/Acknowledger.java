package com.meltwater.rxinflight;

/**
 * Used to explicitly report that a {@link Delivery} should be acknowledged or rejected.
 *
 * Only consulted when the consumer runs in {@link AcknowledgeMode#ON_EXPLICIT_SIGNAL}.
 */
public interface Acknowledger {

	/**
	 * Call to indicate that the message can be acknowledged.
	 *
	 * @see ConsumeChannel#basicAck(long)
	 */
	void ack();

	/**
	 * Call to indicate that the message should be rejected.
	 *
	 * @see ConsumeChannel#basicNack(long, boolean)
	 */
	void reject();

}
