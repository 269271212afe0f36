package com.meltwater.rxinflight;

/**
 * Listener that get notified about consume, dispatch and ack/nack events
 */
public interface ConsumeEventListener {

    default void received(Delivery delivery, long unAckedMessages){}

    default void beforeAck(Delivery delivery){}

    default void beforeNack(Delivery delivery){}

    /**
     * The delivery settled after its channel was closed, so no ack was sent.
     */
    default void ignoredAck(Delivery delivery){}

    /**
     * The delivery settled after its channel was closed, so no nack was sent.
     */
    default void ignoredNack(Delivery delivery){}

    default void afterFailedAck(Delivery delivery, Exception error, boolean channelIsOpen){}

    default void afterFailedNack(Delivery delivery, Exception error, boolean channelIsOpen){}

    default void done(Delivery delivery, long unAckedMessages, long ackStartTimestamp, long processingStartTimestamp){}

    /**
     * The {@link DeliveryHandler} threw before processing could begin. The delivery is left un-acked.
     */
    default void dispatchFailed(Delivery delivery, Exception error){}

    /**
     * The channel of a consumer was closed without a stop being requested. The consumer is dead
     * and it is up to the caller to start a new one.
     */
    default void consumerFailed(String consumerTag, String queue, Throwable cause){}
}
