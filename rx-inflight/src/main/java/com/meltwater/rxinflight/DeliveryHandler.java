package com.meltwater.rxinflight;

/**
 * The downstream processing that every delivered message is dispatched to.
 *
 * Implementations should start the processing and return. Completion is reported later by settling
 * {@link Delivery#processing}, or through {@link Delivery#acknowledger} when the consumer runs in
 * {@link AcknowledgeMode#ON_EXPLICIT_SIGNAL}.
 */
public interface DeliveryHandler {

    /**
     * @param delivery the received message
     * @throws Exception if processing could not even begin, for example because the payload is malformed.
     * The message is then left unacknowledged and will be redelivered by the broker.
     */
    void handle(Delivery delivery) throws Exception;
}
