package com.meltwater.rxinflight;

import com.rabbitmq.client.BasicProperties;
import com.rabbitmq.client.Envelope;

import java.util.Arrays;

/**
 * This class wraps all the data delivered by the rabbitmq broker for a given message, together with
 * the hooks used to report when it is done.
 *
 * @see RabbitInFlightConsumer#startConsumer(String, AcknowledgeMode, DeliveryHandler)
 */
public class Delivery {

    /**
     * The tag that identifies the subscription this message was delivered to.
     */
    public final String consumerTag;

    public final String queue;

    /**
     * The message envelope metadata such as the deliveryTag and the exchange it came from and the routing key
     */
    public final Envelope envelope;

    /**
     * The message properties. For example messageId, content type, and custom headers.
     */
    public final BasicProperties basicProperties;

    /**
     * The message body
     */
    public final byte[] payload;

    /**
     * Settled by the downstream processing when it has finished.
     *
     * NOTE:
     * The consuming code is expected to settle this as soon as it can, unless the consumer runs in
     * {@link AcknowledgeMode#ON_EXPLICIT_SIGNAL} or {@link AcknowledgeMode#IMMEDIATELY}.
     * Failure in doing so will keep the message un-acked until the consumer is stopped, after which
     * rabbitmq re-delivers it.
     */
    public final CompletionHandle processing;

    /**
     * Used to explicitly ack or reject the message. Only has an effect in {@link AcknowledgeMode#ON_EXPLICIT_SIGNAL}.
     */
    public final Acknowledger acknowledger;

    public Delivery(String consumerTag,
                    String queue,
                    Envelope envelope,
                    BasicProperties basicProperties,
                    byte[] payload,
                    CompletionHandle processing,
                    Acknowledger acknowledger) {
        this.consumerTag = consumerTag;
        this.queue = queue;
        this.envelope = envelope;
        this.basicProperties = basicProperties;
        this.payload = payload;
        this.processing = processing;
        this.acknowledger = acknowledger;
    }

    public long getDeliveryTag() {
        return envelope.getDeliveryTag();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Delivery delivery = (Delivery) o;
        return consumerTag.equals(delivery.consumerTag)
                && envelope.getDeliveryTag() == delivery.envelope.getDeliveryTag()
                && Arrays.equals(payload, delivery.payload);
    }

    @Override
    public int hashCode() {
        int result = consumerTag.hashCode();
        result = 31 * result + Long.hashCode(envelope.getDeliveryTag());
        result = 31 * result + Arrays.hashCode(payload);
        return result;
    }

    @Override
    public String toString() {
        return "Delivery{" +
                "consumerTag='" + consumerTag + '\'' +
                ", queue='" + queue + '\'' +
                ", deliveryTag=" + envelope.getDeliveryTag() +
                ", redeliver=" + envelope.isRedeliver() +
                ", payloadSize=" + (payload == null ? 0 : payload.length) +
                '}';
    }
}
