package com.meltwater.rxinflight;

import com.rabbitmq.client.Consumer;

import java.io.IOException;
import java.util.Map;

/**
 * Interface wrapping a {@link com.rabbitmq.client.Channel} that allows consume operations.
 *
 * Note that an instance of this channel is tied to only one queue.
 *
 * @see com.rabbitmq.client.Channel
 */
public interface ConsumeChannel extends ChannelWrapper {

    /**
     * @return the queue this channel is able to consume from
     */
    String getQueue();

    /**
     * Cancel a consumer so that the broker stops delivering new messages to it.
     * Calls the consumer's {@link Consumer#handleCancelOk} method.
     *
     * @param consumerTag a client-generated consumer tag to establish context
     * @throws IOException if an error is encountered, or if the consumerTag is unknown
     */
    void basicCancel(String consumerTag) throws IOException;

    /**
     * Acknowledge one received message.
     *
     * @param deliveryTag the tag from the received {@link com.rabbitmq.client.AMQP.Basic.Deliver}
     * @throws IOException if an error is encountered
     */
    void basicAck(long deliveryTag) throws IOException;

    /**
     * Reject one received message.
     *
     * @param deliveryTag the tag from the received {@link com.rabbitmq.client.AMQP.Basic.Deliver}
     * @param requeue true if the rejected message should be re-queued rather
     *                than discarded/dead-lettered
     * @throws IOException if an error is encountered
     */
    void basicNack(long deliveryTag, boolean requeue) throws IOException;

    /**
     * Start a non-nolocal, non-exclusive consumer with auto ack set to false
     * and empty parameter map.
     *
     * @param consumerTag a client-generated consumer tag to establish context
     * @param callback an interface to the consumer object
     * @throws IOException if an error is encountered
     *
     * @see com.rabbitmq.client.Channel#basicConsume(String, boolean, String, boolean, boolean, Map, Consumer)
     */
    void basicConsume(String consumerTag, Consumer callback) throws IOException;

    /**
     * Request a specific prefetchCount "quality of service" settings for this channel.
     *
     * @param prefetchCount maximum number of messages that the server
     * will deliver, 0 if unlimited
     * @throws IOException if an error is encountered
     */
    void basicQos(int prefetchCount) throws IOException;
}
