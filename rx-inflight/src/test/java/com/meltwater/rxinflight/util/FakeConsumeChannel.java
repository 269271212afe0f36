package com.meltwater.rxinflight.util;

import com.meltwater.rxinflight.ConsumeChannel;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In memory stand-in for a rabbit consume channel. Records every call as an event string, in order.
 */
public class FakeConsumeChannel implements ConsumeChannel {

    private static final AtomicInteger channelNumbers = new AtomicInteger();

    private final String queue;
    private final int channelNumber = channelNumbers.incrementAndGet();
    private final List<String> events = Collections.synchronizedList(new ArrayList<>());
    private final AtomicBoolean open = new AtomicBoolean(true);

    private volatile Consumer consumer;
    private volatile String consumerTag;
    private volatile boolean failAcks = false;
    private volatile boolean failCancel = false;
    private volatile boolean failConsume = false;
    private volatile Runnable onClose = () -> {};

    public FakeConsumeChannel(String queue) {
        this.queue = queue;
    }

    public FakeConsumeChannel failAcks() {
        this.failAcks = true;
        return this;
    }

    public FakeConsumeChannel failCancel() {
        this.failCancel = true;
        return this;
    }

    public FakeConsumeChannel failConsume() {
        this.failConsume = true;
        return this;
    }

    /**
     * Runs the given action while the channel is being closed, before the close takes effect.
     */
    public FakeConsumeChannel onClose(Runnable onClose) {
        this.onClose = onClose;
        return this;
    }

    public List<String> events() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    public List<String> eventsStartingWith(String prefix) {
        List<String> matching = new ArrayList<>();
        for (String event : events()) {
            if (event.startsWith(prefix)) {
                matching.add(event);
            }
        }
        return matching;
    }

    public int indexOf(String event) {
        return events().indexOf(event);
    }

    public String getConsumerTag() {
        return consumerTag;
    }

    public static Envelope envelope(long deliveryTag) {
        return new Envelope(deliveryTag, false, "test-exchange", "test.key");
    }

    public static AMQP.BasicProperties properties(long deliveryTag) {
        return new AMQP.BasicProperties.Builder().messageId("message-" + deliveryTag).build();
    }

    /**
     * Simulates the broker pushing a message to the registered consumer.
     */
    public void deliver(long deliveryTag, String body) throws IOException {
        consumer.handleDelivery(consumerTag, envelope(deliveryTag), properties(deliveryTag), body.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Simulates the broker closing the channel, for example because the connection was lost.
     */
    public void brokerShutdown() {
        open.set(false);
        events.add("brokerShutdown");
        consumer.handleShutdownSignal(consumerTag, new ShutdownSignalException(true, false, null, this));
    }

    @Override
    public String getQueue() {
        return queue;
    }

    @Override
    public void basicCancel(String consumerTag) throws IOException {
        events.add("cancel:" + consumerTag);
        if (failCancel) {
            throw new IOException("cancel failed");
        }
        if (consumer != null) {
            consumer.handleCancelOk(consumerTag);
        }
    }

    @Override
    public void basicAck(long deliveryTag) throws IOException {
        if (failAcks) {
            events.add("failedAck:" + deliveryTag);
            throw new IOException("ack failed");
        }
        events.add("ack:" + deliveryTag);
    }

    @Override
    public void basicNack(long deliveryTag, boolean requeue) throws IOException {
        events.add("nack:" + deliveryTag + ":" + (requeue ? "requeue" : "discard"));
    }

    @Override
    public void basicConsume(String consumerTag, Consumer callback) throws IOException {
        if (failConsume) {
            throw new IOException("consume failed");
        }
        events.add("consume:" + consumerTag);
        this.consumerTag = consumerTag;
        this.consumer = callback;
        callback.handleConsumeOk(consumerTag);
    }

    @Override
    public void basicQos(int prefetchCount) {
        events.add("qos:" + prefetchCount);
    }

    @Override
    public void close() {
        onClose.run();
        events.add("close");
        if (open.getAndSet(false) && consumer != null) {
            consumer.handleShutdownSignal(consumerTag, new ShutdownSignalException(false, true, null, this));
        }
    }

    @Override
    public void closeConnection() {
        events.add("closeConnection");
    }

    @Override
    public void closeWithError() {
        open.set(false);
        events.add("closeWithError");
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public int getChannelNumber() {
        return channelNumber;
    }

    @Override
    public String toString() {
        return "FakeConsumeChannel{queue=" + queue + ", channelNo=" + channelNumber + "}";
    }
}
