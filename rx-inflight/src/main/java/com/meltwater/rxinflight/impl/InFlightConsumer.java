package com.meltwater.rxinflight.impl;

import com.meltwater.rxinflight.ConsumeChannel;
import com.meltwater.rxinflight.ConsumeEventListener;
import com.meltwater.rxinflight.DrainResult;
import com.meltwater.rxinflight.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import rx.Scheduler;

import java.util.concurrent.TimeUnit;

/**
 * The {@link Consumer} registered on the broker for one subscription.
 *
 * Deliveries are moved off the rabbit client thread onto a delivery worker before they reach the
 * {@link DeliveryPipeline}. A channel shutdown that was not caused by {@link #stop()} fails the consumer.
 */
public class InFlightConsumer implements Consumer {

    private static final Logger log = new Logger(InFlightConsumer.class);

    private final String consumerTag;
    private final ConsumeChannel channel;
    private final DeliveryTracker tracker;
    private final DrainCoordinator coordinator;
    private final DeliveryPipeline pipeline;
    private final ConsumeEventListener consumeEventListener;
    private final Runnable onTerminated;
    private final long unackedWarningMillis;

    private final Scheduler.Worker deliveryWorker;
    private final Scheduler.Worker unackedMessagesWorker;

    public InFlightConsumer(String consumerTag,
                            ConsumeChannel channel,
                            DeliveryTracker tracker,
                            DrainCoordinator coordinator,
                            DeliveryPipeline pipeline,
                            ConsumeEventListener consumeEventListener,
                            Scheduler deliveryScheduler,
                            long unackedWarningMillis,
                            Runnable onTerminated) {
        this.consumerTag = consumerTag;
        this.channel = channel;
        this.tracker = tracker;
        this.coordinator = coordinator;
        this.pipeline = pipeline;
        this.consumeEventListener = consumeEventListener;
        this.unackedWarningMillis = unackedWarningMillis;
        this.onTerminated = onTerminated;
        this.deliveryWorker = deliveryScheduler.createWorker();
        this.unackedMessagesWorker = deliveryScheduler.createWorker();
        unackedMessagesWorker.schedulePeriodically(this::logUnackedMessages, 1, 1, TimeUnit.MINUTES);
    }

    public String getConsumerTag() {
        return consumerTag;
    }

    public ConsumeChannel getChannel() {
        return channel;
    }

    public DeliveryTracker getTracker() {
        return tracker;
    }

    public DrainCoordinator getCoordinator() {
        return coordinator;
    }

    /**
     * Drains and closes this consumer. Blocks until done.
     */
    public DrainResult stop() {
        final DrainResult result = coordinator.beginDrain(consumerTag);
        if (result != DrainResult.ALREADY_STOPPED) {
            stopWorkers();
            onTerminated.run();
        }
        return result;
    }

    private void logUnackedMessages() {
        int oldMessages = tracker.outstandingOlderThan(unackedWarningMillis);
        if (oldMessages > 0) {
            log.warnWithParams("Long-lived un-acked messages found",
                    "consumerTag", consumerTag,
                    "nrMessages", oldMessages,
                    "olderThanMs", unackedWarningMillis);
        }
    }

    private void stopWorkers() {
        unackedMessagesWorker.unsubscribe();
        deliveryWorker.unsubscribe();
        pipeline.close();
    }

    @Override
    public void handleConsumeOk(String consumerTag) {
        log.infoWithParams("Consumer registered and ready to receive messages.",
                "channel", channel.toString(),
                "queue", channel.getQueue(),
                "consumerTag", consumerTag,
                "mode", pipeline.getMode());
    }

    @Override
    public void handleCancelOk(String consumerTag) {
        log.infoWithParams("Consumer successfully cancelled. It will not receive any more messages.",
                "channel", channel.toString(),
                "queue", channel.getQueue(),
                "consumerTag", consumerTag,
                "outstanding", tracker.outstandingCount());
    }

    @Override
    public void handleCancel(String consumerTag) {
        log.warnWithParams("Consumer cancelled by the broker. It will not receive any more messages.",
                "channel", channel.toString(),
                "queue", channel.getQueue(),
                "consumerTag", consumerTag);
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
        if (!coordinator.isRunning()) {
            log.infoWithParams("Channel shut down while stopping the consumer.",
                    "queue", channel.getQueue(),
                    "consumerTag", consumerTag,
                    "state", coordinator.getState());
            return;
        }
        fail(sig);
    }

    /**
     * Fails the consumer because its channel broke. Outstanding deliveries will be re-delivered by the broker.
     */
    public void fail(Throwable cause) {
        if (!coordinator.abort()) {
            return;
        }
        log.errorWithParams("The rabbit channel was unexpectedly closed, the consumer is stopped.", cause,
                "channel", channel.toString(),
                "queue", channel.getQueue(),
                "consumerTag", consumerTag,
                "outstanding", tracker.outstandingCount());
        stopWorkers();
        channel.closeWithError();
        onTerminated.run();
        consumeEventListener.consumerFailed(consumerTag, channel.getQueue(), cause);
    }

    @Override
    public void handleRecoverOk(String consumerTag) {}

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        deliveryWorker.schedule(() -> {
            try {
                pipeline.onDelivery(consumerTag, envelope, properties, body);
            } catch (Exception e) {
                log.errorWithParams("Unhandled error when handling delivery. This should NEVER happen.", e,
                        "consumerTag", consumerTag,
                        "deliveryTag", envelope.getDeliveryTag());
            }
        });
    }

    @Override
    public String toString() {
        return "InFlightConsumer{" +
                "consumerTag='" + consumerTag + '\'' +
                ", queue='" + channel.getQueue() + '\'' +
                ", state=" + coordinator.getState() +
                ", outstanding=" + tracker.outstandingCount() +
                '}';
    }
}
