package com.meltwater.rxinflight.impl;

import com.meltwater.rxinflight.AcknowledgeMode;
import com.meltwater.rxinflight.Acknowledger;
import com.meltwater.rxinflight.CompletionHandle;
import com.meltwater.rxinflight.ConsumeChannel;
import com.meltwater.rxinflight.ConsumeEventListener;
import com.meltwater.rxinflight.ConsumerSettings;
import com.meltwater.rxinflight.Delivery;
import com.meltwater.rxinflight.DeliveryHandler;
import com.meltwater.rxinflight.ProcessingOutcome;
import com.meltwater.rxinflight.util.Logger;
import com.rabbitmq.client.BasicProperties;
import com.rabbitmq.client.Envelope;
import rx.Scheduler;

/**
 * Takes every delivery of one consumer from receipt to its ack or nack.
 *
 * A delivery is recorded in the {@link DeliveryTracker}, handed to the {@link DeliveryHandler} and,
 * once the {@link CompletionHandle} that the {@link AcknowledgeMode} waits for settles, acked or nacked
 * according to the {@link AcknowledgmentPolicy}. The tag is cleared from the tracker after the ack/nack call,
 * also when that call fails.
 *
 * Acks and nacks are performed on a single worker of the given scheduler, so settling never blocks the caller.
 */
public class DeliveryPipeline {

    private static final Logger log = new Logger(DeliveryPipeline.class);

    private final ConsumeChannel channel;
    private final DeliveryTracker tracker;
    private final DrainCoordinator coordinator;
    private final AcknowledgeMode mode;
    private final DeliveryHandler handler;
    private final ConsumeEventListener consumeEventListener;
    private final ConsumerSettings settings;
    private final Scheduler.Worker ackWorker;

    public DeliveryPipeline(ConsumeChannel channel,
                            DeliveryTracker tracker,
                            DrainCoordinator coordinator,
                            AcknowledgeMode mode,
                            DeliveryHandler handler,
                            ConsumerSettings settings,
                            ConsumeEventListener consumeEventListener,
                            Scheduler ackScheduler) {
        assert channel!=null;
        assert tracker!=null;
        assert coordinator!=null;
        assert mode!=null;
        assert handler!=null;
        this.channel = channel;
        this.tracker = tracker;
        this.coordinator = coordinator;
        this.mode = mode;
        this.handler = handler;
        this.settings = settings;
        this.consumeEventListener = consumeEventListener;
        this.ackWorker = ackScheduler.createWorker();
    }

    public AcknowledgeMode getMode() {
        return mode;
    }

    public void onDelivery(String consumerTag, Envelope envelope, BasicProperties properties, byte[] body) {
        final long deliveryTag = envelope.getDeliveryTag();
        final boolean tracked = mode != AcknowledgeMode.IMMEDIATELY;
        //recorded before the state check, so a drain that starts in between waits for this delivery
        if (tracked) {
            tracker.record(deliveryTag);
        }
        if (!coordinator.isRunning()) {
            if (tracked) {
                tracker.clear(deliveryTag);
            }
            log.traceWithParams("Ignoring message received during shutdown.",
                    "channel", channel.toString(),
                    "consumerTag", consumerTag,
                    "deliveryTag", deliveryTag);
            return;
        }
        final long processingStart = System.currentTimeMillis();
        final CompletionHandle explicitSignal = new CompletionHandle();
        final Delivery delivery = new Delivery(
                consumerTag,
                channel.getQueue(),
                envelope,
                properties,
                body,
                new CompletionHandle(),
                createAcknowledger(explicitSignal));
        log.traceWithParams("Consumer received message",
                "consumerTag", consumerTag,
                "deliveryTag", deliveryTag,
                "redeliver", envelope.isRedeliver(),
                "mode", mode);
        consumeEventListener.received(delivery, tracker.outstandingCount());

        if (!tracked) {
            if (ackOnReceipt(delivery, processingStart)) {
                dispatch(delivery);
            }
            return;
        }

        if (!dispatch(delivery)) {
            return;
        }
        final CompletionHandle awaited = mode == AcknowledgeMode.ON_EXPLICIT_SIGNAL ? explicitSignal : delivery.processing;
        awaited.outcome().subscribe(
                outcome -> onSettled(delivery, outcome, processingStart),
                error -> log.errorWithParams("Completion handle failed. This should NEVER happen.", error,
                        "consumerTag", consumerTag,
                        "deliveryTag", deliveryTag));
    }

    /**
     * Stops the ack worker. Deliveries that settle after this are cleared without touching the channel.
     */
    public void close() {
        ackWorker.unsubscribe();
    }

    private boolean dispatch(Delivery delivery) {
        try {
            handler.handle(delivery);
            return true;
        } catch (Exception e) {
            if (mode != AcknowledgeMode.IMMEDIATELY) {
                tracker.clear(delivery.getDeliveryTag());
            }
            log.errorWithParams("There was a problem dispatching a message, it is left un-acked and will be re-delivered.", e,
                    "consumerName", settings.getConsumer_name(),
                    "workflowId", settings.getWorkflow_id(),
                    "queue", delivery.queue,
                    "consumerTag", delivery.consumerTag,
                    "deliveryTag", delivery.getDeliveryTag());
            consumeEventListener.dispatchFailed(delivery, e);
            return false;
        }
    }

    /**
     * @return false if the channel was already closing, the message is then left to be re-delivered
     */
    private boolean ackOnReceipt(Delivery delivery, long processingStart) {
        final long ackStart = System.currentTimeMillis();
        final boolean sent;
        try {
            sent = coordinator.runWhileOpen(() -> {
                consumeEventListener.beforeAck(delivery);
                channel.basicAck(delivery.getDeliveryTag());
            });
        } catch (Exception e) {
            log.warnWithParams("Failed to ack message on receipt.", e,
                    "consumerTag", delivery.consumerTag,
                    "deliveryTag", delivery.getDeliveryTag());
            consumeEventListener.afterFailedAck(delivery, e, channel.isOpen());
            consumeEventListener.done(delivery, tracker.outstandingCount(), ackStart, processingStart);
            return true;
        }
        if (!sent) {
            consumeEventListener.ignoredAck(delivery);
            return false;
        }
        consumeEventListener.done(delivery, tracker.outstandingCount(), ackStart, processingStart);
        return true;
    }

    private void onSettled(Delivery delivery, ProcessingOutcome outcome, long processingStart) {
        if (coordinator.isClosing() || ackWorker.isUnsubscribed()) {
            terminate(delivery, outcome, processingStart);
        } else {
            ackWorker.schedule(() -> terminate(delivery, outcome, processingStart));
        }
    }

    private void terminate(Delivery delivery, ProcessingOutcome outcome, long processingStart) {
        final long ackStart = System.currentTimeMillis();
        final long deliveryTag = delivery.getDeliveryTag();
        final AckDecision decision = AcknowledgmentPolicy.decide(mode, outcome);
        if (decision == AckDecision.DEFER) {
            log.warnWithParams("Settled delivery has no decision, leaving it outstanding.",
                    "deliveryTag", deliveryTag,
                    "outcome", outcome);
            return;
        }
        try {
            if (decision == AckDecision.ACK) {
                final boolean sent = coordinator.runWhileOpen(() -> {
                    consumeEventListener.beforeAck(delivery);
                    channel.basicAck(deliveryTag);
                });
                if (!sent) {
                    consumeEventListener.ignoredAck(delivery);
                }
            } else {
                final boolean sent = coordinator.runWhileOpen(() -> {
                    consumeEventListener.beforeNack(delivery);
                    channel.basicNack(deliveryTag, settings.isRequeue_on_nack());
                });
                if (!sent) {
                    consumeEventListener.ignoredNack(delivery);
                }
            }
        } catch (Exception e) {
            log.warnWithParams("Failed to " + decision.name().toLowerCase() + " message.", e,
                    "consumerTag", delivery.consumerTag,
                    "deliveryTag", deliveryTag,
                    "channelIsOpen", channel.isOpen());
            if (decision == AckDecision.ACK) {
                consumeEventListener.afterFailedAck(delivery, e, channel.isOpen());
            } else {
                consumeEventListener.afterFailedNack(delivery, e, channel.isOpen());
            }
        } finally {
            tracker.clear(deliveryTag);
        }
        consumeEventListener.done(delivery, tracker.outstandingCount(), ackStart, processingStart);
    }

    private Acknowledger createAcknowledger(final CompletionHandle explicitSignal) {
        return new Acknowledger() {
            @Override
            public void ack() {
                explicitSignal.succeed();
            }

            @Override
            public void reject() {
                explicitSignal.fail();
            }
        };
    }
}
