package com.meltwater.rxinflight;

import com.meltwater.rxinflight.impl.DefaultChannelFactory;
import com.meltwater.rxinflight.impl.DeliveryPipeline;
import com.meltwater.rxinflight.impl.DeliveryTracker;
import com.meltwater.rxinflight.impl.DrainCoordinator;
import com.meltwater.rxinflight.impl.InFlightConsumer;
import com.meltwater.rxinflight.util.Logger;
import rx.Scheduler;
import rx.schedulers.Schedulers;

import java.io.IOException;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts consumers that track every delivery until it is acked or nacked, and stops them without losing
 * the deliveries that are still being processed.
 *
 * Every consumer gets its own {@link ConsumeChannel} from the {@link ChannelFactory}. With the
 * {@link DefaultChannelFactory} that also means its own {@link com.rabbitmq.client.Connection}.
 *
 * Example:
 * <pre>
 * RabbitInFlightConsumer consumers = new RabbitInFlightConsumer(channelFactory, new ConsumerSettings().withPreFetchCount(10));
 * String tag = consumers.startConsumer("orders", AcknowledgeMode.AFTER_SUCCESSFUL_PROCESSING, delivery -&gt;
 *         process(delivery.payload).subscribe(
 *                 done -&gt; delivery.processing.succeed(),
 *                 error -&gt; delivery.processing.fail(error)));
 * ...
 * consumers.stopConsumer(tag);
 * </pre>
 */
public class RabbitInFlightConsumer {

    private static final Logger log = new Logger(RabbitInFlightConsumer.class);

    private final static AtomicInteger consumerCount = new AtomicInteger();

    private final ChannelFactory channelFactory;
    private final ConsumerSettings settings;
    private final Map<String, InFlightConsumer> consumers = new ConcurrentHashMap<>();

    private ConsumeEventListener consumeEventListener = new NoopConsumeEventListener();
    private Scheduler deliveryScheduler = Schedulers.io();
    private Scheduler ackScheduler = Schedulers.io();

    public RabbitInFlightConsumer(ChannelFactory channelFactory, ConsumerSettings settings) {
        assert channelFactory!=null;
        assert settings!=null;
        this.channelFactory = channelFactory;
        this.settings = settings;
    }

    public RabbitInFlightConsumer setConsumeEventListener(ConsumeEventListener consumeEventListener) {
        assert consumeEventListener!=null;
        this.consumeEventListener = consumeEventListener;
        return this;
    }

    /**
     * @param deliveryScheduler the scheduler that the {@link DeliveryHandler} is called on
     */
    public RabbitInFlightConsumer setDeliveryScheduler(Scheduler deliveryScheduler) {
        this.deliveryScheduler = deliveryScheduler;
        return this;
    }

    /**
     * @param ackScheduler the scheduler that acks and nacks are sent to the broker on
     */
    public RabbitInFlightConsumer setAckScheduler(Scheduler ackScheduler) {
        this.ackScheduler = ackScheduler;
        return this;
    }

    /**
     * Starts consuming from an already existing queue.
     *
     * @param queue the queue to consume from
     * @param mode when deliveries are acknowledged
     * @param onDelivery called once for every delivered message
     *
     * @return the consumer tag, used to stop the consumer
     * @throws IOException if the channel could not be created or the consumer could not be registered
     */
    public synchronized String startConsumer(String queue, AcknowledgeMode mode, DeliveryHandler onDelivery) throws IOException {
        assert queue!=null;
        assert mode!=null;
        assert onDelivery!=null;
        final String consumerTag = settings.getConsumer_tag_prefix() + "-" + consumerCount.incrementAndGet();
        log.infoWithParams("Starting up consumer.",
                "queue", queue,
                "mode", mode,
                "consumerTag", consumerTag,
                "settings", settings,
                "consumeEventListener", consumeEventListener);

        final ConsumeChannel channel = channelFactory.createConsumeChannel(queue);
        final DeliveryTracker tracker = new DeliveryTracker();
        final DrainCoordinator coordinator = new DrainCoordinator(channel, tracker, settings);
        final DeliveryPipeline pipeline = new DeliveryPipeline(
                channel,
                tracker,
                coordinator,
                mode,
                onDelivery,
                settings,
                consumeEventListener,
                ackScheduler);
        final InFlightConsumer consumer = new InFlightConsumer(
                consumerTag,
                channel,
                tracker,
                coordinator,
                pipeline,
                consumeEventListener,
                deliveryScheduler,
                settings.getUnacked_warning_millis(),
                () -> consumers.remove(consumerTag));
        consumers.put(consumerTag, consumer);
        try {
            if (settings.getPre_fetch_count() > 0) {
                channel.basicQos(settings.getPre_fetch_count());
            }
            channel.basicConsume(consumerTag, consumer);
        } catch (IOException e) {
            log.errorWithParams("Unexpected error when registering the rabbit consumer on the broker.", e,
                    "queue", queue,
                    "consumerTag", consumerTag);
            consumer.fail(e);
            throw e;
        }
        return consumerTag;
    }

    /**
     * Stops the consumer: no new messages are delivered, the ones in flight get a bounded amount of time to be
     * acked or nacked and then the channel and connection are closed.
     *
     * Blocks until the consumer is closed.
     *
     * @param consumerTag the tag returned by {@link #startConsumer(String, AcknowledgeMode, DeliveryHandler)}
     */
    public DrainResult stopConsumer(String consumerTag) {
        final InFlightConsumer consumer = consumers.get(consumerTag);
        if (consumer == null) {
            log.infoWithParams("No running consumer with that tag, doing nothing.",
                    "consumerTag", consumerTag);
            return DrainResult.ALREADY_STOPPED;
        }
        final DrainResult result = consumer.stop();
        log.infoWithParams("Consumer stopped.",
                "consumerTag", consumerTag,
                "result", result);
        return result;
    }

    /**
     * @return the number of deliveries dispatched but not yet acked or nacked, 0 for unknown consumers
     */
    public int outstanding(String consumerTag) {
        final InFlightConsumer consumer = consumers.get(consumerTag);
        return consumer == null ? 0 : consumer.getTracker().outstandingCount();
    }

    public Set<String> activeConsumers() {
        return Collections.unmodifiableSet(new HashSet<>(consumers.keySet()));
    }
}
