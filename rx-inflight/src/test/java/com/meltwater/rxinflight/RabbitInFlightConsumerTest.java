package com.meltwater.rxinflight;

import com.meltwater.rxinflight.util.FakeChannelFactory;
import com.meltwater.rxinflight.util.FakeConsumeChannel;
import com.meltwater.rxinflight.util.RecordingConsumeEventListener;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;
import rx.Observable;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static com.jayway.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class RabbitInFlightConsumerTest {

    @Rule
    public Timeout globalTimeout = new Timeout(60, TimeUnit.SECONDS);

    private static final String QUEUE = "in-queue";

    private FakeChannelFactory channelFactory;
    private RecordingConsumeEventListener listener;
    private final Map<Long, Delivery> dispatched = new ConcurrentHashMap<>();

    @Before
    public void setup() {
        channelFactory = new FakeChannelFactory();
        listener = new RecordingConsumeEventListener();
        dispatched.clear();
    }

    private RabbitInFlightConsumer consumers(ConsumerSettings settings) {
        return new RabbitInFlightConsumer(channelFactory, settings).setConsumeEventListener(listener);
    }

    private DeliveryHandler collecting() {
        return delivery -> dispatched.put(delivery.getDeliveryTag(), delivery);
    }

    @Test
    public void registers_consumer_with_prefetch_and_prefixed_tag() throws Exception {
        RabbitInFlightConsumer consumers = consumers(new ConsumerSettings()
                .withPreFetchCount(10)
                .withConsumerTagPrefix("trigger"));

        String tag = consumers.startConsumer(QUEUE, AcknowledgeMode.AFTER_PROCESSING, collecting());

        assertThat(tag, startsWith("trigger-"));
        assertThat(consumers.activeConsumers(), contains(tag));
        FakeConsumeChannel channel = channelFactory.lastChannel();
        assertThat(channel.getQueue(), is(QUEUE));
        assertThat(channel.events(), contains("qos:10", "consume:" + tag));
    }

    @Test
    public void unlimited_prefetch_skips_qos() throws Exception {
        RabbitInFlightConsumer consumers = consumers(new ConsumerSettings());

        String tag = consumers.startConsumer(QUEUE, AcknowledgeMode.AFTER_PROCESSING, collecting());

        assertThat(channelFactory.lastChannel().events(), contains("consume:" + tag));
    }

    @Test
    public void acks_deliveries_as_processing_finishes() throws Exception {
        RabbitInFlightConsumer consumers = consumers(new ConsumerSettings());
        String tag = consumers.startConsumer(QUEUE, AcknowledgeMode.AFTER_SUCCESSFUL_PROCESSING, collecting());
        FakeConsumeChannel channel = channelFactory.lastChannel();

        channel.deliver(1, "first");
        channel.deliver(2, "second");
        await().atMost(5, TimeUnit.SECONDS).until(() -> consumers.outstanding(tag), equalTo(2));

        dispatched.get(2L).processing.succeed();
        dispatched.get(1L).processing.fail(new IllegalStateException("workflow failed"));

        await().atMost(5, TimeUnit.SECONDS).until(() -> consumers.outstanding(tag), equalTo(0));
        assertThat(channel.eventsStartingWith("ack"), contains("ack:2"));
        assertThat(channel.eventsStartingWith("nack"), contains("nack:1:requeue"));
        assertThat(new String(dispatched.get(1L).payload), is("first"));
        assertThat(dispatched.get(1L).queue, is(QUEUE));
        assertThat(dispatched.get(1L).consumerTag, is(tag));
    }

    @Test
    public void immediate_mode_acks_without_tracking() throws Exception {
        RabbitInFlightConsumer consumers = consumers(new ConsumerSettings());
        String tag = consumers.startConsumer(QUEUE, AcknowledgeMode.IMMEDIATELY, collecting());
        FakeConsumeChannel channel = channelFactory.lastChannel();

        channel.deliver(1, "payload");

        await().atMost(5, TimeUnit.SECONDS).until(() -> dispatched.containsKey(1L));
        assertThat(channel.eventsStartingWith("ack"), contains("ack:1"));
        assertThat(consumers.outstanding(tag), is(0));
    }

    @Test
    public void stop_waits_for_slow_deliveries_before_closing() throws Exception {
        RabbitInFlightConsumer consumers = consumers(new ConsumerSettings());
        String tag = consumers.startConsumer(QUEUE, AcknowledgeMode.AFTER_PROCESSING, delivery ->
                Observable.timer(2, TimeUnit.SECONDS).subscribe(t -> delivery.processing.succeed()));
        FakeConsumeChannel channel = channelFactory.lastChannel();

        channel.deliver(1, "a");
        channel.deliver(2, "b");
        channel.deliver(3, "c");
        await().atMost(5, TimeUnit.SECONDS).until(() -> consumers.outstanding(tag), equalTo(3));

        long start = System.currentTimeMillis();
        DrainResult result = consumers.stopConsumer(tag);
        long waited = System.currentTimeMillis() - start;

        assertThat(result, is(DrainResult.DRAINED));
        assertThat(waited, lessThan(TimeUnit.MINUTES.toMillis(5)));
        assertThat(channel.eventsStartingWith("ack"), containsInAnyOrder("ack:1", "ack:2", "ack:3"));
        int close = channel.indexOf("close");
        assertThat(channel.indexOf("cancel:" + tag), lessThan(close));
        assertThat(channel.indexOf("ack:1"), lessThan(close));
        assertThat(channel.indexOf("ack:2"), lessThan(close));
        assertThat(channel.indexOf("ack:3"), lessThan(close));
        assertThat(channel.indexOf("closeConnection"), greaterThanOrEqualTo(close));
        assertThat(consumers.activeConsumers(), is(empty()));
    }

    @Test
    public void stop_force_closes_a_delivery_that_never_completes() throws Exception {
        RabbitInFlightConsumer consumers = consumers(new ConsumerSettings().withDrainPollIntervalMillis(5));
        String tag = consumers.startConsumer(QUEUE, AcknowledgeMode.AFTER_PROCESSING, collecting());
        FakeConsumeChannel channel = channelFactory.lastChannel();

        channel.deliver(1, "stuck");
        await().atMost(5, TimeUnit.SECONDS).until(() -> consumers.outstanding(tag), equalTo(1));

        long start = System.currentTimeMillis();
        DrainResult result = consumers.stopConsumer(tag);

        assertThat(result, is(DrainResult.TIMED_OUT));
        assertThat(System.currentTimeMillis() - start, greaterThanOrEqualTo(5L * ConsumerSettings.DEFAULT_DRAIN_MAX_POLLS));
        assertThat(channel.events(), contains("consume:" + tag, "cancel:" + tag, "close", "closeConnection"));

        dispatched.get(1L).processing.succeed();
        assertThat(channel.eventsStartingWith("ack"), is(empty()));
        assertThat(listener.events(), hasItem("ignoredAck:1"));
    }

    @Test
    public void deliveries_after_stop_are_not_dispatched() throws Exception {
        RabbitInFlightConsumer consumers = consumers(new ConsumerSettings().withDrainPollIntervalMillis(5));
        String tag = consumers.startConsumer(QUEUE, AcknowledgeMode.AFTER_PROCESSING, collecting());
        FakeConsumeChannel channel = channelFactory.lastChannel();

        consumers.stopConsumer(tag);
        channel.deliver(7, "late");

        Thread.sleep(200);
        assertThat(dispatched.isEmpty(), is(true));
        assertThat(channel.eventsStartingWith("ack"), is(empty()));
    }

    @Test
    public void stopping_twice_or_unknown_consumers_does_nothing() throws Exception {
        RabbitInFlightConsumer consumers = consumers(new ConsumerSettings());
        String tag = consumers.startConsumer(QUEUE, AcknowledgeMode.AFTER_PROCESSING, collecting());

        assertThat(consumers.stopConsumer(tag), is(DrainResult.DRAINED));
        assertThat(consumers.stopConsumer(tag), is(DrainResult.ALREADY_STOPPED));
        assertThat(consumers.stopConsumer("no-such-consumer"), is(DrainResult.ALREADY_STOPPED));
        assertThat(channelFactory.lastChannel().eventsStartingWith("cancel"), contains("cancel:" + tag));
    }

    @Test
    public void broken_channel_fails_the_consumer() throws Exception {
        RabbitInFlightConsumer consumers = consumers(new ConsumerSettings());
        String tag = consumers.startConsumer(QUEUE, AcknowledgeMode.AFTER_PROCESSING, collecting());
        FakeConsumeChannel channel = channelFactory.lastChannel();
        channel.deliver(1, "in flight");
        await().atMost(5, TimeUnit.SECONDS).until(() -> consumers.outstanding(tag), equalTo(1));
        Delivery inFlight = dispatched.get(1L);

        channel.brokerShutdown();

        assertThat(listener.events(), hasItem("consumerFailed:" + tag));
        assertThat(channel.events(), hasItem("closeWithError"));
        assertThat(channel.events(), not(hasItem("cancel:" + tag)));
        assertThat(consumers.activeConsumers(), is(empty()));

        inFlight.processing.succeed();
        assertThat(channel.eventsStartingWith("ack"), is(empty()));
        assertThat(consumers.stopConsumer(tag), is(DrainResult.ALREADY_STOPPED));
    }

    @Test
    public void failing_to_register_closes_the_channel_and_throws() {
        channelFactory = new FakeChannelFactory(queue -> new FakeConsumeChannel(queue).failConsume());
        RabbitInFlightConsumer consumers = consumers(new ConsumerSettings());
        try {
            consumers.startConsumer(QUEUE, AcknowledgeMode.AFTER_PROCESSING, collecting());
            fail("Expected the consumer registration to fail");
        } catch (IOException e) {
            assertThat(e.getMessage(), is("consume failed"));
        }
        assertThat(channelFactory.lastChannel().events(), contains("closeWithError"));
        assertThat(consumers.activeConsumers(), is(empty()));
    }

    @Test
    public void consumers_track_their_deliveries_independently() throws Exception {
        RabbitInFlightConsumer consumers = consumers(new ConsumerSettings());
        String first = consumers.startConsumer("queue-a", AcknowledgeMode.ON_EXPLICIT_SIGNAL, collecting());
        FakeConsumeChannel firstChannel = channelFactory.lastChannel();
        final Map<Long, Delivery> secondDispatched = new ConcurrentHashMap<>();
        String second = consumers.startConsumer("queue-b", AcknowledgeMode.ON_EXPLICIT_SIGNAL,
                delivery -> secondDispatched.put(delivery.getDeliveryTag(), delivery));
        FakeConsumeChannel secondChannel = channelFactory.lastChannel();

        firstChannel.deliver(1, "a");
        secondChannel.deliver(1, "b");
        secondChannel.deliver(2, "c");
        await().atMost(5, TimeUnit.SECONDS).until(() -> consumers.outstanding(first) + consumers.outstanding(second), equalTo(3));

        dispatched.get(1L).acknowledger.ack();
        await().atMost(5, TimeUnit.SECONDS).until(() -> consumers.outstanding(first), equalTo(0));
        assertThat(consumers.outstanding(second), is(2));
        assertThat(firstChannel.eventsStartingWith("ack"), contains("ack:1"));
        assertThat(secondChannel.eventsStartingWith("ack"), is(empty()));

        assertThat(consumers.stopConsumer(first), is(DrainResult.DRAINED));
        assertThat(consumers.activeConsumers(), contains(second));
    }
}
