package com.meltwater.rxinflight.impl;

import com.meltwater.rxinflight.ConsumeChannel;
import com.meltwater.rxinflight.ConsumerSettings;
import com.meltwater.rxinflight.DrainResult;
import com.meltwater.rxinflight.util.Logger;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Stops a consumer without losing the deliveries it is currently processing.
 *
 * When a drain begins the subscription is cancelled so that the broker stops delivering. The
 * {@link DeliveryTracker} is then polled until nothing is outstanding, or until the max number
 * of polls is reached. After that the channel is closed and then its connection.
 *
 * Deliveries still outstanding when the channel closes are re-queued by the broker.
 */
public class DrainCoordinator {

    private static final Logger log = new Logger(DrainCoordinator.class);

    private final AtomicReference<ShutdownState> state = new AtomicReference<>(ShutdownState.RUNNING);
    private final Object closeLock = new Object();
    private volatile boolean closing = false;

    private final ConsumeChannel channel;
    private final DeliveryTracker tracker;
    private final long pollIntervalMillis;
    private final int maxPolls;
    private final int progressLogPolls;

    public DrainCoordinator(ConsumeChannel channel, DeliveryTracker tracker, ConsumerSettings settings) {
        this(channel,
                tracker,
                settings.getDrain_poll_interval_millis(),
                settings.getDrain_max_polls(),
                settings.getDrain_progress_log_polls());
    }

    public DrainCoordinator(ConsumeChannel channel,
                            DeliveryTracker tracker,
                            long pollIntervalMillis,
                            int maxPolls,
                            int progressLogPolls) {
        assert channel!=null;
        assert tracker!=null;
        assert pollIntervalMillis>0;
        assert maxPolls>=0;
        assert progressLogPolls>0;
        this.channel = channel;
        this.tracker = tracker;
        this.pollIntervalMillis = pollIntervalMillis;
        this.maxPolls = maxPolls;
        this.progressLogPolls = progressLogPolls;
    }

    public ShutdownState getState() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == ShutdownState.RUNNING;
    }

    public boolean isClosed() {
        return state.get() == ShutdownState.CLOSED;
    }

    /**
     * @return true once the channel is being closed, or is closed. No ack or nack may be sent after this.
     */
    public boolean isClosing() {
        return closing;
    }

    /**
     * Runs a call on the channel unless the channel is closing. The channel is not closed while the call runs.
     *
     * @return false if the channel is closing and the call was not made
     */
    public boolean runWhileOpen(ChannelCall call) throws IOException {
        synchronized (closeLock) {
            if (closing) {
                return false;
            }
            call.run();
            return true;
        }
    }

    /**
     * Cancels the subscription, waits for the outstanding deliveries and closes the channel and connection.
     *
     * Blocks the calling thread until done. Only the first call does anything.
     *
     * @param consumerTag the subscription to cancel
     */
    public DrainResult beginDrain(String consumerTag) {
        if (!state.compareAndSet(ShutdownState.RUNNING, ShutdownState.DRAINING)) {
            log.infoWithParams("Already stopping or stopped, doing nothing.",
                    "consumerTag", consumerTag,
                    "state", state.get());
            return DrainResult.ALREADY_STOPPED;
        }
        log.infoWithParams("Shutting down consumer. Waiting for outstanding deliveries before closing the channel.",
                "channel", channel.toString(),
                "consumerTag", consumerTag,
                "outstanding", tracker.outstandingCount());
        try {
            channel.basicCancel(consumerTag);
        } catch (Exception e) {
            log.warnWithParams("Unexpected error when cancelling consumer", e,
                    "channel", channel.toString(),
                    "consumerTag", consumerTag,
                    "outstanding", tracker.outstandingCount());
        }

        final boolean drained = awaitOutstanding(consumerTag);

        log.infoWithParams("Closing the channel and connection.",
                "consumerTag", consumerTag,
                "drained", drained);
        markClosing();
        try {
            channel.close();
            channel.closeConnection();
        } finally {
            state.set(ShutdownState.CLOSED);
        }
        return drained ? DrainResult.DRAINED : DrainResult.TIMED_OUT;
    }

    /**
     * Marks the consumer as closed without cancelling or waiting. Used when the channel is already broken.
     *
     * @return false if it was already closed
     */
    public boolean abort() {
        markClosing();
        return state.getAndSet(ShutdownState.CLOSED) != ShutdownState.CLOSED;
    }

    private void markClosing() {
        synchronized (closeLock) {
            closing = true;
        }
    }

    private boolean awaitOutstanding(String consumerTag) {
        final long startTime = System.currentTimeMillis();
        int polls = 0;
        while (tracker.outstandingCount() > 0 && polls < maxPolls) {
            try {
                TimeUnit.MILLISECONDS.sleep(pollIntervalMillis);
            } catch (InterruptedException e) {
                log.warnWithParams("Drain interrupted with outstanding deliveries still pending",
                        "consumerTag", consumerTag,
                        "outstanding", tracker.outstandingCount());
                Thread.currentThread().interrupt();
                break;
            }
            polls++;
            if (polls % progressLogPolls == 0) {
                log.infoWithParams("Closing down consumer, waiting for outstanding deliveries",
                        "consumerTag", consumerTag,
                        "outstanding", tracker.outstandingCount(),
                        "millisWaited", System.currentTimeMillis() - startTime,
                        "polls", polls,
                        "maxPolls", maxPolls);
            }
        }
        int remaining = tracker.outstandingCount();
        if (remaining > 0) {
            log.warnWithParams("Drain ceiling reached with outstanding deliveries still pending. They will be re-delivered.",
                    "channel", channel.toString(),
                    "consumerTag", consumerTag,
                    "millisWaited", System.currentTimeMillis() - startTime,
                    "polls", polls,
                    "outstanding", remaining);
            return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "DrainCoordinator{" +
                "state=" + state.get() +
                ", pollIntervalMillis=" + pollIntervalMillis +
                ", maxPolls=" + maxPolls +
                '}';
    }

    public interface ChannelCall {
        void run() throws IOException;
    }
}
