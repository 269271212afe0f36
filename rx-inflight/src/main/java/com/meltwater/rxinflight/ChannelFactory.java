package com.meltwater.rxinflight;

import java.io.IOException;

/**
 * A factory for creating channels
 */
public interface ChannelFactory {

    /**
     * Creates a consume channel connected to an already existing queue.
     *
     * Each channel is opened on its own connection, so closing the channel and then its connection
     * releases everything the consumer held.
     *
     * @param queue the queue the consume channel is connected to
     *
     * @return a consume channel connected to an already existing queue.
     */
    ConsumeChannel createConsumeChannel(String queue) throws IOException;

}
