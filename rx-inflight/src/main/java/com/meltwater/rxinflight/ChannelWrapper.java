package com.meltwater.rxinflight;

/**
 * Interface wrapping a {@link com.rabbitmq.client.Channel} together with the
 * {@link com.rabbitmq.client.Connection} it was opened on.
 *
 * @see com.rabbitmq.client.Channel
 */
public interface ChannelWrapper {

    /**
     * Close this channel with the {@link com.rabbitmq.client.AMQP#REPLY_SUCCESS} close code
     * and message 'OK'. The underlying connection is left open.
     *
     * Any delivery that has not been acknowledged when the channel closes is re-queued by the broker.
     */
    void close();

    /**
     * Close the connection this channel was opened on. Should be called after {@link #close()}.
     */
    void closeConnection();

    /**
     * Close both the channel and the connection with an error status.
     *
     * This method should be called even if the channel is known to be closed by an error to make
     * sure that the corresponding {@link com.rabbitmq.client.Connection} is also closed and all resources
     * are released.
     */
    void closeWithError();

    /**
     * Determine whether the channel is currently open.
     *
     * Checking this method should be only for information,
     * because of the race conditions - state can change after the call.
     *
     * @return true when channel is open, false otherwise
     */
    boolean isOpen();

    /**
     * @return the channel number
     */
    int getChannelNumber();

}
