package com.meltwater.rxinflight.impl;

import com.meltwater.rxinflight.ChannelFactory;
import com.meltwater.rxinflight.ConnectionSettings;
import com.meltwater.rxinflight.ConsumeChannel;
import com.meltwater.rxinflight.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Consumer;

import java.io.IOException;

/**
 * Opens one {@link Connection} with a single {@link Channel} for every consume channel, so a consumer can close
 * its channel and then its connection without affecting any other consumer.
 *
 * Declaring queues and exchanges is left to the caller, the queue is expected to exist.
 */
public class DefaultChannelFactory implements ChannelFactory {

    private static final Logger log = new Logger(DefaultChannelFactory.class);

    private final ConnectionFactory connectionFactory;
    private final ConnectionSettings settings;

    /**
     * @param brokerUri an amqp:// or amqps:// uri, including credentials and virtual host
     * @param settings connection tuning
     */
    public DefaultChannelFactory(String brokerUri, ConnectionSettings settings) {
        this(factoryFor(brokerUri), settings);
    }

    DefaultChannelFactory(ConnectionFactory connectionFactory, ConnectionSettings settings) {
        assert connectionFactory!=null;
        assert settings!=null;
        this.connectionFactory = connectionFactory;
        this.settings = settings;
        settings.applyTo(connectionFactory);
    }

    private static ConnectionFactory factoryFor(String brokerUri) {
        assert brokerUri!=null;
        final ConnectionFactory factory = new ConnectionFactory();
        try {
            factory.setUri(brokerUri);
        } catch (Exception e) {
            throw new IllegalArgumentException("Invalid broker uri", e);
        }
        return factory;
    }

    @Override
    public ConsumeChannel createConsumeChannel(String queue) throws IOException {
        assert queue!=null;
        log.infoWithParams("Creating consume connection to broker ...",
                "host", connectionFactory.getHost(),
                "port", connectionFactory.getPort(),
                "virtualHost", connectionFactory.getVirtualHost(),
                "queue", queue,
                "settings", settings);
        final Connection connection;
        try {
            connection = connectionFactory.newConnection(settings.getConnection_name() + "-" + queue);
        } catch (Exception e) {
            throw new ConnectionFailureException(connectionFactory, e);
        }
        final Channel channel;
        try {
            channel = connection.createChannel();
        } catch (IOException | RuntimeException e) {
            connection.abort();
            throw e;
        }
        if (channel == null) {
            connection.abort();
            throw new IOException("No channel available on the new connection");
        }
        ConsumeChannelImpl consumeChannel = new ConsumeChannelImpl(channel, connection, queue, settings.getClose_timeout_millis());
        log.infoWithParams("Successfully created consume channel.",
                "channel", consumeChannel,
                "queue", queue);
        return consumeChannel;
    }

    static class ConsumeChannelImpl implements ConsumeChannel {

        private final Channel delegate;
        private final Connection connection;
        private final String queue;
        private final int closeTimeoutMillis;

        ConsumeChannelImpl(Channel delegate, Connection connection, String queue, int closeTimeoutMillis) {
            this.delegate = delegate;
            this.connection = connection;
            this.queue = queue;
            this.closeTimeoutMillis = closeTimeoutMillis;
        }

        @Override
        public String getQueue() {
            return queue;
        }

        @Override
        public void basicCancel(String consumerTag) throws IOException {
            delegate.basicCancel(consumerTag);
        }

        @Override
        public void basicAck(long deliveryTag) throws IOException {
            delegate.basicAck(deliveryTag, false);
        }

        @Override
        public void basicNack(long deliveryTag, boolean requeue) throws IOException {
            delegate.basicNack(deliveryTag, false, requeue);
        }

        @Override
        public void basicConsume(String consumerTag, Consumer callback) throws IOException {
            delegate.basicConsume(queue, false, consumerTag, callback);
        }

        @Override
        public void basicQos(int prefetchCount) throws IOException {
            delegate.basicQos(prefetchCount);
        }

        @Override
        public void close() {
            final boolean wasOpen = delegate.isOpen();
            if (wasOpen) {
                try {
                    delegate.close();
                } catch (Exception e) {
                    log.warnWithParams("Unexpected error when closing channel.", e,
                            "channel", this,
                            "isOpen", delegate.isOpen());
                }
            }
            log.infoWithParams("Closed consume channel.",
                    "channel", this,
                    "wasOpen", wasOpen);
        }

        @Override
        public void closeConnection() {
            final boolean wasOpen = connection.isOpen();
            if (wasOpen) {
                try {
                    connection.close(closeTimeoutMillis);
                } catch (Exception e) {
                    log.warnWithParams("Unexpected error when closing connection.", e,
                            "channel", this,
                            "isOpen", connection.isOpen());
                }
            }
            log.infoWithParams("Closed consume connection.",
                    "queue", queue,
                    "wasOpen", wasOpen);
        }

        @Override
        public void closeWithError() {
            try {
                delegate.abort(AMQP.INTERNAL_ERROR, "Closed with error");
            } catch (Exception e) {
                log.debugWithParams("Failed to abort channel, it is most likely already closed.", e,
                        "channel", this);
            }
            connection.abort(AMQP.INTERNAL_ERROR, "Closed with error");
        }

        @Override
        public boolean isOpen() {
            return delegate.isOpen() && connection.isOpen();
        }

        @Override
        public int getChannelNumber() {
            return delegate.getChannelNumber();
        }

        @Override
        public String toString() {
            return "{" +
                    "queue=" + queue +
                    ", channelNo=" + delegate.getChannelNumber() +
                    ", brokerPort=" + connection.getPort() +
                    '}';
        }
    }

    static class ConnectionFailureException extends IOException {
        ConnectionFailureException(ConnectionFactory cf, Exception e) {
            super(
                String.format(
                    "Error while connecting to broker. host='%s' port=%d virtualHost='%s' username='%s'",
                    cf.getHost(), cf.getPort(), cf.getVirtualHost(), cf.getUsername()
                ),
                e
            );
        }
    }
}
