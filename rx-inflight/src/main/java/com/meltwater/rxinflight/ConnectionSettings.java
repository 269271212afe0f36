package com.meltwater.rxinflight;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableMap;
import com.rabbitmq.client.ConnectionFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Tuning for the connection that every consumer opens. Applied to the {@link ConnectionFactory} by
 * {@link com.meltwater.rxinflight.impl.DefaultChannelFactory}.
 *
 * The close timeout bounds how long closing the connection may take once a consumer has drained.
 */
public class ConnectionSettings {

    public static final int DEFAULT_HEARTBEAT_SECS = 10;
    public static final int DEFAULT_CONNECTION_TIMEOUT_MILLIS = 30_000;
    public static final int DEFAULT_HANDSHAKE_TIMEOUT_MILLIS = 10_000;
    public static final int DEFAULT_CLOSE_TIMEOUT_MILLIS = 10_000;
    public static final String DEFAULT_CONNECTION_NAME = "rx-inflight";

    private int heartbeat_secs                  = DEFAULT_HEARTBEAT_SECS;
    private int connection_timeout_millis       = DEFAULT_CONNECTION_TIMEOUT_MILLIS;
    private int handshake_timeout_millis        = DEFAULT_HANDSHAKE_TIMEOUT_MILLIS;
    private int close_timeout_millis            = DEFAULT_CLOSE_TIMEOUT_MILLIS;
    private String connection_name              = DEFAULT_CONNECTION_NAME;
    private Map<String, String> client_properties = ImmutableMap.of();

    public int getHeartbeat_secs() {
        return heartbeat_secs;
    }

    public int getConnection_timeout_millis() {
        return connection_timeout_millis;
    }

    public int getHandshake_timeout_millis() {
        return handshake_timeout_millis;
    }

    public int getClose_timeout_millis() {
        return close_timeout_millis;
    }

    public String getConnection_name() {
        return connection_name;
    }

    public Map<String, String> getClient_properties() {
        return client_properties;
    }

    public ConnectionSettings withHeartbeatSecs(int heartbeat_secs) {
        assert heartbeat_secs>=0;
        this.heartbeat_secs = heartbeat_secs;
        return this;
    }

    public ConnectionSettings withConnectionTimeoutMillis(int connection_timeout_millis) {
        assert connection_timeout_millis>=0;
        this.connection_timeout_millis = connection_timeout_millis;
        return this;
    }

    public ConnectionSettings withHandshakeTimeoutMillis(int handshake_timeout_millis) {
        assert handshake_timeout_millis>=0;
        this.handshake_timeout_millis = handshake_timeout_millis;
        return this;
    }

    /**
     * @param close_timeout_millis how long closing the connection after a drain may block, -1 waits forever
     */
    public ConnectionSettings withCloseTimeoutMillis(int close_timeout_millis) {
        assert close_timeout_millis>=-1;
        this.close_timeout_millis = close_timeout_millis;
        return this;
    }

    /**
     * @param connection_name shown in the broker management ui, suffixed with the queue name
     */
    public ConnectionSettings withConnectionName(String connection_name) {
        assert connection_name!=null;
        this.connection_name = connection_name;
        return this;
    }

    public ConnectionSettings withClientProperties(Map<String, String> client_properties) {
        assert client_properties!=null;
        this.client_properties = ImmutableMap.copyOf(client_properties);
        return this;
    }

    /**
     * Configures the factory for a consume connection. Automatic recovery is always turned off, a broken
     * channel fails its consumer instead.
     */
    public void applyTo(ConnectionFactory factory) {
        factory.setRequestedHeartbeat(heartbeat_secs);
        factory.setConnectionTimeout(connection_timeout_millis);
        factory.setHandshakeTimeout(handshake_timeout_millis);
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
        Map<String, Object> properties = new HashMap<>(factory.getClientProperties());
        properties.putAll(client_properties);
        properties.put("connection_type", "consume");
        factory.setClientProperties(properties);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConnectionSettings that = (ConnectionSettings) o;
        return heartbeat_secs == that.heartbeat_secs &&
                connection_timeout_millis == that.connection_timeout_millis &&
                handshake_timeout_millis == that.handshake_timeout_millis &&
                close_timeout_millis == that.close_timeout_millis &&
                Objects.equal(connection_name, that.connection_name) &&
                Objects.equal(client_properties, that.client_properties);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(heartbeat_secs, connection_timeout_millis, handshake_timeout_millis,
                close_timeout_millis, connection_name, client_properties);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("heartbeat_secs", heartbeat_secs)
                .add("connection_timeout_millis", connection_timeout_millis)
                .add("handshake_timeout_millis", handshake_timeout_millis)
                .add("close_timeout_millis", close_timeout_millis)
                .add("connection_name", connection_name)
                .add("client_properties", client_properties)
                .toString();
    }
}
