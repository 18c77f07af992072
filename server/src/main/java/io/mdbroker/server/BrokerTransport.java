package io.mdbroker.server;

import java.net.URI;

import org.jetbrains.annotations.NotNull;
import org.zeromq.ZMsg;

/**
 * Message-oriented, identity-routed endpoint the broker is attached to.
 *
 * <p>
 * Inbound messages carry the routing ID of the peer as first frame, outbound messages are routed by their first frame.
 * Implementations are used from the broker thread only.
 */
public interface BrokerTransport extends AutoCloseable {
    /**
     * @param endpoint address to bind to, e.g. 'tcp://*:47047' or 'mdp://*:47047'
     * @return the resolved endpoint peers may connect to
     * @throws MdpTransportException if the endpoint cannot be bound
     */
    URI bind(@NotNull URI endpoint);

    /**
     * Waits for inbound traffic.
     *
     * @param timeout [ms] maximum time to wait
     * @return {@code true} if at least one message can be received without blocking
     */
    boolean poll(long timeout);

    /**
     * @return the next inbound message, or {@code null} if none is pending
     */
    ZMsg receive();

    /**
     * @param msg multipart message whose first frame is the recipient's routing ID
     * @throws MdpTransportException if the message cannot be delivered to the recipient
     */
    void send(@NotNull ZMsg msg);

    /**
     * @return {@code true} once {@link #close()} has been called, the transport cannot be used any more
     */
    boolean isClosed();

    @Override
    void close();
}
