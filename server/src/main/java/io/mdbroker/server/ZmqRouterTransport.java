package io.mdbroker.server;

import static io.mdbroker.MdpConstants.SCHEME_MDP;
import static io.mdbroker.MdpConstants.SCHEME_TCP;

import java.net.URI;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;
import org.zeromq.ZMQException;
import org.zeromq.ZMsg;

import io.mdbroker.MdpConstants;

/**
 * {@link BrokerTransport} backed by a single ZeroMQ ROUTER socket.
 *
 * <p>
 * The socket is configured with {@code ROUTER_MANDATORY} so that messages to disconnected peers are reported as
 * {@link MdpTransportException} instead of being silently dropped.
 */
public class ZmqRouterTransport implements BrokerTransport {
    private static final Logger LOGGER = LoggerFactory.getLogger(ZmqRouterTransport.class);
    private final ZContext ctx;
    private final ZMQ.Socket routerSocket;
    private final ZMQ.Poller poller;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param linger [ms] time pending outbound messages are kept after close
     * @param highWaterMark [frames] outbound/inbound queue limit, '0' for unbounded
     */
    public ZmqRouterTransport(final int linger, final int highWaterMark) {
        ctx = new ZContext(1);
        ctx.setLinger(linger); // applied again when the context closes its sockets
        routerSocket = ctx.createSocket(SocketType.ROUTER);
        routerSocket.setLinger(linger);
        routerSocket.setHWM(highWaterMark);
        routerSocket.setRouterMandatory(true);
        poller = ctx.createPoller(1);
        poller.register(routerSocket, ZMQ.Poller.POLLIN);
    }

    @Override
    public URI bind(@NotNull final URI endpoint) {
        final String scheme = endpoint.getScheme() == null ? "" : endpoint.getScheme().toLowerCase(Locale.UK);
        final URI adjustedEndpoint = SCHEME_MDP.equals(scheme) ? MdpConstants.replaceScheme(endpoint, SCHEME_TCP) : endpoint;
        final String endpointAddress = adjustedEndpoint.toString();
        try {
            if (!routerSocket.bind(endpointAddress)) {
                throw new MdpTransportException("could not bind broker to '" + endpointAddress + "'");
            }
        } catch (ZMQException e) {
            throw new MdpTransportException("could not bind broker to '" + endpointAddress + "'", e);
        }
        LOGGER.atDebug().addArgument(endpointAddress).log("ROUTER socket bound to '{}'");
        return MdpConstants.resolveHost(adjustedEndpoint, MdpConstants.getLocalHostName());
    }

    @Override
    public boolean poll(final long timeout) {
        if (closed.get()) {
            throw new MdpTransportException("transport already closed");
        }
        try {
            return poller.poll(timeout) > 0 && poller.pollin(0);
        } catch (ZMQException e) {
            throw new MdpTransportException("poll failed on broker socket", e);
        }
    }

    @Override
    public ZMsg receive() {
        try {
            return ZMsg.recvMsg(routerSocket, ZMQ.DONTWAIT);
        } catch (ZMQException e) {
            throw new MdpTransportException("receive failed on broker socket", e);
        }
    }

    @Override
    public void send(@NotNull final ZMsg msg) {
        final String recipient = String.valueOf(msg.peekFirst()); // frames are consumed by ZMsg::send
        try {
            if (!msg.send(routerSocket)) {
                throw new MdpTransportException("could not send message to '" + recipient + "'");
            }
        } catch (ZMQException e) {
            throw new MdpTransportException("could not send message to '" + recipient + "'", e);
        }
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        poller.close();
        ctx.destroy();
    }
}
