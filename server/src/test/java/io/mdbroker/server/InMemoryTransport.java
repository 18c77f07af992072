package io.mdbroker.server;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;
import java.util.stream.Collectors;

import org.jetbrains.annotations.NotNull;
import org.zeromq.ZMsg;
import org.zeromq.util.ZData;

import io.mdbroker.MdpProtocol.Command;
import io.mdbroker.MdpProtocol.MdpMessage;

/**
 * Single-threaded stand-in for the ROUTER socket: inbound messages are queued by the test, outbound messages are
 * recorded. Sends to addresses marked unreachable fail like a ROUTER_MANDATORY socket would.
 *
 * <p>
 * Inbound messages must be queued before the broker thread is started if the broker runs on its own thread.
 */
class InMemoryTransport implements BrokerTransport {
    final Deque<ZMsg> inbound = new ArrayDeque<>();
    final List<ZMsg> outbound = new ArrayList<>();
    final Set<String> unreachable = new HashSet<>(); // hex routing IDs
    final AtomicInteger pollFailures = new AtomicInteger(); // number of upcoming poll calls that fail
    final AtomicInteger receiveFailures = new AtomicInteger(); // number of upcoming receive calls that fail
    volatile boolean blockingPoll; // wait the full poll timeout if nothing is pending
    boolean failBind;
    volatile boolean closed;
    URI boundEndpoint;

    @Override
    public URI bind(@NotNull final URI endpoint) {
        if (failBind) {
            throw new MdpTransportException("could not bind broker to '" + endpoint + "'");
        }
        boundEndpoint = endpoint;
        return endpoint;
    }

    @Override
    public boolean poll(final long timeout) {
        if (closed) {
            throw new MdpTransportException("transport already closed");
        }
        if (pollFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new MdpTransportException("poll failed on in-memory transport");
        }
        if (blockingPoll && inbound.isEmpty()) {
            LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(timeout));
        }
        return !inbound.isEmpty();
    }

    @Override
    public ZMsg receive() {
        if (receiveFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new MdpTransportException("receive failed on in-memory transport");
        }
        return inbound.pollFirst();
    }

    @Override
    public void send(@NotNull final ZMsg msg) {
        final String recipient = ZData.strhex(msg.getFirst().getData());
        if (closed || unreachable.contains(recipient)) {
            throw new MdpTransportException("could not send message to '" + recipient + "'");
        }
        outbound.add(msg);
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }

    void receiveFrom(final byte[] sender, final MdpMessage message) {
        message.senderID = sender;
        inbound.add(message.toZMsg(true));
    }

    List<MdpMessage> sent() {
        return outbound.stream().map(msg -> MdpMessage.decode(msg, true)).collect(Collectors.toList());
    }

    List<MdpMessage> sent(final Command command) {
        return sent().stream().filter(msg -> msg.command == command).collect(Collectors.toList());
    }
}
