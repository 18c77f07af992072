package io.mdbroker;

import static java.nio.charset.StandardCharsets.UTF_8;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZFrame;
import org.zeromq.ZMQ;
import org.zeromq.ZMsg;

import io.mdbroker.MdpProtocol.Command;
import io.mdbroker.MdpProtocol.MdpMessage;
import io.mdbroker.MdpProtocol.MdpSubProtocol;

/**
 * basic MDP/0.1 protocol consistency tests
 */
class MdpProtocolTests {
    private static final byte[] SENDER = "senderName".getBytes(UTF_8);
    private static final byte[] CLIENT = { 3, 2, 1 };
    private static final byte[] DATA = "test data - Hello World!".getBytes(UTF_8);

    @Test
    void testCommandEnum() {
        for (Command cmd : Command.values()) {
            assertEquals(cmd, Command.getCommand(cmd.getData()));
            assertNotNull(cmd.toString());
            if (cmd != Command.UNKNOWN) {
                assertTrue(cmd.isSentByWorker() || cmd.isSentByBroker());
            }
        }
        assertArrayEquals(new byte[] { 0x01 }, Command.READY.getData());
        assertArrayEquals(new byte[] { 0x05 }, Command.DISCONNECT.getData());
        assertEquals(Command.UNKNOWN, Command.getCommand(new byte[] { 0x06 }));
        assertEquals(Command.UNKNOWN, Command.getCommand(new byte[0]));
        assertFalse(Command.REQUEST.isSentByWorker());
        assertFalse(Command.REPLY.isSentByBroker());
    }

    @Test
    void testMdpSubProtocolEnum() {
        for (MdpSubProtocol cmd : MdpSubProtocol.values()) {
            assertEquals(cmd, MdpSubProtocol.getProtocol(cmd.getData()));
            assertNotNull(cmd.toString());
        }
        assertArrayEquals("MDPC01".getBytes(UTF_8), MdpSubProtocol.PROT_CLIENT.getData());
        assertArrayEquals("MDPW01".getBytes(UTF_8), MdpSubProtocol.PROT_WORKER.getData());
        assertEquals(MdpSubProtocol.UNKNOWN, MdpSubProtocol.getProtocol("MDPC02".getBytes(UTF_8)));
    }

    @Test
    void testMdpIdentity() {
        final MdpMessage test = MdpMessage.clientRequest("serviceName", DATA);
        assertEquals(Command.REQUEST, test.command);
        assertEquals(test, test, "object identity");
        assertNotEquals(test, new Object(), "inequality if different class type");
        final MdpMessage clone = MdpMessage.clientRequest("serviceName", DATA.clone());
        clone.senderID = SENDER;
        assertEquals(test, clone, "sender ID is ignored");
        assertEquals(test.hashCode(), clone.hashCode(), "hashCode equality");
        clone.protocol = MdpSubProtocol.PROT_WORKER;
        assertNotEquals(test, clone);
        assertNotEquals(test, MdpMessage.clientRequest("serviceName", DATA, DATA), "different number of body frames");
        assertEquals("serviceName", test.getServiceName(), "service name string");
        assertEquals("", test.getSenderName());
        assertNotNull(test.toString());
    }

    @Test
    void testWireLayout() {
        assertFrames(MdpMessage.clientRequest("echo", DATA).toZMsg(false), "", "MDPC01", "echo", "test data - Hello World!");
        assertFrames(MdpMessage.clientReply("client".getBytes(UTF_8), "echo".getBytes(UTF_8), List.of(DATA)).toZMsg(true), "client", "", "MDPC01", "echo", "test data - Hello World!");
        assertFrames(MdpMessage.workerReady("echo").toZMsg(false), "", "MDPW01", "\u0001", "echo");
        assertFrames(MdpMessage.workerRequest("worker".getBytes(UTF_8), "client".getBytes(UTF_8), List.of(DATA)).toZMsg(true), "worker", "", "MDPW01", "\u0002", "client", "", "test data - Hello World!");
        assertFrames(MdpMessage.workerReply("client".getBytes(UTF_8), DATA).toZMsg(false), "", "MDPW01", "\u0003", "client", "", "test data - Hello World!");
        assertFrames(MdpMessage.workerHeartbeat("worker".getBytes(UTF_8)).toZMsg(true), "worker", "", "MDPW01", "\u0004");
        assertFrames(MdpMessage.workerDisconnect("worker".getBytes(UTF_8)).toZMsg(true), "worker", "", "MDPW01", "\u0005");
    }

    @ParameterizedTest
    @EnumSource(value = Command.class, names = { "READY", "REQUEST", "REPLY", "HEARTBEAT", "DISCONNECT" })
    void testWorkerDecode(final Command command) {
        final MdpMessage original = new MdpMessage(SENDER, MdpSubProtocol.PROT_WORKER, command, command == Command.READY ? "echo".getBytes(UTF_8) : null,
                command == Command.REQUEST || command == Command.REPLY ? CLIENT : null, command == Command.REQUEST || command == Command.REPLY ? List.of(DATA, DATA) : null);
        final MdpMessage decoded = MdpMessage.decode(original.toZMsg(true), true);
        assertEquals(original, decoded);
        assertArrayEquals(SENDER, decoded.senderID);
    }

    @Test
    void testClientDecode() {
        final ZMsg request = MdpMessage.clientRequest("echo", DATA, DATA).toZMsg(false);
        request.push(SENDER);
        final MdpMessage decoded = MdpMessage.decode(request, true);
        assertEquals(MdpSubProtocol.PROT_CLIENT, decoded.protocol);
        assertEquals(Command.REQUEST, decoded.command, "client messages received by the broker are requests");
        assertArrayEquals(SENDER, decoded.senderID);
        assertEquals("echo", decoded.getServiceName());
        assertEquals(2, decoded.body.size());

        final MdpMessage reply = MdpMessage.decode(MdpMessage.clientReply(SENDER, "echo".getBytes(UTF_8), List.of()).toZMsg(false), false);
        assertEquals(Command.REPLY, reply.command, "client messages received by the client are replies");
        assertEquals(0, reply.senderID.length);
        assertTrue(reply.body.isEmpty());
    }

    @Test
    void testDecodeErrors() {
        assertDecodeError(MdpProtocolException.Reason.MALFORMED, frames());
        assertDecodeError(MdpProtocolException.Reason.MALFORMED, frames("sender", ""));
        assertDecodeError(MdpProtocolException.Reason.MALFORMED, frames("sender", "not-empty", "MDPC01", "echo"));
        assertDecodeError(MdpProtocolException.Reason.MALFORMED, frames("sender", "", "MDPC01"));
        assertDecodeError(MdpProtocolException.Reason.MALFORMED, frames("sender", "", "MDPW01"));
        assertDecodeError(MdpProtocolException.Reason.MALFORMED, frames("sender", "", "MDPW01", "\u0001"));
        assertDecodeError(MdpProtocolException.Reason.MALFORMED, frames("sender", "", "MDPW01", "\u0003", "client"));
        assertDecodeError(MdpProtocolException.Reason.MALFORMED, frames("sender", "", "MDPW01", "\u0003", "client", "x", "body"));
        assertDecodeError(MdpProtocolException.Reason.UNKNOWN_ORIGINATOR, frames("sender", "", "MDPX01", "echo"));
        assertDecodeError(MdpProtocolException.Reason.UNKNOWN_COMMAND, frames("sender", "", "MDPW01", "\u0009"));
    }

    @Test
    void testDataToString() {
        assertEquals("", MdpMessage.dataToString((byte[]) null));
        assertEquals("text", MdpMessage.dataToString("text".getBytes(UTF_8)));
        assertEquals("000102", MdpMessage.dataToString(new byte[] { 0, 1, 2 }));
        assertTrue(MdpMessage.dataToString(new byte[300]).endsWith("[100 more bytes]"));
        assertEquals("[#frames= 2: a, b]", MdpMessage.dataToString(List.of("a".getBytes(UTF_8), "b".getBytes(UTF_8))));
    }

    @Test
    void testMdpSendReceiveIdentity() {
        try (ZContext ctx = new ZContext()) {
            final ZMQ.Socket router = ctx.createSocket(SocketType.ROUTER);
            router.bind("inproc://mdp-identity");
            final ZMQ.Socket dealer = ctx.createSocket(SocketType.DEALER);
            dealer.setIdentity(SENDER);
            dealer.connect("inproc://mdp-identity");
            LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(200));

            final MdpMessage ready = MdpMessage.workerReady("echo");
            assertTrue(ready.send(dealer));
            final MdpMessage received = MdpMessage.receive(router, true);
            assertNotNull(received);
            assertEquals(ready, received, "serialisation identity via router");
            assertArrayEquals(SENDER, received.senderID);

            final MdpMessage request = MdpMessage.workerRequest(SENDER, CLIENT, List.of(DATA));
            assertTrue(request.send(router));
            final MdpMessage receivedRequest = MdpMessage.receive(dealer, true);
            assertEquals(request, receivedRequest, "serialisation identity via dealer");

            dealer.send("garbage");
            LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(100));
            assertNull(MdpMessage.receive(router, true), "invalid messages are dropped");
            assertNull(MdpMessage.receive(router, false), "nothing pending");
        }
    }

    private static void assertDecodeError(final MdpProtocolException.Reason reason, final ZMsg msg) {
        final MdpProtocolException exception = assertThrows(MdpProtocolException.class, () -> MdpMessage.decode(msg, true));
        assertEquals(reason, exception.getReason(), exception.toString());
    }

    private static ZMsg frames(final String... frames) {
        final ZMsg msg = new ZMsg();
        for (String frame : frames) {
            msg.add(frame.getBytes(UTF_8));
        }
        return msg;
    }

    private static void assertFrames(final ZMsg msg, final String... expected) {
        assertEquals(expected.length, msg.size(), msg.toString());
        int index = 0;
        for (ZFrame frame : msg) {
            assertArrayEquals(expected[index].getBytes(UTF_8), frame.getData(), "frame #" + index);
            index++;
        }
    }
}
