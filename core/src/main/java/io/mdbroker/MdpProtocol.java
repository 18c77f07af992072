package io.mdbroker;

import static org.zeromq.ZMQ.Socket;

import static io.mdbroker.MdpProtocol.Command.*;
import static io.mdbroker.MdpProtocolException.Reason.MALFORMED;
import static io.mdbroker.MdpProtocolException.Reason.UNKNOWN_COMMAND;
import static io.mdbroker.MdpProtocolException.Reason.UNKNOWN_ORIGINATOR;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeromq.SocketType;
import org.zeromq.ZFrame;
import org.zeromq.ZMQ;
import org.zeromq.ZMsg;
import org.zeromq.util.ZData;

/**
 * Majordomo Protocol (MDP) definitions and implementations according to https://rfc.zeromq.org/spec/7/ (MDP/0.1)
 *
 * <p>
 * Frame layout as seen by the broker ROUTER socket:
 * <pre>
 *  client  -&gt; broker : [sender][""]["MDPC01"][service][body...]
 *  broker  -&gt; client : [client][""]["MDPC01"][service][body...]
 *  worker  -&gt; broker : [sender][""]["MDPW01"][command][command frames...]
 *  broker  -&gt; worker : [worker][""]["MDPW01"][command][command frames...]
 * </pre>
 * Worker command frames: READY [service], REQUEST/REPLY [client][""][body...], HEARTBEAT and DISCONNECT none.
 * <p>
 * DEALER sockets (clients and workers) neither send nor receive the leading sender frame.
 */
@SuppressWarnings({ "PMD.TooManyMethods", "PMD.ArrayIsStoredDirectly", "PMD.MethodReturnsInternalArray" })
public final class MdpProtocol { // NOPMD - nomen est omen
    public static final byte[] EMPTY_FRAME = {};
    private static final byte[] PROTOCOL_NAME_CLIENT = "MDPC01".getBytes(StandardCharsets.UTF_8);
    private static final byte[] PROTOCOL_NAME_WORKER = "MDPW01".getBytes(StandardCharsets.UTF_8);
    private static final byte[] PROTOCOL_NAME_UNKNOWN = "UNKNOWN_PROTOCOL".getBytes(StandardCharsets.UTF_8);
    private static final int MAX_PRINT_LENGTH = 200;
    private static final int MIN_PRINTABLE_CHAR = 32;
    private static final Logger LOGGER = LoggerFactory.getLogger(MdpProtocol.class);

    private MdpProtocol() {
        // utility class
    }

    /**
     * MDP sub-protocol V0.1 -- the originator tag of every message
     */
    public enum MdpSubProtocol {
        PROT_CLIENT(PROTOCOL_NAME_CLIENT), // client protocol implementation version
        PROT_WORKER(PROTOCOL_NAME_WORKER), // worker protocol implementation version
        UNKNOWN(PROTOCOL_NAME_UNKNOWN);

        private final byte[] data;
        private final String protocolName;
        MdpSubProtocol(final byte[] value) {
            this.data = value;
            protocolName = new String(data, StandardCharsets.UTF_8);
        }

        public byte[] getData() {
            return data;
        }

        @Override
        public String toString() {
            return "MdpSubProtocol{'" + protocolName + "'}";
        }

        public static MdpSubProtocol getProtocol(byte[] frame) {
            for (MdpSubProtocol knownProtocol : MdpSubProtocol.values()) {
                if (knownProtocol != UNKNOWN && Arrays.equals(knownProtocol.data, frame)) {
                    return knownProtocol;
                }
            }
            return UNKNOWN;
        }
    }

    /**
     * MDP/0.1 worker commands, as byte values
     */
    public enum Command {
        READY(0x01, true, false),
        REQUEST(0x02, false, true),
        REPLY(0x03, true, false),
        HEARTBEAT(0x04, true, true),
        DISCONNECT(0x05, true, true),
        UNKNOWN(-1, false, false);

        private final byte[] data;
        private final boolean sentByWorker;
        private final boolean sentByBroker;
        Command(final int value, final boolean sentByWorker, final boolean sentByBroker) { //watch for ints>255, will be truncated
            this.data = new byte[] { (byte) (value & 0xFF) };
            this.sentByWorker = sentByWorker;
            this.sentByBroker = sentByBroker;
        }

        public byte[] getData() {
            return data;
        }

        /**
         * @return {@code true} if a worker may send this command to the broker
         */
        public boolean isSentByWorker() {
            return sentByWorker;
        }

        /**
         * @return {@code true} if the broker may send this command to a worker
         */
        public boolean isSentByBroker() {
            return sentByBroker;
        }

        public static Command getCommand(byte[] frame) {
            for (Command knownMdpCommand : values()) {
                if (knownMdpCommand != UNKNOWN && Arrays.equals(knownMdpCommand.data, frame)) {
                    return knownMdpCommand;
                }
            }
            return UNKNOWN;
        }
    }

    /**
     * MDP data object holding one decoded Majordomo message.
     *
     * Client sub-protocol messages have no command frame on the wire: they are decoded as {@link Command#REQUEST}
     * on the broker (ROUTER) side and as {@link Command#REPLY} on the client (DEALER) side.
     */
    public static class MdpMessage {
        /** frame 0: sender/recipient routing ID - only present on ROUTER sockets */
        public byte[] senderID;
        /** originator tag: client or worker sub-protocol */
        public MdpSubProtocol protocol;
        /** worker command, or the implicit REQUEST/REPLY for client messages */
        public Command command;
        /** service name (client messages and READY), empty otherwise */
        public byte[] serviceNameBytes;
        /** client routing ID (worker REQUEST and REPLY), empty otherwise */
        public byte[] clientID;
        /** opaque body frames */
        public List<byte[]> body;

        /**
         * @param senderID routing ID of the peer - may be null for DEALER-side messages
         * @param protocol originator tag
         * @param command worker command or implicit client command
         * @param serviceNameBytes UTF-8 encoded service name - may be null if not applicable
         * @param clientID client routing ID - may be null if not applicable
         * @param body opaque body frames - may be null or empty
         */
        public MdpMessage(final byte[] senderID, @NotNull final MdpSubProtocol protocol, @NotNull final Command command,
                final byte[] serviceNameBytes, final byte[] clientID, final List<byte[]> body) {
            this.senderID = senderID == null ? EMPTY_FRAME : senderID;
            this.protocol = Objects.requireNonNull(protocol, "protocol must not be null");
            this.command = Objects.requireNonNull(command, "command must not be null");
            this.serviceNameBytes = serviceNameBytes == null ? EMPTY_FRAME : serviceNameBytes;
            this.clientID = clientID == null ? EMPTY_FRAME : clientID;
            this.body = body == null ? Collections.emptyList() : List.copyOf(body);
        }

        public static MdpMessage clientRequest(@NotNull final String serviceName, final byte[]... body) {
            return new MdpMessage(null, MdpSubProtocol.PROT_CLIENT, REQUEST, serviceName.getBytes(StandardCharsets.UTF_8), null, List.of(body));
        }

        public static MdpMessage clientReply(@NotNull final byte[] clientAddress, @NotNull final byte[] serviceNameBytes, final List<byte[]> body) {
            return new MdpMessage(clientAddress, MdpSubProtocol.PROT_CLIENT, REPLY, serviceNameBytes, null, body);
        }

        public static MdpMessage workerReady(@NotNull final String serviceName) {
            return new MdpMessage(null, MdpSubProtocol.PROT_WORKER, READY, serviceName.getBytes(StandardCharsets.UTF_8), null, null);
        }

        public static MdpMessage workerRequest(@NotNull final byte[] workerAddress, @NotNull final byte[] clientAddress, final List<byte[]> body) {
            return new MdpMessage(workerAddress, MdpSubProtocol.PROT_WORKER, REQUEST, null, clientAddress, body);
        }

        public static MdpMessage workerReply(@NotNull final byte[] clientAddress, final byte[]... body) {
            return new MdpMessage(null, MdpSubProtocol.PROT_WORKER, REPLY, null, clientAddress, List.of(body));
        }

        public static MdpMessage workerHeartbeat(final byte[] workerAddress) {
            return new MdpMessage(workerAddress, MdpSubProtocol.PROT_WORKER, HEARTBEAT, null, null, null);
        }

        public static MdpMessage workerDisconnect(final byte[] workerAddress) {
            return new MdpMessage(workerAddress, MdpSubProtocol.PROT_WORKER, DISCONNECT, null, null, null);
        }

        public String getSenderName() {
            return ZData.toString(senderID);
        }

        public String getServiceName() {
            return new String(serviceNameBytes, StandardCharsets.UTF_8);
        }

        /**
         * Encodes this message into its multipart wire representation.
         *
         * @param withSenderFrame {@code true} to prepend the routing ID (needed when sending through ROUTER sockets)
         * @return newly allocated multipart message
         */
        public ZMsg toZMsg(final boolean withSenderFrame) {
            final ZMsg msg = new ZMsg();
            if (withSenderFrame) {
                msg.add(new ZFrame(senderID));
            }
            msg.add(new ZFrame(EMPTY_FRAME));
            msg.add(new ZFrame(protocol.getData()));
            switch (protocol) {
            case PROT_CLIENT:
                msg.add(new ZFrame(serviceNameBytes));
                body.forEach(frame -> msg.add(new ZFrame(frame)));
                break;
            case PROT_WORKER:
                msg.add(new ZFrame(command.getData()));
                switch (command) {
                case READY:
                    msg.add(new ZFrame(serviceNameBytes));
                    break;
                case REQUEST:
                case REPLY:
                    msg.add(new ZFrame(clientID));
                    msg.add(new ZFrame(EMPTY_FRAME));
                    body.forEach(frame -> msg.add(new ZFrame(frame)));
                    break;
                case HEARTBEAT:
                case DISCONNECT:
                    break;
                default:
                    throw new IllegalStateException("cannot encode worker command " + command);
                }
                break;
            default:
                throw new IllegalStateException("cannot encode protocol " + protocol);
            }
            return msg;
        }

        /**
         * Send MDP message to Socket
         *
         * @param socket ZeroMQ socket to send the message on
         * @return {@code true} if successful
         */
        public boolean send(@NotNull final Socket socket) {
            final ZMsg msg = toZMsg(socket.getSocketType() == SocketType.ROUTER);
            if (LOGGER.isTraceEnabled()) {
                LOGGER.atTrace().addArgument(this).log("sending message {}");
            }
            return msg.send(socket);
        }

        /**
         * Decodes a multipart message.
         *
         * @param msg multipart message as received from the socket (left unmodified)
         * @param hasSenderFrame {@code true} if the first frame is the routing ID (ROUTER sockets), which also marks
         *                       client messages as {@link Command#REQUEST}
         * @return decoded message
         * @throws MdpProtocolException if the message is not a valid MDP/0.1 message
         */
        public static MdpMessage decode(@NotNull final ZMsg msg, final boolean hasSenderFrame) {
            final List<byte[]> rawFrames = msg.stream().map(ZFrame::getData).collect(Collectors.toUnmodifiableList());
            int index = 0;
            final byte[] senderID;
            if (hasSenderFrame) {
                requireFrames(rawFrames, 1, "sender frame");
                senderID = rawFrames.get(index++);
            } else {
                senderID = EMPTY_FRAME;
            }
            requireFrames(rawFrames, index + 2, "empty delimiter and protocol frame");
            if (rawFrames.get(index++).length != 0) {
                throw new MdpProtocolException(MALFORMED, "missing empty delimiter frame, rawMessage: " + dataToString(rawFrames));
            }

            final MdpSubProtocol protocol = MdpSubProtocol.getProtocol(rawFrames.get(index++));
            switch (protocol) {
            case PROT_CLIENT:
                requireFrames(rawFrames, index + 1, "service frame");
                final byte[] serviceName = rawFrames.get(index++);
                return new MdpMessage(senderID, protocol, hasSenderFrame ? REQUEST : REPLY, serviceName, null, rawFrames.subList(index, rawFrames.size()));
            case PROT_WORKER:
                requireFrames(rawFrames, index + 1, "command frame");
                final byte[] commandFrame = rawFrames.get(index++);
                final Command command = Command.getCommand(commandFrame);
                switch (command) {
                case READY:
                    requireFrames(rawFrames, index + 1, "service frame");
                    return new MdpMessage(senderID, protocol, command, rawFrames.get(index), null, null);
                case REQUEST:
                case REPLY:
                    requireFrames(rawFrames, index + 2, "client and empty delimiter frame");
                    final byte[] clientID = rawFrames.get(index++);
                    if (rawFrames.get(index++).length != 0) {
                        throw new MdpProtocolException(MALFORMED, "missing empty delimiter after client frame, rawMessage: " + dataToString(rawFrames));
                    }
                    return new MdpMessage(senderID, protocol, command, null, clientID, rawFrames.subList(index, rawFrames.size()));
                case HEARTBEAT:
                case DISCONNECT:
                    return new MdpMessage(senderID, protocol, command, null, null, null);
                default:
                    throw new MdpProtocolException(UNKNOWN_COMMAND, "unknown command: '" + ZData.strhex(commandFrame) + "' rawMessage: " + dataToString(rawFrames));
                }
            default:
                throw new MdpProtocolException(UNKNOWN_ORIGINATOR, "unknown protocol: '" + ZData.toString(rawFrames.get(index - 1)) + "' rawMessage: " + dataToString(rawFrames));
            }
        }

        /**
         * @param socket the socket to receive from
         * @param wait {@code false} performs a non-blocking receive
         * @return MdpMessage if valid, or {@code null} otherwise
         */
        public static MdpMessage receive(@NotNull final Socket socket, final boolean wait) {
            final ZMsg msg = ZMsg.recvMsg(socket, wait ? 0 : ZMQ.DONTWAIT);
            if (msg == null) {
                return null;
            }
            try {
                return decode(msg, socket.getSocketType() == SocketType.ROUTER);
            } catch (MdpProtocolException e) {
                LOGGER.atDebug().setCause(e).log("received invalid message");
                return null;
            }
        }

        @Override
        public boolean equals(final Object obj) {
            if (this == obj) {
                return true;
            } else if (!(obj instanceof MdpMessage)) {
                return false;
            }
            final MdpMessage other = (MdpMessage) obj;
            // ignore senderID from comparison since not all socket provide/require this information
            if (protocol != other.protocol || command != other.command || !Arrays.equals(serviceNameBytes, other.serviceNameBytes)
                    || !Arrays.equals(clientID, other.clientID) || body.size() != other.body.size()) {
                return false;
            }
            for (int i = 0; i < body.size(); i++) {
                if (!Arrays.equals(body.get(i), other.body.get(i))) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public int hashCode() {
            int result = protocol.hashCode();
            result = 31 * result + command.hashCode();
            result = 31 * result + Arrays.hashCode(serviceNameBytes);
            result = 31 * result + Arrays.hashCode(clientID);
            for (byte[] frame : body) {
                result = 31 * result + Arrays.hashCode(frame);
            }
            return result;
        }

        @Override
        public String toString() {
            return "MdpMessage{senderID='" + dataToString(senderID) + "', " + protocol + ", " + command + ", serviceName='" + getServiceName()
                    + "', clientID='" + dataToString(clientID) + "', body=" + dataToString(body) + '}';
        }

        public static String dataToString(byte[] data) {
            if (data == null) {
                return "";
            }
            // Dump message as text or hex-encoded string
            boolean isText = true;
            for (byte aData : data) {
                if (aData < MIN_PRINTABLE_CHAR) {
                    isText = false;
                    break;
                }
            }
            if (isText) {
                // always make full-print when there are only printable characters
                return new String(data, ZMQ.CHARSET);
            }
            if (data.length < MAX_PRINT_LENGTH) {
                return ZData.strhex(data);
            } else {
                return ZData.strhex(Arrays.copyOf(data, MAX_PRINT_LENGTH)) + "[" + (data.length - MAX_PRINT_LENGTH) + " more bytes]";
            }
        }

        public static String dataToString(List<byte[]> data) {
            return data.stream().map(MdpMessage::dataToString).collect(Collectors.joining(", ", "[#frames= " + data.size() + ": ", "]"));
        }

        private static void requireFrames(final List<byte[]> rawFrames, final int minimum, final String what) {
            if (rawFrames.size() < minimum) {
                throw new MdpProtocolException(MALFORMED, "message too short for " + what + ", rawMessage: " + dataToString(rawFrames));
            }
        }
    }
}
