package io.mdbroker.server.domain;

import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;

import io.mdbroker.MdpProtocol.MdpMessage;

/**
 * A client request waiting in a service queue.
 */
@SuppressWarnings("PMD.ArrayIsStoredDirectly")
public class ClientRequest {
    private final byte[] requester; // routing ID of the requesting client
    private final List<byte[]> body; // opaque request frames
    private final long receivedAt; // [ms]

    public ClientRequest(@NotNull final byte[] requester, @NotNull final List<byte[]> body, final long receivedAt) { // NOPMD direct storage of address OK
        this.requester = Objects.requireNonNull(requester, "requester must not be null");
        this.body = List.copyOf(body);
        this.receivedAt = receivedAt;
    }

    @SuppressWarnings("PMD.MethodReturnsInternalArray")
    public byte[] getRequester() {
        return requester;
    }

    public List<byte[]> getBody() {
        return body;
    }

    public long getReceivedAt() {
        return receivedAt;
    }

    @Override
    public String toString() {
        return "ClientRequest{requester='" + MdpMessage.dataToString(requester) + "', body=" + MdpMessage.dataToString(body) + ", receivedAt=" + receivedAt + '}';
    }
}
