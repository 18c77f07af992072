package io.mdbroker.server.domain;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

import io.mdbroker.MdpProtocol.MdpMessage;

/**
 * This defines one registered (idle) worker. Owned exclusively by the registry.
 */
@SuppressWarnings("PMD.ArrayIsStoredDirectly")
public class WorkerRecord {
    public static final long NEVER = -1L;
    private final WorkerId id;
    private final byte[] address; // Address ID frame to route to
    private final String serviceName; // service this worker last declared
    private final long registeredAt; // [ms]
    private long lastHeartbeatSent = NEVER; // [ms]
    private long lastHeartbeatReceived; // [ms]
    private long expiresAt; // [ms] Expires at unless heartbeat

    public WorkerRecord(@NotNull final WorkerId id, final byte[] address, @NotNull final String serviceName, final long registeredAt, final long expiresAt) { // NOPMD direct storage of address OK
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.address = address == null ? new byte[0] : address;
        this.serviceName = Objects.requireNonNull(serviceName, "serviceName must not be null");
        this.registeredAt = registeredAt;
        this.lastHeartbeatReceived = registeredAt;
        this.expiresAt = expiresAt;
    }

    public WorkerId getId() {
        return id;
    }

    @SuppressWarnings("PMD.MethodReturnsInternalArray")
    public byte[] getAddress() {
        return address;
    }

    public String getServiceName() {
        return serviceName;
    }

    public long getRegisteredAt() {
        return registeredAt;
    }

    public long getLastHeartbeatSent() {
        return lastHeartbeatSent;
    }

    public void setLastHeartbeatSent(final long lastHeartbeatSent) {
        this.lastHeartbeatSent = lastHeartbeatSent;
    }

    public long getLastHeartbeatReceived() {
        return lastHeartbeatReceived;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    public boolean isExpired(final long now) {
        return expiresAt <= now;
    }

    /**
     * @param now current time [ms]
     * @param timeToLive [ms]
     */
    public void refresh(final long now, final long timeToLive) {
        lastHeartbeatReceived = now;
        expiresAt = now + timeToLive;
    }

    @Override
    public String toString() {
        return "WorkerRecord{id=" + id + ", address='" + MdpMessage.dataToString(address) + "', serviceName='" + serviceName
                + "', registeredAt=" + registeredAt + ", lastHeartbeatSent=" + lastHeartbeatSent + ", lastHeartbeatReceived=" + lastHeartbeatReceived
                + ", expiresAt=" + expiresAt + '}';
    }
}
