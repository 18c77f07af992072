package io.mdbroker.server.domain;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.ArrayDeque;
import java.util.Deque;

import org.jetbrains.annotations.NotNull;

/**
 * This defines a single service: its pending client requests and its idle workers, both in arrival order.
 *
 * <p>
 * Workers are referenced by their wrapped {@link WorkerId} only and resolved through the registry on demand.
 */
public class ServiceState {
    private final String name; // Service name
    private final byte[] nameBytes; // Service name as byte array
    private final Deque<ClientRequest> requests = new ArrayDeque<>(); // List of pending client requests
    private final Deque<String> waiting = new ArrayDeque<>(); // List of waiting workers

    public ServiceState(@NotNull final String name) {
        this.name = name;
        this.nameBytes = name.getBytes(UTF_8);
    }

    public String getName() {
        return name;
    }

    @SuppressWarnings("PMD.MethodReturnsInternalArray")
    public byte[] getNameBytes() {
        return nameBytes;
    }

    public Deque<ClientRequest> getRequests() {
        return requests;
    }

    public Deque<String> getWaiting() {
        return waiting;
    }

    public boolean isIdle() {
        return requests.isEmpty() && waiting.isEmpty();
    }

    @Override
    public String toString() {
        return "ServiceState{name='" + name + "', requests=" + requests.size() + ", waiting=" + waiting + '}';
    }
}
