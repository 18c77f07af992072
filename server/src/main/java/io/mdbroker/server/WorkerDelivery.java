package io.mdbroker.server;

import org.jetbrains.annotations.NotNull;

import io.mdbroker.server.domain.ClientRequest;
import io.mdbroker.server.domain.WorkerRecord;

/**
 * Hands a client request to the worker it has been assigned to. One implementation exists per
 * {@link io.mdbroker.server.domain.WorkerClass}.
 */
@FunctionalInterface
public interface WorkerDelivery {
    /**
     * @param worker the (already claimed) worker
     * @param request the request to deliver
     * @throws MdpTransportException if the request could not be handed over
     * @throws UnsupportedOperationException if the worker class has no delivery path
     */
    void deliver(@NotNull WorkerRecord worker, @NotNull ClientRequest request);
}
