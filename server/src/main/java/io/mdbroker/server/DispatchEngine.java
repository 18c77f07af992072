package io.mdbroker.server;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mdbroker.server.domain.ClientRequest;
import io.mdbroker.server.domain.ServiceState;
import io.mdbroker.server.domain.WorkerClass;
import io.mdbroker.server.domain.WorkerId;
import io.mdbroker.server.domain.WorkerRecord;

/**
 * Matches pending client requests with available workers of the same service, oldest first on both sides.
 *
 * <p>
 * A request leaves its queue only once it has been handed to a worker. If the hand-over fails, the claimed worker is
 * dropped and the request stays at the head of the queue for the next available worker.
 * <p>
 * N.B. not thread-safe: all methods must be called with the broker lock held.
 */
@SuppressWarnings({ "PMD.UseConcurrentHashMap", "PMD.AvoidCatchingGenericException" }) // guarded by the broker lock
public class DispatchEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(DispatchEngine.class);
    /** upper bound of remembered assignments of workers that never replied */
    public static final int MAX_TRACKED_ASSIGNMENTS = 65_536;
    private static final WorkerDelivery UNSUPPORTED_DELIVERY = (worker, request) -> {
        throw new UnsupportedOperationException("no delivery registered for worker class '" + worker.getId().getWorkerClass() + "'");
    };
    private final WorkerRegistry registry;
    private final LivenessMonitor liveness;
    private final Map<WorkerClass, WorkerDelivery> deliveries = new EnumMap<>(WorkerClass.class);
    private final Map<String, String> assignments = new LinkedHashMap<>() { // Map<wrapped worker id, service name>
        private static final long serialVersionUID = 3105467427368218412L;

        @Override
        protected boolean removeEldestEntry(final Map.Entry<String, String> eldest) {
            return size() > MAX_TRACKED_ASSIGNMENTS;
        }
    };

    /**
     * @param registry the registry holding services and workers
     * @param liveness used to evict expired workers before each dispatch
     * @param zmqDelivery delivery path for {@link WorkerClass#ZMQ} workers
     */
    public DispatchEngine(@NotNull final WorkerRegistry registry, @NotNull final LivenessMonitor liveness, @NotNull final WorkerDelivery zmqDelivery) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.liveness = Objects.requireNonNull(liveness, "liveness must not be null");
        for (WorkerClass workerClass : WorkerClass.values()) {
            deliveries.put(workerClass, UNSUPPORTED_DELIVERY);
        }
        deliveries.put(WorkerClass.ZMQ, Objects.requireNonNull(zmqDelivery, "zmqDelivery must not be null"));
    }

    public void registerDelivery(@NotNull final WorkerClass workerClass, @NotNull final WorkerDelivery delivery) {
        deliveries.put(Objects.requireNonNull(workerClass, "workerClass must not be null"), Objects.requireNonNull(delivery, "delivery must not be null"));
    }

    /**
     * Queues the request at the tail of its service (created if necessary) and dispatches.
     *
     * @param serviceName the requested service
     * @param requester routing ID of the client
     * @param body opaque request frames
     * @param now [ms] current time
     * @return number of requests handed to workers
     */
    public int submitClientRequest(@NotNull final String serviceName, @NotNull final byte[] requester, @NotNull final List<byte[]> body, final long now) {
        registry.requireService(serviceName).getRequests().addLast(new ClientRequest(requester, body, now));
        return dispatch(serviceName, now);
    }

    /**
     * Evicts expired workers, then pairs pending requests and available workers of the service until either queue
     * runs empty.
     *
     * @param serviceName the service to dispatch
     * @param now [ms] current time
     * @return number of requests handed to workers
     */
    public int dispatch(@NotNull final String serviceName, final long now) {
        liveness.sweepExpired(now);
        final ServiceState service = registry.getService(serviceName);
        if (service == null) {
            return 0;
        }
        int dispatched = 0;
        while (!service.getRequests().isEmpty() && !service.getWaiting().isEmpty()) {
            final WorkerRecord worker = registry.claimAvailableWorker(service);
            if (worker == null) {
                break;
            }
            final ClientRequest request = service.getRequests().peekFirst();
            if (deliver(worker, request)) {
                service.getRequests().pollFirst();
                assignments.put(worker.getId().getWrapped(), service.getName());
                dispatched++;
            }
        }
        return dispatched;
    }

    /**
     * @param id the worker that replied (or left)
     * @return name of the service the worker has last been assigned to, or {@code null} if there is none outstanding
     */
    public String completeAssignment(@NotNull final WorkerId id) {
        return assignments.remove(id.getWrapped());
    }

    public int getOutstandingAssignments() {
        return assignments.size();
    }

    private boolean deliver(final WorkerRecord worker, final ClientRequest request) {
        try {
            deliveries.get(worker.getId().getWorkerClass()).deliver(worker, request);
            return true;
        } catch (RuntimeException e) { // NOPMD -- any failed hand-over drops the worker, the request stays queued
            LOGGER.atWarn().setCause(e).addArgument(request).addArgument(worker.getId()).log("could not deliver request {} to worker '{}' - dropping worker");
            return false;
        }
    }
}
