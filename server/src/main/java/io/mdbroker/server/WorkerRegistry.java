package io.mdbroker.server;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

import io.mdbroker.server.domain.ServiceState;
import io.mdbroker.server.domain.WorkerId;
import io.mdbroker.server.domain.WorkerRecord;

/**
 * Owns the known (idle) workers and, per service name, the pending-request and available-worker queues.
 *
 * <p>
 * Invariants:
 * <ul>
 * <li>a worker identity is queued in at most one service and only while its record is registered</li>
 * <li>expired records are removed from the registry and from every queue in the same call</li>
 * <li>queues are strictly FIFO</li>
 * </ul>
 * N.B. not thread-safe: all methods must be called with the broker lock held.
 */
@SuppressWarnings("PMD.UseConcurrentHashMap") // guarded by the broker lock
public class WorkerRegistry {
    private final long timeToLive; // [ms]
    private final Map<String, WorkerRecord> workers = new LinkedHashMap<>(); // known workers Map<wrapped id, WorkerRecord>
    private final Map<String, ServiceState> services = new HashMap<>(); // known services Map<'service name', ServiceState>

    /**
     * @param timeToLive [ms] time after the last received heart-beat after which a worker is presumed dead
     */
    public WorkerRegistry(final long timeToLive) {
        if (timeToLive <= 0) {
            throw new IllegalArgumentException("timeToLive must be positive: " + timeToLive);
        }
        this.timeToLive = timeToLive;
    }

    public long getTimeToLive() {
        return timeToLive;
    }

    /**
     * Creates or overwrites the worker record and appends the worker to the service's available-worker queue.
     *
     * @param id worker identity
     * @param address routing frame (may be null for internal workers)
     * @param serviceName service the worker is ready to serve
     * @param now [ms] current time
     * @return the new record
     */
    public WorkerRecord registerReady(@NotNull final WorkerId id, final byte[] address, @NotNull final String serviceName, final long now) {
        final String wrappedId = id.getWrapped();
        purgeFromQueues(wrappedId); // a repeated READY must not leave the identity queued twice
        final WorkerRecord worker = new WorkerRecord(id, address, serviceName, now, now + timeToLive);
        workers.put(wrappedId, worker);
        requireService(serviceName).getWaiting().addLast(wrappedId);
        return worker;
    }

    /**
     * @param id worker identity
     * @param now [ms] current time
     * @return {@code false} if the identity is unknown (state unchanged), {@code true} if its expiry has been extended
     */
    public boolean recordHeartbeat(@NotNull final WorkerId id, final long now) {
        final WorkerRecord worker = workers.get(id.getWrapped());
        if (worker == null) {
            return false;
        }
        worker.refresh(now, timeToLive);
        return true;
    }

    /**
     * @param id worker identity
     * @return the removed record or {@code null} if the identity was unknown
     */
    public WorkerRecord remove(@NotNull final WorkerId id) {
        final WorkerRecord worker = workers.remove(id.getWrapped());
        if (worker != null) {
            purgeFromQueues(id.getWrapped());
        }
        return worker;
    }

    /**
     * Removes every worker with {@code expiresAt <= now} from the registry and from all available-worker queues,
     * then drops service entries that have neither pending requests nor available workers.
     *
     * @param now [ms] current time
     * @return the removed records, oldest registration first
     */
    public List<WorkerRecord> sweepExpired(final long now) {
        final List<WorkerRecord> expired = new ArrayList<>();
        for (WorkerRecord worker : workers.values()) {
            if (worker.isExpired(now)) {
                expired.add(worker);
            }
        }
        for (WorkerRecord worker : expired) {
            workers.remove(worker.getId().getWrapped());
            purgeFromQueues(worker.getId().getWrapped());
        }
        purgeIdleServices();
        return expired;
    }

    /**
     * Takes the oldest available worker of the service out of the pool: the identity leaves the queue and its record
     * leaves the registry (an assigned worker has to send a new READY to rejoin).
     *
     * @param service the service to take a worker from
     * @return the claimed record or {@code null} if no worker is available
     */
    public WorkerRecord claimAvailableWorker(@NotNull final ServiceState service) {
        for (String wrappedId = service.getWaiting().pollFirst(); wrappedId != null; wrappedId = service.getWaiting().pollFirst()) {
            final WorkerRecord worker = workers.remove(wrappedId);
            if (worker != null) {
                return worker;
            }
        }
        return null;
    }

    /**
     * Locates the service (creates if necessary).
     *
     * @param serviceName service name
     * @return the existing (or new if absent) service
     */
    public ServiceState requireService(@NotNull final String serviceName) {
        return services.computeIfAbsent(serviceName, ServiceState::new);
    }

    public ServiceState getService(final String serviceName) {
        return services.get(serviceName);
    }

    public WorkerRecord getWorker(@NotNull final WorkerId id) {
        return workers.get(id.getWrapped());
    }

    public boolean contains(@NotNull final WorkerId id) {
        return workers.containsKey(id.getWrapped());
    }

    public Collection<WorkerRecord> getWorkers() {
        return Collections.unmodifiableCollection(workers.values());
    }

    public Collection<ServiceState> getServices() {
        return Collections.unmodifiableCollection(services.values());
    }

    public int pendingRequests(final String serviceName) {
        final ServiceState service = services.get(serviceName);
        return service == null ? 0 : service.getRequests().size();
    }

    public List<WorkerId> availableWorkers(final String serviceName) {
        final ServiceState service = services.get(serviceName);
        if (service == null) {
            return Collections.emptyList();
        }
        final List<WorkerId> available = new ArrayList<>(service.getWaiting().size());
        service.getWaiting().forEach(wrappedId -> available.add(WorkerId.unwrap(wrappedId)));
        return available;
    }

    /**
     * @return number of dropped service entries without pending requests and without available workers
     */
    public int purgeIdleServices() {
        final int before = services.size();
        services.values().removeIf(ServiceState::isIdle);
        return before - services.size();
    }

    private void purgeFromQueues(final String wrappedId) {
        for (ServiceState service : services.values()) {
            service.getWaiting().remove(wrappedId);
        }
    }

    @Override
    public String toString() {
        return "WorkerRegistry{workers=" + workers.keySet() + ", services=" + services.values() + '}';
    }
}
