package io.mdbroker.server;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mdbroker.MdpProtocol.MdpMessage;
import io.mdbroker.server.domain.WorkerClass;
import io.mdbroker.server.domain.WorkerRecord;

/**
 * Evicts workers whose heart-beats stopped, emits periodic heart-beats to idle ZeroMQ workers and sends the final
 * DISCONNECT broadcast on shutdown.
 *
 * <p>
 * N.B. not thread-safe: all methods must be called with the broker lock held.
 */
public class LivenessMonitor {
    private static final Logger LOGGER = LoggerFactory.getLogger(LivenessMonitor.class);
    private final WorkerRegistry registry;
    private final Predicate<MdpMessage> sender;
    private final long heartbeatInterval; // [ms]

    /**
     * @param registry the worker registry to watch
     * @param sender sends a message to a worker and returns {@code false} if that failed
     * @param heartbeatInterval [ms] minimum interval between two heart-beats to the same worker
     */
    public LivenessMonitor(@NotNull final WorkerRegistry registry, @NotNull final Predicate<MdpMessage> sender, final long heartbeatInterval) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
        if (heartbeatInterval <= 0) {
            throw new IllegalArgumentException("heartbeatInterval must be positive: " + heartbeatInterval);
        }
        this.heartbeatInterval = heartbeatInterval;
    }

    public long getHeartbeatInterval() {
        return heartbeatInterval;
    }

    /**
     * @param now [ms] current time
     * @return the evicted workers
     */
    public List<WorkerRecord> sweepExpired(final long now) {
        final List<WorkerRecord> expired = registry.sweepExpired(now);
        for (WorkerRecord worker : expired) {
            LOGGER.atInfo().addArgument(worker.getId()).addArgument(worker.getServiceName()).addArgument(now - worker.getLastHeartbeatReceived()) //
                    .log("deleting expired worker '{}' of service '{}' - last heart-beat received {} ms ago");
        }
        return expired;
    }

    /**
     * Sends a HEARTBEAT to every live ZeroMQ worker that has never received one or whose last one is at least one
     * heart-beat interval old. Expired workers are evicted first.
     *
     * @param now [ms] current time
     * @return number of heart-beats sent
     */
    public int sendHeartbeats(final long now) {
        sweepExpired(now);
        int sent = 0;
        for (WorkerRecord worker : registry.getWorkers()) {
            if (worker.getId().getWorkerClass() != WorkerClass.ZMQ) {
                continue;
            }
            final long lastSent = worker.getLastHeartbeatSent();
            if (lastSent != WorkerRecord.NEVER && now < lastSent + heartbeatInterval) {
                continue;
            }
            if (sender.test(MdpMessage.workerHeartbeat(worker.getAddress()))) {
                worker.setLastHeartbeatSent(now);
                sent++;
            }
        }
        return sent;
    }

    /**
     * Sends DISCONNECT to every live ZeroMQ worker and empties the registry.
     *
     * @param now [ms] current time
     * @return number of workers that were still registered after the final sweep
     */
    public int disconnectAll(final long now) {
        sweepExpired(now);
        final List<WorkerRecord> remaining = new ArrayList<>(registry.getWorkers());
        for (WorkerRecord worker : remaining) {
            if (worker.getId().getWorkerClass() == WorkerClass.ZMQ) {
                sender.test(MdpMessage.workerDisconnect(worker.getAddress()));
            }
            registry.remove(worker.getId());
        }
        registry.purgeIdleServices();
        if (!remaining.isEmpty()) {
            LOGGER.atInfo().addArgument(remaining.size()).log("disconnected {} remaining worker(s)");
        }
        return remaining.size();
    }
}
