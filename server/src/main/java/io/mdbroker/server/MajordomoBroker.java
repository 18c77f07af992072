package io.mdbroker.server;

import static java.nio.charset.StandardCharsets.UTF_8;

import static io.mdbroker.MdpProtocol.EMPTY_FRAME;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongFunction;
import java.util.function.LongSupplier;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zeromq.ZMsg;
import org.zeromq.util.ZData;

import io.mdbroker.MdpProtocol.MdpMessage;
import io.mdbroker.MdpProtocolException;
import io.mdbroker.server.domain.ClientRequest;
import io.mdbroker.server.domain.WorkerClass;
import io.mdbroker.server.domain.WorkerId;
import io.mdbroker.server.domain.WorkerRecord;

/**
 * Majordomo Protocol broker
 * A minimal implementation of <a href="https://rfc.zeromq.org/spec/7/">MDP/0.1</a>
 *
 * <p>
 * Clients send requests for a named service, workers announce themselves as READY for one service, the broker matches
 * requests with idle workers in arrival order and routes the worker's REPLY back to the originating client. Workers
 * that stop sending heart-beats for {@code heartbeat * heartbeatMult} seconds are evicted.
 * <p>
 * Differences to the RFC: a worker that has been handed a request leaves the pool and must send a new READY to
 * receive further work. Replies carry the service name the request has been dispatched for.
 * <p>
 * The ROUTER socket is used exclusively by the broker thread. Host-side calls (in-process workers and clients) are
 * queued and applied by the event loop; inspection methods may be called from any thread.
 * <p>
 * default heart-beat, time-out and endpoint settings are controlled via {@link BrokerConfig} and the 'mdp.*' JVM
 * properties documented in {@link io.mdbroker.MdpConstants}.
 */
@SuppressWarnings({ "PMD.TooManyMethods", "PMD.GodClass", "PMD.AvoidCatchingGenericException" })
public class MajordomoBroker extends Thread implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(MajordomoBroker.class);
    private static final AtomicInteger BROKER_COUNTER = new AtomicInteger();
    public static final int MAX_MESSAGES_PER_CYCLE = 1000;
    protected final BrokerConfig config;
    protected final BrokerTransport transport;
    protected final LongSupplier clock; // [ms]
    protected final ReentrantLock lock = new ReentrantLock();
    protected final WorkerRegistry registry;
    protected final LivenessMonitor liveness;
    protected final DispatchEngine dispatcher;
    protected final Queue<HostTask<?>> hostTasks = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean run = new AtomicBoolean(false); // NOPMD - nomen est omen
    private final AtomicBoolean running = new AtomicBoolean(false); // NOPMD - nomen est omen
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile URI boundEndpoint;

    /**
     * @param config broker settings, the ZeroMQ ROUTER transport is created from its linger and high-water mark
     */
    public MajordomoBroker(@NotNull final BrokerConfig config) {
        this(config, new ZmqRouterTransport(config.getLinger(), config.getHighWaterMark()));
    }

    public MajordomoBroker(@NotNull final BrokerConfig config, @NotNull final BrokerTransport transport) {
        this(config, transport, System::currentTimeMillis);
    }

    /**
     * @param config broker settings
     * @param transport the endpoint clients and workers connect to
     * @param clock [ms] time source used for all heart-beat and expiry computations
     */
    public MajordomoBroker(@NotNull final BrokerConfig config, @NotNull final BrokerTransport transport, @NotNull final LongSupplier clock) {
        super();
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        setName(MajordomoBroker.class.getSimpleName() + "#" + BROKER_COUNTER.getAndIncrement());
        registry = new WorkerRegistry(config.getTimeToLive());
        liveness = new LivenessMonitor(registry, this::send, config.getHeartbeatInterval());
        dispatcher = new DispatchEngine(registry, liveness, this::deliverToZmqWorker);
    }

    /**
     * Binds the broker to the configured address. Called implicitly by {@link #start()} if not done before.
     *
     * @return the resolved endpoint clients and workers may connect to
     * @throws MdpTransportException if the address cannot be bound
     */
    public synchronized URI bind() {
        if (boundEndpoint == null) {
            boundEndpoint = transport.bind(URI.create(config.getAddress()));
            LOGGER.atInfo().addArgument(getName()).addArgument(boundEndpoint).log("Majordomo broker/0.1 '{}' is active at '{}'");
        }
        return boundEndpoint;
    }

    @Override
    public synchronized void start() {
        if (closed.get()) {
            throw new IllegalStateException(getName() + " has already been closed");
        }
        bind();
        run.set(true);
        super.start();
    }

    /**
     * main broker work happens here
     */
    @Override
    public void run() {
        running.set(true);
        try {
            while (run.get() && !Thread.currentThread().isInterrupted()) {
                processCycle();
            }
        } finally {
            if (Thread.interrupted()) { // clears the flag, the final DISCONNECT messages still need the socket
                LOGGER.atInfo().addArgument(getName()).log("broker '{}' interrupted - shutting down");
            }
            shutdown();
            close();
            running.set(false);
        }
    }

    /**
     * Stop broker: signals the event loop to terminate and waits at most {@code pollInterval + heartbeat} for the
     * final DISCONNECT broadcast. The transport is left to the event loop if it did not terminate in time.
     */
    public void stopBroker() {
        run.set(false);
        if (isAlive() && Thread.currentThread() != this) {
            final long timeout = config.getPollInterval() + config.getHeartbeatInterval();
            try {
                this.join(timeout);
            } catch (InterruptedException e) { // NOPMD NOSONAR -- re-throwing with different type
                Thread.currentThread().interrupt();
                throw new IllegalStateException(this.getName() + " did not shut down in " + timeout + " ms", e);
            }
            if (isAlive()) {
                LOGGER.atWarn().addArgument(getName()).addArgument(timeout).log("broker '{}' did not terminate within {} ms");
                return;
            }
        }
        close();
    }

    /**
     * Sends the DISCONNECT broadcast and releases the transport. A running event loop is stopped via
     * {@link #stopBroker()} and performs both steps on its own thread.
     */
    @Override
    public void close() {
        if (isAlive() && Thread.currentThread() != this) {
            stopBroker();
            return;
        }
        shutdown();
        if (closed.compareAndSet(false, true)) {
            transport.close();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public URI getBoundEndpoint() {
        return boundEndpoint;
    }

    public BrokerConfig getConfig() {
        return config;
    }

    /**
     * Registers the hand-over path for requests assigned to workers of the given class, e.g. in-process
     * {@link WorkerClass#INTERNAL} workers.
     *
     * @param workerClass the worker class
     * @param delivery the delivery, invoked on the broker thread
     */
    public void registerDelivery(@NotNull final WorkerClass workerClass, @NotNull final WorkerDelivery delivery) {
        lock.lock();
        try {
            dispatcher.registerDelivery(workerClass, delivery);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Announces an in-process worker as ready for the given service.
     *
     * @param rawId worker identity, unique among internal workers, must not contain {@value WorkerId#SEPARATOR}
     * @param serviceName the service the worker is ready to serve
     * @return future completed with the worker identity once the worker has been registered
     */
    public CompletableFuture<WorkerId> registerInternalWorker(@NotNull final String rawId, @NotNull final String serviceName) {
        final WorkerId id = WorkerId.of(WorkerClass.INTERNAL, rawId);
        Objects.requireNonNull(serviceName, "serviceName must not be null");
        return submitHostTask(now -> {
            registry.registerReady(id, null, serviceName, now);
            LOGGER.atInfo().addArgument(id).addArgument(serviceName).log("registering worker '{}' for service '{}'");
            dispatcher.dispatch(serviceName, now);
            return id;
        });
    }

    /**
     * @param rawId identity of an in-process worker
     * @return future completed with {@code false} if the worker is unknown, {@code true} if its expiry has been extended
     */
    public CompletableFuture<Boolean> internalHeartbeat(@NotNull final String rawId) {
        final WorkerId id = WorkerId.of(WorkerClass.INTERNAL, rawId);
        return submitHostTask(now -> handleHeartbeat(id, now));
    }

    /**
     * @param rawId identity of an in-process worker
     * @return future completed with {@code false} if the worker is unknown, {@code true} if it has been removed
     */
    public CompletableFuture<Boolean> internalDisconnect(@NotNull final String rawId) {
        final WorkerId id = WorkerId.of(WorkerClass.INTERNAL, rawId);
        return submitHostTask(now -> handleDisconnect(id));
    }

    /**
     * Queues a request of an in-process client.
     *
     * @param serviceName the requested service
     * @param requester identity the reply will be routed to
     * @param body opaque request frames
     * @return future completed with the number of requests that could be handed to workers right away
     */
    public CompletableFuture<Integer> submitRequest(@NotNull final String serviceName, @NotNull final byte[] requester, final byte[]... body) {
        Objects.requireNonNull(serviceName, "serviceName must not be null");
        Objects.requireNonNull(requester, "requester must not be null");
        final List<byte[]> frames = List.of(body);
        return submitHostTask(now -> dispatcher.submitClientRequest(serviceName, requester, frames, now));
    }

    /**
     * @return identities of all registered (idle) workers, in registration order
     */
    public List<WorkerId> getWorkerIds() {
        lock.lock();
        try {
            final List<WorkerId> ids = new ArrayList<>(registry.getWorkers().size());
            registry.getWorkers().forEach(worker -> ids.add(worker.getId()));
            return ids;
        } finally {
            lock.unlock();
        }
    }

    public int getPendingRequests(final String serviceName) {
        lock.lock();
        try {
            return registry.pendingRequests(serviceName);
        } finally {
            lock.unlock();
        }
    }

    public List<WorkerId> getAvailableWorkers(final String serviceName) {
        lock.lock();
        try {
            return registry.availableWorkers(serviceName);
        } finally {
            lock.unlock();
        }
    }

    public List<String> getServiceNames() {
        lock.lock();
        try {
            final List<String> names = new ArrayList<>(registry.getServices().size());
            registry.getServices().forEach(service -> names.add(service.getName()));
            return names;
        } finally {
            lock.unlock();
        }
    }

    /**
     * One event-loop iteration: waits at most one poll interval for inbound traffic, emits due heart-beats, applies
     * queued host-side calls and processes the received messages.
     * <p>
     * Transport failures are logged and the cycle carries on, unless the transport has been closed.
     *
     * @return number of processed inbound messages
     */
    protected int processCycle() {
        boolean pending = false;
        try {
            pending = transport.poll(config.getPollInterval());
        } catch (MdpTransportException e) {
            if (!handleTransportFailure(e)) {
                return 0;
            }
            LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(config.getPollInterval()));
        }
        lock.lock();
        try {
            final long now = clock.getAsLong();
            liveness.sendHeartbeats(now);
            for (HostTask<?> task = hostTasks.poll(); task != null; task = hostTasks.poll()) {
                task.execute(now);
            }
        } finally {
            lock.unlock();
        }
        int handled = 0;
        while (pending && handled < MAX_MESSAGES_PER_CYCLE) {
            final ZMsg msg;
            try {
                msg = transport.receive();
            } catch (MdpTransportException e) {
                handleTransportFailure(e);
                break;
            }
            if (msg == null) {
                break;
            }
            handleReceivedMessage(msg);
            handled++;
        }
        return handled;
    }

    /**
     * Handle received message.
     *
     * @param msg the raw multipart message including the sender's routing ID
     * @return {@code true} if the message was valid and has been processed
     */
    protected boolean handleReceivedMessage(@NotNull final ZMsg msg) {
        final MdpMessage message;
        try {
            message = MdpMessage.decode(msg, true);
        } catch (MdpProtocolException e) {
            logInvalidMessage(e);
            return false;
        }
        logMessage("received", message);

        lock.lock();
        try {
            final long now = clock.getAsLong();
            switch (message.protocol) {
            case PROT_CLIENT:
                dispatcher.submitClientRequest(message.getServiceName(), message.senderID, message.body, now);
                return true;
            case PROT_WORKER:
                return processWorker(message, now);
            default:
                return false;
            }
        } catch (RuntimeException e) { // NOPMD -- one failing message must not end the event loop
            LOGGER.atError().setCause(e).addArgument(message).log("could not process message {}");
            return false;
        } finally {
            lock.unlock();
        }
    }

    protected boolean processWorker(final MdpMessage msg, final long now) {
        final WorkerId workerId = WorkerId.ofAddress(msg.senderID);
        switch (msg.command) {
        case READY:
            final String serviceName = msg.getServiceName();
            registry.registerReady(workerId, msg.senderID, serviceName, now);
            LOGGER.atInfo().addArgument(workerId).addArgument(serviceName).log("registering worker '{}' for service '{}'");
            dispatcher.dispatch(serviceName, now);
            return true;
        case REPLY:
            final String assignedService = dispatcher.completeAssignment(workerId);
            if (assignedService == null && LOGGER.isDebugEnabled()) {
                LOGGER.atDebug().addArgument(workerId).log("reply from worker '{}' without outstanding request - forwarding with empty service frame");
            }
            send(MdpMessage.clientReply(msg.clientID, assignedService == null ? EMPTY_FRAME : assignedService.getBytes(UTF_8), msg.body));
            return true;
        case HEARTBEAT:
            return handleHeartbeat(workerId, now);
        case DISCONNECT:
            return handleDisconnect(workerId);
        default:
            if (LOGGER.isDebugEnabled()) {
                LOGGER.atDebug().addArgument(msg.command).addArgument(workerId).log("dropping unsupported command '{}' from worker '{}'");
            }
            return false;
        }
    }

    /**
     * Sends DISCONNECT to all remaining workers and empties the registry. Pending host-side calls fail. Runs once.
     */
    protected void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        lock.lock();
        try {
            liveness.disconnectAll(clock.getAsLong());
            for (HostTask<?> task = hostTasks.poll(); task != null; task = hostTasks.poll()) {
                task.abort(getName() + " has been shut down");
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @param message the message to send, its sender ID is the recipient's routing ID
     * @return {@code false} if the transport refused the message
     */
    protected boolean send(final MdpMessage message) {
        logMessage("sending", message);
        try {
            transport.send(message.toZMsg(true));
            return true;
        } catch (MdpTransportException e) {
            LOGGER.atWarn().setCause(e).addArgument(message.command).addArgument(ZData.strhex(message.senderID)).log("could not send {} to '{}'");
            return false;
        }
    }

    protected void deliverToZmqWorker(final WorkerRecord worker, final ClientRequest request) {
        final MdpMessage message = MdpMessage.workerRequest(worker.getAddress(), request.getRequester(), request.getBody());
        logMessage("sending", message);
        transport.send(message.toZMsg(true));
    }

    /**
     * @return {@code false} if the transport has been closed and the event loop has been told to stop
     */
    private boolean handleTransportFailure(final MdpTransportException e) {
        if (transport.isClosed()) {
            LOGGER.atError().setCause(e).addArgument(getName()).log("broker '{}' transport has been closed - stopping event loop");
            run.set(false);
            return false;
        }
        LOGGER.atError().setCause(e).addArgument(getName()).log("broker '{}' transport failure - continuing with next cycle");
        return true;
    }

    private boolean handleHeartbeat(final WorkerId workerId, final long now) {
        if (registry.recordHeartbeat(workerId, now)) {
            return true;
        }
        LOGGER.atWarn().addArgument(workerId).log("heart-beat from unknown worker '{}' - ignored");
        return false;
    }

    private boolean handleDisconnect(final WorkerId workerId) {
        dispatcher.completeAssignment(workerId);
        final WorkerRecord worker = registry.remove(workerId);
        if (worker == null) {
            LOGGER.atWarn().addArgument(workerId).log("disconnect from unknown worker '{}' - ignored");
            return false;
        }
        LOGGER.atInfo().addArgument(workerId).addArgument(worker.getServiceName()).log("worker '{}' of service '{}' disconnected");
        return true;
    }

    private void logInvalidMessage(final MdpProtocolException e) {
        if (e.getReason() == MdpProtocolException.Reason.UNKNOWN_ORIGINATOR) {
            LOGGER.atWarn().addArgument(e.getMessage()).log("dropping message from unknown originator: {}");
        } else if (LOGGER.isDebugEnabled()) {
            LOGGER.atDebug().addArgument(e.getReason()).addArgument(e.getMessage()).log("dropping invalid message ({}): {}");
        }
    }

    private void logMessage(final String direction, final MdpMessage message) {
        if (config.isLogDetails()) {
            LOGGER.atInfo().addArgument(direction).addArgument(message).log("{} {}");
        } else if (LOGGER.isTraceEnabled()) {
            LOGGER.atTrace().addArgument(direction).addArgument(message).log("{} {}");
        }
    }

    private <R> CompletableFuture<R> submitHostTask(final LongFunction<R> action) {
        final HostTask<R> task = new HostTask<>(action);
        lock.lock(); // shutdown() drains the queue under the same lock
        try {
            if (shutdown.get()) {
                task.abort(getName() + " has been shut down");
            } else {
                hostTasks.add(task);
            }
        } finally {
            lock.unlock();
        }
        return task.result;
    }

    /**
     * A host-side call executed on the broker thread.
     *
     * @param <R> result type
     */
    protected static class HostTask<R> {
        protected final LongFunction<R> action;
        protected final CompletableFuture<R> result = new CompletableFuture<>();

        protected HostTask(final LongFunction<R> action) {
            this.action = action;
        }

        protected void execute(final long now) {
            try {
                result.complete(action.apply(now));
            } catch (RuntimeException e) { // NOPMD -- handed to the caller via the future
                result.completeExceptionally(e);
            }
        }

        protected void abort(final String reason) {
            result.completeExceptionally(new IllegalStateException(reason));
        }
    }
}
