package io.mdbroker.server.domain;

import java.util.Objects;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.zeromq.util.ZData;

/**
 * Registry key of a worker: its {@link WorkerClass} combined with the raw transport identity, so that identities of
 * different worker classes cannot collide.
 *
 * <p>
 * {@code unwrap(wrap(class, rawId))} yields {@code (class, rawId)} for every rawId not containing {@link #SEPARATOR}.
 */
public final class WorkerId {
    public static final char SEPARATOR = '|';
    private final WorkerClass workerClass;
    private final String rawId;
    private final String wrapped;

    private WorkerId(final WorkerClass workerClass, final String rawId) {
        this.workerClass = Objects.requireNonNull(workerClass, "workerClass must not be null");
        this.rawId = Objects.requireNonNull(rawId, "rawId must not be null");
        this.wrapped = wrap(workerClass, rawId);
    }

    public static WorkerId of(@NotNull final WorkerClass workerClass, @NotNull final String rawId) {
        if (rawId.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("raw worker id must not contain '" + SEPARATOR + "': " + rawId);
        }
        return new WorkerId(workerClass, rawId);
    }

    /**
     * @param address ROUTER routing frame of a ZeroMQ worker
     * @return identity of the ZeroMQ-class worker using the hex form of the address as raw id
     */
    public static WorkerId ofAddress(@NotNull final byte[] address) {
        return new WorkerId(WorkerClass.ZMQ, ZData.strhex(address));
    }

    public static String wrap(@NotNull final WorkerClass workerClass, @NotNull final String rawId) {
        return workerClass.getTag() + SEPARATOR + rawId;
    }

    public static WorkerId unwrap(@NotNull final String wrapped) {
        final int split = wrapped.indexOf(SEPARATOR);
        if (split < 0) {
            throw new IllegalArgumentException("not a wrapped worker id: '" + wrapped + "'");
        }
        return new WorkerId(WorkerClass.fromTag(wrapped.substring(0, split)), wrapped.substring(split + 1));
    }

    public WorkerClass getWorkerClass() {
        return workerClass;
    }

    public String getRawId() {
        return rawId;
    }

    public String getWrapped() {
        return wrapped;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        } else if (!(o instanceof WorkerId)) {
            return false;
        }
        return wrapped.equals(((WorkerId) o).wrapped);
    }

    @Override
    public int hashCode() {
        return wrapped.hashCode();
    }

    @Override
    public String toString() {
        return StringUtils.abbreviate(wrapped, 64);
    }
}
