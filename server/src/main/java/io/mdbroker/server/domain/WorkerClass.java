package io.mdbroker.server.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * Worker class tag: selects how requests reach a worker.
 */
public enum WorkerClass {
    /** worker connected through the broker's ZeroMQ transport */
    ZMQ("zmq"),
    /** in-process worker reached through a host-supplied delivery function */
    INTERNAL("internal");

    private final String tag;

    WorkerClass(final String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static WorkerClass fromTag(final String tag) {
        final String lowerCaseTag = Objects.requireNonNull(tag, "tag must not be null").toLowerCase(Locale.UK);
        for (WorkerClass workerClass : values()) {
            if (workerClass.tag.equals(lowerCaseTag)) {
                return workerClass;
            }
        }
        throw new IllegalArgumentException("unknown worker class tag: '" + tag + "'");
    }
}
