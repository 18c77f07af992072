package io.mdbroker.server;

import static io.mdbroker.MdpConstants.ADDRESS;
import static io.mdbroker.MdpConstants.ADDRESS_DEFAULT;
import static io.mdbroker.MdpConstants.HEARTBEAT;
import static io.mdbroker.MdpConstants.HEARTBEAT_DEFAULT;
import static io.mdbroker.MdpConstants.HEARTBEAT_MULT;
import static io.mdbroker.MdpConstants.HEARTBEAT_MULT_DEFAULT;
import static io.mdbroker.MdpConstants.HIGH_WATER_MARK;
import static io.mdbroker.MdpConstants.HIGH_WATER_MARK_DEFAULT;
import static io.mdbroker.MdpConstants.LINGER;
import static io.mdbroker.MdpConstants.LINGER_DEFAULT;
import static io.mdbroker.MdpConstants.LOG_DETAILS;
import static io.mdbroker.MdpConstants.LOG_DETAILS_DEFAULT;
import static io.mdbroker.MdpConstants.POLL_INTERVAL;
import static io.mdbroker.MdpConstants.POLL_INTERVAL_DEFAULT;

import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.StringUtils;

import io.mdbroker.utils.SystemProperties;

/**
 * Broker settings. Initialised from the 'mdp.*' JVM properties (see {@link io.mdbroker.MdpConstants}), falling back
 * to the built-in defaults. All setters validate and return {@code this} for chaining.
 */
public class BrokerConfig {
    private String address = SystemProperties.getValueIgnoreCase(ADDRESS, ADDRESS_DEFAULT);
    private long pollInterval = SystemProperties.getValueIgnoreCase(POLL_INTERVAL, POLL_INTERVAL_DEFAULT); // [ms]
    private int heartbeat = SystemProperties.getValueIgnoreCase(HEARTBEAT, HEARTBEAT_DEFAULT); // [s]
    private int heartbeatMult = SystemProperties.getValueIgnoreCase(HEARTBEAT_MULT, HEARTBEAT_MULT_DEFAULT);
    private boolean logDetails = SystemProperties.getValueIgnoreCase(LOG_DETAILS, LOG_DETAILS_DEFAULT);
    private int linger = SystemProperties.getValueIgnoreCase(LINGER, LINGER_DEFAULT); // [ms]
    private int highWaterMark = SystemProperties.getValueIgnoreCase(HIGH_WATER_MARK, HIGH_WATER_MARK_DEFAULT);

    public String getAddress() {
        return address;
    }

    public BrokerConfig setAddress(final String address) {
        if (StringUtils.isBlank(address)) {
            throw new IllegalArgumentException("address must not be blank");
        }
        this.address = address.trim();
        return this;
    }

    /**
     * @return [ms] bounded wait of one event-loop cycle
     */
    public long getPollInterval() {
        return pollInterval;
    }

    public BrokerConfig setPollInterval(final long pollInterval) {
        if (pollInterval <= 0) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        this.pollInterval = pollInterval;
        return this;
    }

    /**
     * @return [s] interval between heart-beats sent to idle workers
     */
    public int getHeartbeat() {
        return heartbeat;
    }

    public BrokerConfig setHeartbeat(final int heartbeat) {
        if (heartbeat <= 0) {
            throw new IllegalArgumentException("heartbeat must be positive: " + heartbeat);
        }
        this.heartbeat = heartbeat;
        return this;
    }

    public int getHeartbeatMult() {
        return heartbeatMult;
    }

    public BrokerConfig setHeartbeatMult(final int heartbeatMult) {
        if (heartbeatMult <= 0) {
            throw new IllegalArgumentException("heartbeatMult must be positive: " + heartbeatMult);
        }
        this.heartbeatMult = heartbeatMult;
        return this;
    }

    public boolean isLogDetails() {
        return logDetails;
    }

    public BrokerConfig setLogDetails(final boolean logDetails) {
        this.logDetails = logDetails;
        return this;
    }

    public int getLinger() {
        return linger;
    }

    public BrokerConfig setLinger(final int linger) {
        if (linger < -1) {
            throw new IllegalArgumentException("linger must be -1 (infinite) or non-negative: " + linger);
        }
        this.linger = linger;
        return this;
    }

    public int getHighWaterMark() {
        return highWaterMark;
    }

    public BrokerConfig setHighWaterMark(final int highWaterMark) {
        if (highWaterMark < 0) {
            throw new IllegalArgumentException("highWaterMark must not be negative: " + highWaterMark);
        }
        this.highWaterMark = highWaterMark;
        return this;
    }

    /**
     * @return [ms] heart-beat interval
     */
    public long getHeartbeatInterval() {
        return TimeUnit.SECONDS.toMillis(heartbeat);
    }

    /**
     * @return [ms] time after the last received heart-beat after which a worker is presumed dead
     */
    public long getTimeToLive() {
        return getHeartbeatInterval() * heartbeatMult;
    }

    @Override
    public String toString() {
        return "BrokerConfig{address='" + address + "', pollInterval=" + pollInterval + ", heartbeat=" + heartbeat + ", heartbeatMult=" + heartbeatMult
                + ", logDetails=" + logDetails + ", linger=" + linger + ", highWaterMark=" + highWaterMark + '}';
    }
}
