package io.mdbroker;

import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.SocketException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Majordomo broker global constant definitions.
 *
 * <p>
 * The broker is controlled by the following JVM properties (keys are matched ignoring case):
 * <ul>
 * <li>'mdp.address': default ('tcp://*:47047') endpoint the broker binds to</li>
 * <li>'mdp.pollInterval' [ms]: default (100 ms) bounded wait of one poll/heart-beat cycle</li>
 * <li>'mdp.heartBeat' [s]: default (3 s) interval between heart-beats sent to each idle worker</li>
 * <li>'mdp.heartBeatMult' []: default (2) multiplier applied to the heart-beat interval to compute the worker time-to-live
 * <small>N.B. a worker expires when its last heart-beat was received more than 'heartBeat' * 'heartBeatMult' s ago.</small></li>
 * <li>'mdp.logDetails' []: default (false) log every received and sent message at info level</li>
 * <li>'mdp.linger' [ms]: default (0) time pending messages are kept after the socket is closed</li>
 * <li>'mdp.highWaterMark' []: default (0, i.e. unbounded) number of message frames queued per socket before dropping</li>
 * </ul>
 */
public final class MdpConstants {
    private static final Logger LOGGER = LoggerFactory.getLogger(MdpConstants.class);
    public static final String WILDCARD = "*";
    public static final String SCHEME_INPROC = "inproc";
    public static final String SCHEME_MDP = "mdp";
    public static final String SCHEME_TCP = "tcp";
    public static final String ADDRESS_GIVEN = "address given: ";

    public static final String ADDRESS = "mdp.address";
    public static final String ADDRESS_DEFAULT = "tcp://*:47047";
    public static final String POLL_INTERVAL = "mdp.pollInterval";
    public static final long POLL_INTERVAL_DEFAULT = 100; // [ms]
    public static final String HEARTBEAT = "mdp.heartBeat";
    public static final int HEARTBEAT_DEFAULT = 3; // [s]
    public static final String HEARTBEAT_MULT = "mdp.heartBeatMult";
    public static final int HEARTBEAT_MULT_DEFAULT = 2; // [counts]
    public static final String LOG_DETAILS = "mdp.logDetails";
    public static final boolean LOG_DETAILS_DEFAULT = false;
    public static final String LINGER = "mdp.linger";
    public static final int LINGER_DEFAULT = 0; // [ms]
    public static final String HIGH_WATER_MARK = "mdp.highWaterMark";
    public static final int HIGH_WATER_MARK_DEFAULT = 0; // [frames], '0' -> limited only by memory

    private MdpConstants() {
        // utility class
    }

    public static String getLocalHostName() {
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.connect(InetAddress.getByName("8.8.8.8"), 10_002); // NOPMD - bogus hardcoded IP acceptable in this context
            final InetAddress localAddress = socket.getLocalAddress();
            if (localAddress == null || localAddress.isAnyLocalAddress()) {
                throw new UnknownHostException("no routable local address");
            }
            return localAddress.getHostAddress();
        } catch (final SocketException | UnknownHostException e) {
            LOGGER.atDebug().setCause(e).log("cannot resolve own host IP address - falling back to 'localhost'");
            return "localhost";
        }
    }

    /**
     * @param address endpoint, e.g. 'mdp://*:47047'
     * @param schemeReplacement new scheme, e.g. 'tcp'
     * @return the endpoint with replaced scheme ('inproc' endpoints are returned unchanged, '*' wildcards are kept)
     */
    public static URI replaceScheme(final @NotNull URI address, final @NotNull String schemeReplacement) {
        if (address.getScheme() == null) {
            throw new IllegalArgumentException(ADDRESS_GIVEN + address);
        }
        if (address.getScheme().toLowerCase(Locale.UK).equals(SCHEME_INPROC)) {
            return address;
        }
        return URI.create(schemeReplacement + address.toString().substring(address.getScheme().length()));
    }

    public static URI resolveHost(final @NotNull URI address, final @NotNull String hostName) {
        if ((address.getScheme() != null && address.getScheme().toLowerCase(Locale.UK).equals(SCHEME_INPROC)) || address.getAuthority() == null || !address.getAuthority().contains(WILDCARD)) {
            return address;
        }
        try {
            final String[] splitAuthority = StringUtils.split(address.getAuthority(), ":");
            final int port = splitAuthority.length >= 2 ? Integer.parseInt(splitAuthority[1]) : address.getPort();
            return new URI(address.getScheme(), null, hostName, port, address.getPath(), address.getQuery(), null);
        } catch (URISyntaxException | NumberFormatException e) {
            throw new IllegalArgumentException(ADDRESS_GIVEN + address, e);
        }
    }
}
