package io.mdbroker.server;

/**
 * Thrown when the broker endpoint cannot be bound or when a message cannot be handed to the transport (e.g. the
 * recipient's routing ID is no longer connected).
 */
public class MdpTransportException extends IllegalStateException {
    private static final long serialVersionUID = 6187335921484063305L;

    public MdpTransportException(final String message) {
        super(message);
    }

    public MdpTransportException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
