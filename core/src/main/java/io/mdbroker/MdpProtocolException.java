package io.mdbroker;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a multipart message cannot be decoded into a valid Majordomo message.
 * Only the offending message is affected; callers are expected to log and drop it.
 */
public class MdpProtocolException extends IllegalArgumentException {
    private static final long serialVersionUID = -4212781326573046712L;

    /**
     * Kind of decode failure
     */
    public enum Reason {
        /** the protocol frame is neither the client nor the worker tag */
        UNKNOWN_ORIGINATOR,
        /** worker message with an unknown or, for this direction, unsupported command */
        UNKNOWN_COMMAND,
        /** missing frames or missing empty delimiter */
        MALFORMED
    }

    private final Reason reason;

    public MdpProtocolException(@NotNull final Reason reason, final String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "MdpProtocolException{" + reason + ": " + getMessage() + '}';
    }
}
