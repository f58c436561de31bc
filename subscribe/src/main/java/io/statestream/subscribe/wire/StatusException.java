package io.statestream.subscribe.wire;

import java.util.Objects;

/**
 * Terminal error of a subscribe call, carrying a status code the transport reports to the client.
 */
public class StatusException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Status codes reported to clients.
     */
    public enum Code {
        CANCELLED,
        UNKNOWN,
        PERMISSION_DENIED,
        /**
         * The subscription was invalidated on the server; the client must subscribe again from
         * scratch.
         */
        ABORTED,
        UNAVAILABLE
    }

    private final Code code;

    public StatusException(Code code, String description) {
        super(code + ": " + description);
        this.code = Objects.requireNonNull(code, "Code must not be null");
    }

    public StatusException(Code code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = Objects.requireNonNull(code, "Code must not be null");
    }

    public Code getCode() {
        return code;
    }
}
