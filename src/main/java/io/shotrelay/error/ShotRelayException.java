package io.shotrelay.error;

/**
 * Base type for failures the lifecycle and coordination layers surface to callers.
 *
 * <p>Unchecked, like the rest of the code base; each subtype pins its {@link ErrorKind} so
 * handlers can translate a caught exception into a handler result without instanceof chains.
 */
public abstract class ShotRelayException extends RuntimeException {
    private final ErrorKind kind;

    protected ShotRelayException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ShotRelayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
