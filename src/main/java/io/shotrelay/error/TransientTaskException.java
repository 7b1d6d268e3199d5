package io.shotrelay.error;

/**
 * A capture or diff attempt failed in a way that is worth retrying.
 */
public class TransientTaskException extends ShotRelayException {

    public TransientTaskException(String message) {
        super(ErrorKind.TRANSIENT, message);
    }

    public TransientTaskException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT, message, cause);
    }
}
