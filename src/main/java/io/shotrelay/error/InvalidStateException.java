package io.shotrelay.error;

/**
 * A transition was requested from a status that does not allow it, e.g. completing a canceled task.
 */
public class InvalidStateException extends ShotRelayException {

    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }
}
