package io.shotrelay.error;

/**
 * Bad or missing input, rejected before any state change.
 */
public class ValidationException extends ShotRelayException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
