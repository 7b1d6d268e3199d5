package io.shotrelay.error;

public class NotFoundException extends ShotRelayException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
