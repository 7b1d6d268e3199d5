package io.shotrelay.error;

public class CoordinatorStoppedException extends ShotRelayException {

    public CoordinatorStoppedException(String message) {
        super(ErrorKind.COORDINATOR_STOPPED, message);
    }
}
