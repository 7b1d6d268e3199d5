package io.shotrelay.error;

/**
 * The request clashes with existing state, e.g. a duplicate build name. Nothing was mutated.
 */
public class ConflictException extends ShotRelayException {
    private final Long existingId;

    public ConflictException(String message) {
        this(message, null);
    }

    public ConflictException(String message, Long existingId) {
        super(ErrorKind.CONFLICT, message);
        this.existingId = existingId;
    }

    public Long existingId() {
        return existingId;
    }
}
