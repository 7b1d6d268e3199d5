package io.shotrelay.model;

public record ReleaseView(
        long id,
        long buildId,
        String name,
        int number,
        String url,
        ReleaseStatus status,
        long createdAtMs,
        long updatedAtMs,
        Long completedAtMs
) {
    public boolean completed() {
        return completedAtMs != null;
    }
}
