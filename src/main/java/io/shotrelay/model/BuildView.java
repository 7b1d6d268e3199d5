package io.shotrelay.model;

public record BuildView(
        long id,
        String name,
        boolean isPublic,
        long createdAtMs
) {
}
