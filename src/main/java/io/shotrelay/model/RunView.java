package io.shotrelay.model;

/**
 * One named capture inside a release candidate.
 *
 * <p>{@code image}, {@code log}, {@code config} and the {@code diff*} fields are artifact hashes.
 * The {@code ref*} fields hold the baseline linkage copied when the run was created.
 */
public record RunView(
        long id,
        long releaseId,
        String name,
        String url,
        RunStatus status,
        String image,
        String log,
        String config,
        String diffImage,
        String diffLog,
        String refUrl,
        String refImage,
        String refLog,
        String refConfig,
        boolean baselinePending,
        long createdAtMs,
        long updatedAtMs
) {
    public boolean hasBaseline() {
        return refImage != null || baselinePending;
    }
}
