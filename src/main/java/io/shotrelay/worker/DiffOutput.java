package io.shotrelay.worker;

/**
 * Result of comparing two screenshots. {@code diffImage} is {@code null} when the images show no
 * perceptual difference.
 */
public record DiffOutput(
        byte[] diffImage,
        String log
) {
    public boolean identical() {
        return diffImage == null;
    }
}
