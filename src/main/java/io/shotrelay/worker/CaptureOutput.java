package io.shotrelay.worker;

public record CaptureOutput(
        byte[] image,
        String log
) {
}
