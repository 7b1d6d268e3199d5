package io.shotrelay.testing;

import io.shotrelay.error.TransientTaskException;
import io.shotrelay.worker.CaptureEngine;
import io.shotrelay.worker.CaptureOutput;
import io.shotrelay.worker.CaptureSpec;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Renders a page as the bytes of {@code "png:" + url}, or as a fixed image set per URL.
 */
public final class FakeCaptureEngine implements CaptureEngine {
    private final Map<String, String> images = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> failuresLeft = new ConcurrentHashMap<>();
    private final List<CaptureSpec> captured = new CopyOnWriteArrayList<>();

    public FakeCaptureEngine render(String url, String image) {
        images.put(url, image);
        return this;
    }

    public FakeCaptureEngine failTimes(String url, int times) {
        failuresLeft.put(url, new AtomicInteger(times));
        return this;
    }

    public List<CaptureSpec> captured() {
        return captured;
    }

    @Override
    public CaptureOutput capture(CaptureSpec spec) {
        captured.add(spec);
        AtomicInteger left = failuresLeft.get(spec.url());
        if (left != null && left.getAndDecrement() > 0) {
            throw new TransientTaskException("page load timed out: " + spec.url());
        }
        String image = images.getOrDefault(spec.url(), "png:" + spec.url());
        return new CaptureOutput(image.getBytes(StandardCharsets.UTF_8), "captured " + spec.url());
    }
}
