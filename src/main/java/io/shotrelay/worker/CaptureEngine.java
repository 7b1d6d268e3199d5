package io.shotrelay.worker;

import io.shotrelay.error.TransientTaskException;

public interface CaptureEngine {
    CaptureOutput capture(CaptureSpec spec) throws TransientTaskException;
}
