package io.shotrelay.worker;

import io.shotrelay.error.TransientTaskException;

public interface DiffEngine {
    DiffOutput diff(byte[] before, byte[] after) throws TransientTaskException;
}
