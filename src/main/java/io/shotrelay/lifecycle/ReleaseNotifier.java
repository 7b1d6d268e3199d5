package io.shotrelay.lifecycle;

import io.shotrelay.model.ReleaseView;

/**
 * Told once per release when every run has been resolved and the release is marked complete.
 */
@FunctionalInterface
public interface ReleaseNotifier {
    void releaseCompleted(ReleaseView release);
}
