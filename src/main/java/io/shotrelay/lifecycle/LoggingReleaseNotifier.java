package io.shotrelay.lifecycle;

import io.shotrelay.model.ReleaseView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingReleaseNotifier implements ReleaseNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingReleaseNotifier.class);

    @Override
    public void releaseCompleted(ReleaseView release) {
        log.info("Release ready for review: build_id={}, release_name={}, release_number={}, release_id={}",
                release.buildId(), release.name(), release.number(), release.id());
    }
}
