package org.testnet.universe.artifact;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Fetches a published release to a local file.
 */
@FunctionalInterface
public interface ReleaseDownloader {

    /**
     * @throws ArtifactException if the release can't be fetched completely
     */
    void download(String url, Path target, Duration timeout);
}
