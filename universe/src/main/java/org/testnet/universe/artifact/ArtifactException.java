package org.testnet.universe.artifact;

import org.testnet.universe.universe.UniverseException;

/**
 * The deployable binaries could not be produced: the build failed, the tarball is unreadable
 * or the release download failed. Raised before any node is touched.
 */
public class ArtifactException extends UniverseException {

    public ArtifactException(String message) {
        super(message);
    }

    public ArtifactException(String message, Throwable cause) {
        super(message, cause);
    }
}
