package org.testnet.universe.artifact;

import lombok.extern.slf4j.Slf4j;
import org.testnet.universe.remote.RemoteHost;
import org.testnet.universe.remote.RemoteHost.RemoteDirectory;

/**
 * Pushes resolved artifacts to a node's host.
 * <p>
 * Support files go to every node. Binaries only go to the bootstrap leader; other nodes fetch
 * them from the leader when their launcher runs, which keeps the controlling host's uplink out
 * of the fan-out.
 */
@Slf4j
public class ArtifactDistributor {

    public void distribute(RemoteHost host, Artifacts artifacts, boolean includeBinaries) {
        log.debug("Push {} support files to {}", artifacts.getSupportFiles().size(), host.getHost());
        host.transfer(artifacts.getSupportFiles(), RemoteDirectory.PROJECT);

        if (includeBinaries) {
            log.debug("Push {} binaries to {}", artifacts.getBinaries().size(), host.getHost());
            host.transfer(artifacts.getBinaries(), RemoteDirectory.BIN);
        }
    }
}
