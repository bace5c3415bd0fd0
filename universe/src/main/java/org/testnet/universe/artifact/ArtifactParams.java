package org.testnet.universe.artifact;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Local paths and commands used to produce the artifacts of a run. Relative paths are resolved
 * against {@link #projectRoot}.
 */
@Builder(toBuilder = true)
@Getter
@ToString
public class ArtifactParams {

    @Default
    @NonNull
    private final Path projectRoot = Paths.get(".");

    /**
     * Build command of a local build. The feature list is appended as a single argument.
     */
    @Default
    @NonNull
    private final ImmutableList<String> buildCommand = ImmutableList.of("scripts/cargo-install-all.sh", "farf");

    /**
     * Installs custom programs into the build output. The program directory is appended.
     */
    @Default
    @NonNull
    private final ImmutableList<String> customProgramsCommand =
            ImmutableList.of("scripts/cargo-install-custom-programs.sh", "farf");

    /**
     * Output directory of a local build, removed before every build.
     */
    @Default
    @NonNull
    private final String buildOutputDir = "farf";

    @Default
    @NonNull
    private final String buildBinDir = "farf/bin";

    @Default
    @NonNull
    private final String releaseDir = "solana-release";

    @Default
    @NonNull
    private final String releaseBinDir = "solana-release/bin";

    @Default
    @NonNull
    private final String releaseTarball = "solana-release.tar.bz2";

    /**
     * Download url of a release, with a {@code %s} placeholder for the channel or tag.
     */
    @Default
    @NonNull
    private final String releaseUrlTemplate =
            "http://solana-release.s3.amazonaws.com/%s/solana-release-x86_64-unknown-linux-gnu.tar.bz2";

    /**
     * Files and directories every node needs next to the binaries.
     */
    @Default
    @NonNull
    private final ImmutableList<String> supportFiles =
            ImmutableList.of("fetch-perf-libs.sh", "scripts", "net", "multinode-demo");

    @Default
    @NonNull
    private final Duration buildTimeout = Duration.ofHours(1);

    @Default
    @NonNull
    private final Duration downloadTimeout = Duration.ofMinutes(10);

    public Path resolve(String path) {
        return projectRoot.resolve(path);
    }
}
