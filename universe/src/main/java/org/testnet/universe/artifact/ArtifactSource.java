package org.testnet.universe.artifact;

import com.google.common.collect.ImmutableList;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Where the binaries of a deployment come from: a build of the local source tree, a release
 * tarball on disk, or a release published on a channel (edge, beta, stable) or under a
 * version tag (vX.Y.Z).
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
@ToString
public class ArtifactSource {

    private static final Pattern CHANNEL = Pattern.compile("edge|beta|stable|v.*");

    @Getter
    @NonNull
    private final Kind kind;

    /**
     * Build features of a local build.
     */
    @Getter
    @NonNull
    private final ImmutableList<String> features;

    private final Path customPrograms;

    private final Path tarball;

    private final String channel;

    public static ArtifactSource local(List<String> features, Path customPrograms) {
        return new ArtifactSource(Kind.LOCAL, ImmutableList.copyOf(features), customPrograms, null, null);
    }

    public static ArtifactSource local() {
        return local(ImmutableList.of(), null);
    }

    public static ArtifactSource tarball(@NonNull Path tarball) {
        return new ArtifactSource(Kind.TARBALL, ImmutableList.of(), null, tarball, null);
    }

    /**
     * A published release.
     *
     * @param channel edge, beta, stable or a version tag starting with "v"
     * @throws IllegalArgumentException if the channel is none of these
     */
    public static ArtifactSource channel(@NonNull String channel) {
        if (!isValidChannel(channel)) {
            throw new IllegalArgumentException("Invalid release channel: " + channel);
        }
        return new ArtifactSource(Kind.CHANNEL, ImmutableList.of(), null, null, channel);
    }

    public static boolean isValidChannel(String channel) {
        return channel != null && CHANNEL.matcher(channel).matches();
    }

    public Optional<Path> getCustomPrograms() {
        return Optional.ofNullable(customPrograms);
    }

    public Optional<Path> getTarball() {
        return Optional.ofNullable(tarball);
    }

    public Optional<String> getChannel() {
        return Optional.ofNullable(channel);
    }

    public DeployMethod getDeployMethod() {
        return kind == Kind.LOCAL ? DeployMethod.LOCAL : DeployMethod.TAR;
    }

    public enum Kind {
        LOCAL, TARBALL, CHANNEL
    }
}
