package org.testnet.universe.artifact;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.testnet.universe.remote.CommandResult;
import org.testnet.universe.remote.CommandRunner;
import org.testnet.universe.remote.RemoteException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns an {@link ArtifactSource} into {@link Artifacts}: builds the local tree, or unpacks a
 * release tarball after optionally downloading it.
 * <p>
 * Resolution happens once per run, before any node is touched. Every failure is reported as
 * an {@link ArtifactException}.
 */
@Slf4j
@Builder
public class ArtifactResolver {

    static final String VERSION_FILE = "version.yml";
    static final String VERSION_PREFIX = "version: ";
    static final String TAR_UNKNOWN = "tar-unknown";
    static final String LOCAL_UNKNOWN = "local-unknown";

    private static final Duration SHORT_COMMAND_TIMEOUT = Duration.ofMinutes(1);

    @NonNull
    private final ArtifactParams params;

    @NonNull
    private final CommandRunner commandRunner;

    @NonNull
    private final ReleaseDownloader downloader;

    public Artifacts resolve(@NonNull ArtifactSource source) {
        log.info("Resolve artifacts: {}", source);
        Stopwatch stopwatch = Stopwatch.createStarted();

        Artifacts artifacts;
        switch (source.getKind()) {
            case LOCAL:
                artifacts = build(source);
                break;
            case TARBALL:
                artifacts = unpack(source.getTarball().orElseThrow(IllegalStateException::new));
                break;
            case CHANNEL:
                artifacts = unpack(download(source.getChannel().orElseThrow(IllegalStateException::new)));
                break;
            default:
                throw new IllegalStateException("Unknown artifact source: " + source.getKind());
        }

        log.info("Artifacts ready in {}: version {}", stopwatch, artifacts.getVersion());
        return artifacts;
    }

    private Artifacts build(ArtifactSource source) {
        run(ImmutableList.of("rm", "-rf", params.getBuildOutputDir()), SHORT_COMMAND_TIMEOUT);

        ImmutableList<String> build = ImmutableList.<String>builder()
                .addAll(params.getBuildCommand())
                .add(String.join(",", source.getFeatures()))
                .build();
        run(build, params.getBuildTimeout());

        source.getCustomPrograms().ifPresent(programs -> {
            ImmutableList<String> install = ImmutableList.<String>builder()
                    .addAll(params.getCustomProgramsCommand())
                    .add(programs.toString())
                    .build();
            run(install, params.getBuildTimeout());
        });

        return assemble(DeployMethod.LOCAL, params.getBuildBinDir(), sourceRevision());
    }

    private Path download(String channel) {
        Path target = params.resolve(params.getReleaseTarball());
        downloader.download(String.format(params.getReleaseUrlTemplate(), channel), target, params.getDownloadTimeout());
        return target;
    }

    private Artifacts unpack(Path tarball) {
        if (!Files.isReadable(tarball)) {
            throw new ArtifactException("File not readable: " + tarball);
        }

        run(ImmutableList.of("rm", "-rf", params.getReleaseDir()), SHORT_COMMAND_TIMEOUT);
        run(ImmutableList.of("tar", "jxf", tarball.toAbsolutePath().toString()), params.getBuildTimeout());

        return assemble(DeployMethod.TAR, params.getReleaseBinDir(), releaseVersion());
    }

    private Artifacts assemble(DeployMethod method, String binDir, String version) {
        return Artifacts.builder()
                .deployMethod(method)
                .binaries(listBinaries(params.resolve(binDir)))
                .supportFiles(supportFiles())
                .version(version)
                .build();
    }

    private List<Path> listBinaries(Path binDir) {
        if (!Files.isDirectory(binDir)) {
            throw new ArtifactException("Binary directory not found: " + binDir);
        }

        try (Stream<Path> files = Files.list(binDir)) {
            List<Path> binaries = files.sorted().collect(Collectors.toList());
            if (binaries.isEmpty()) {
                throw new ArtifactException("No binaries in: " + binDir);
            }
            return binaries;
        } catch (IOException e) {
            throw new ArtifactException("Can't list binaries in: " + binDir, e);
        }
    }

    private List<Path> supportFiles() {
        List<Path> files = params.getSupportFiles().stream()
                .map(params::resolve)
                .collect(Collectors.toList());

        files.stream()
                .filter(Files::notExists)
                .findFirst()
                .ifPresent(missing -> {
                    throw new ArtifactException("Support file not found: " + missing);
                });
        return files;
    }

    private String releaseVersion() {
        Path versionFile = params.resolve(params.getReleaseDir()).resolve(VERSION_FILE);
        try (Stream<String> lines = Files.lines(versionFile, StandardCharsets.UTF_8)) {
            return lines.filter(line -> line.startsWith(VERSION_PREFIX))
                    .map(line -> line.substring(VERSION_PREFIX.length()).trim())
                    .findFirst()
                    .orElse(TAR_UNKNOWN);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Can't read release version from {}", versionFile, e);
            return TAR_UNKNOWN;
        }
    }

    private String sourceRevision() {
        try {
            CommandResult result = commandRunner.run(
                    ImmutableList.of("git", "rev-parse", "HEAD"),
                    ImmutableMap.of(),
                    params.getProjectRoot(),
                    SHORT_COMMAND_TIMEOUT
            );
            return Optional.of(result)
                    .filter(CommandResult::isSuccess)
                    .map(CommandResult::getOutput)
                    .filter(output -> !output.isEmpty())
                    .orElse(LOCAL_UNKNOWN);
        } catch (RemoteException e) {
            log.warn("Can't determine the source revision", e);
            return LOCAL_UNKNOWN;
        }
    }

    private void run(List<String> command, Duration timeout) {
        try {
            CommandResult result = commandRunner.run(command, ImmutableMap.of(), params.getProjectRoot(), timeout);
            if (!result.isSuccess()) {
                throw new ArtifactException("Command failed with exit code " + result.getExitCode() + ": "
                        + String.join(" ", command) + System.lineSeparator() + result.getOutput());
            }
        } catch (RemoteException e) {
            throw new ArtifactException("Can't run: " + String.join(" ", command), e);
        }
    }
}
