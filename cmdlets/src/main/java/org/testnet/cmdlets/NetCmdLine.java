package org.testnet.cmdlets;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.docopt.Docopt;
import org.testnet.universe.artifact.ArtifactSource;
import org.testnet.universe.sanity.SanityOptions;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Command line of the net tool.
 */
@Slf4j
@ToString
public class NetCmdLine {

    /**
     * This string defines the command line arguments,
     * in the docopt DSL (see http://docopt.org) for the executable.
     * It also serves as the documentation for the executable.
     *
     * <p>Note that the java implementation of docopt has a strange requirement
     * that each option must be preceded with a space.
     */
    public static final String USAGE =
            "Operate a configured testnet.\n"
                    + "\n"
                    + "Usage:\n"
                    + "\tnet (start|stop|restart|sanity|update|logs) [-c <config>] [-T <tarball>|-t <channel>] "
                    + "[-f <features>] [-r] [-D <programs>] [-o <option>]...\n"
                    + "\tnet (-h|--help)\n"
                    + "\n"
                    + "Commands:\n"
                    + " start      Start the network\n"
                    + " sanity     Sanity check the network\n"
                    + " stop       Stop the network\n"
                    + " restart    Shortcut for stop then start\n"
                    + " update     Live update all network nodes\n"
                    + " logs       Fetch remote logs from each network node\n"
                    + "\n"
                    + "Options:\n"
                    + " -c <config>, --config=<config>         Testnet configuration file "
                    + "[default: net/config/config.json].\n"
                    + " -T <tarball>, --tarball=<tarball>      Deploy the specified release tarball.\n"
                    + " -t <channel>, --channel=<channel>      Deploy the latest tarball release for the "
                    + "release channel (edge|beta|stable) or release tag (vX.Y.Z).\n"
                    + " -f <features>, --features=<features>   Comma separated build features to activate.\n"
                    + " -r, --reuse                            Reuse existing node and ledger configuration "
                    + "from a previous start.\n"
                    + " -D <programs>, --programs=<programs>   Deploy custom programs from this location.\n"
                    + " -o <option>, --option=<option>         Sanity option: noLedgerVerify, "
                    + "noValidatorSanity or rejectExtraNodes.\n"
                    + " -h, --help                             Show this screen.\n"
                    + "\n"
                    + "If the log verbosity variable (RUST_LOG by default) is set in the environment it is "
                    + "propagated into the network nodes.\n";

    @Getter
    private final NetCommand command;

    @Getter
    private final Path configFile;

    @Getter
    private final boolean reuse;

    @Getter
    private final SanityOptions sanityOptions;

    @Getter
    private final ArtifactSource artifactSource;

    private NetCmdLine(Map<String, Object> opts) {
        this.command = parseCommand(opts);
        this.configFile = Paths.get((String) opts.get("--config"));
        this.reuse = Boolean.TRUE.equals(opts.get("--reuse"));
        this.sanityOptions = SanityOptions.parse(stringList(opts.get("--option")));
        this.artifactSource = parseArtifactSource(opts);
    }

    /**
     * Parses the arguments of the net tool.
     *
     * @throws org.docopt.DocoptExitException if the arguments don't match the usage or help is requested
     * @throws IllegalArgumentException       if an option value is invalid
     */
    public static NetCmdLine parse(String... args) {
        Map<String, Object> opts = new Docopt(USAGE)
                .withHelp(true)
                .withExit(false)
                .parse(args);
        log.debug("Parsed arguments: {}", opts);
        return new NetCmdLine(opts);
    }

    private static NetCommand parseCommand(Map<String, Object> opts) {
        for (NetCommand command : NetCommand.values()) {
            if (Boolean.TRUE.equals(opts.get(command.getName()))) {
                return command;
            }
        }
        throw new IllegalArgumentException("No command given");
    }

    private static ArtifactSource parseArtifactSource(Map<String, Object> opts) {
        String tarball = (String) opts.get("--tarball");
        if (tarball != null) {
            return ArtifactSource.tarball(Paths.get(tarball));
        }

        String channel = (String) opts.get("--channel");
        if (channel != null) {
            return ArtifactSource.channel(channel);
        }

        String features = (String) opts.get("--features");
        List<String> featureList = features == null
                ? ImmutableList.of()
                : Splitter.on(',').trimResults().omitEmptyStrings().splitToList(features);

        String programs = (String) opts.get("--programs");
        return ArtifactSource.local(featureList, programs == null ? null : Paths.get(programs));
    }

    private static List<String> stringList(Object value) {
        if (value == null) {
            return ImmutableList.of();
        }
        if (value instanceof List) {
            ImmutableList.Builder<String> values = ImmutableList.builder();
            for (Object item : (List<?>) value) {
                values.add(String.valueOf(item));
            }
            return values.build();
        }
        return ImmutableList.of(String.valueOf(value));
    }
}
