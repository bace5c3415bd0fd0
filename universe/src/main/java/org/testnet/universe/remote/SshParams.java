package org.testnet.universe.remote;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import java.time.Duration;

/**
 * How the controlling host reaches node hosts over ssh and where node state lives on them.
 */
@Builder(toBuilder = true)
@Getter
@ToString
public class SshParams {

    private final String user;

    /**
     * Private key file, null to rely on the ssh agent.
     */
    private final String identityFile;

    /**
     * Extra "-o" options on top of the non-interactive defaults.
     */
    @Singular
    private final ImmutableList<String> options;

    @Default
    @NonNull
    private final Duration connectTimeout = Duration.ofSeconds(10);

    @Default
    @NonNull
    private final Duration commandTimeout = Duration.ofMinutes(2);

    @Default
    @NonNull
    private final Duration transferTimeout = Duration.ofMinutes(10);

    /**
     * Per-node project directory, relative to the remote user's home.
     */
    @Default
    @NonNull
    private final String projectDir = "testnet";

    /**
     * Binary install directory, relative to the remote user's home.
     */
    @Default
    @NonNull
    private final String binDir = ".cargo/bin";

    /**
     * Directories inside the project directory that survive a {@link StateMode#REUSE} reset.
     */
    @Default
    @NonNull
    private final ImmutableList<String> persistedDirs = ImmutableList.of("config", "config-local");

    /**
     * Process groups started as root (e.g. system monitors) need sudo to be killed.
     */
    @Default
    private final boolean sudoKill = false;

    public String target(String host) {
        return user == null ? host : user + "@" + host;
    }

    /**
     * Options shared by ssh, scp and rsync for non-interactive, key based connections.
     */
    public ImmutableList<String> sshOptions() {
        ImmutableList.Builder<String> args = ImmutableList.builder();
        args.add("-o", "StrictHostKeyChecking=no")
                .add("-o", "UserKnownHostsFile=/dev/null")
                .add("-o", "LogLevel=ERROR")
                .add("-o", "ConnectTimeout=" + connectTimeout.getSeconds());
        options.forEach(option -> args.add("-o", option));
        if (identityFile != null) {
            args.add("-i", identityFile);
        }
        return args.build();
    }
}
