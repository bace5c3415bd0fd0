package org.testnet.universe.remote;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.testnet.universe.util.ShellUtils;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link RemoteHost} reached with the ssh, scp and rsync binaries of the controlling host.
 * <p>
 * Launched processes are started under {@code setsid}, which makes the process id the id of a
 * fresh process group. The id is written to {@code <project>/supervised/<name>.pgid} so that a
 * later invocation of the tool can find and kill exactly that group.
 */
@Slf4j
@Builder
public class SshRemoteHost implements RemoteHost {

    static final String TRACKING_DIR = "supervised";
    static final String TRACKING_SUFFIX = ".pgid";
    private static final String RELOCATION_DIR = ".testnet-reuse";

    @Getter
    @NonNull
    private final String host;

    @NonNull
    private final SshParams params;

    @NonNull
    private final CommandRunner runner;

    public static RemoteHostFactory factory(SshParams params, CommandRunner runner) {
        return host -> SshRemoteHost.builder().host(host).params(params).runner(runner).build();
    }

    @Override
    public void prepareState(StateMode mode) {
        String project = "~/" + params.getProjectDir();
        String bin = "~/" + params.getBinDir();
        List<String> script = new ArrayList<>();
        script.add("set -ex");

        switch (mode) {
            case RESET:
                script.add("rm -rf " + project);
                break;
            case REUSE:
                String relocation = "~/" + RELOCATION_DIR;
                script.add("rm -rf " + relocation);
                script.add("mkdir -p " + relocation);
                for (String dir : params.getPersistedDirs()) {
                    script.add("mkdir -p " + project + "/" + dir);
                    script.add("mv " + project + "/" + dir + " " + relocation + "/");
                }
                script.add("rm -rf " + project);
                script.add("mkdir -p " + project);
                for (String dir : params.getPersistedDirs()) {
                    script.add("mv " + relocation + "/" + dir + " " + project + "/");
                }
                script.add("rm -rf " + relocation);
                break;
            default:
                throw new IllegalStateException("Unexpected state mode: " + mode);
        }

        script.add("mkdir -p " + project + " " + bin);
        ssh(String.join("; ", script), params.getCommandTimeout()).orThrow(ImmutableList.of("prepareState", mode.name()));
    }

    @Override
    public void transfer(List<Path> sources, RemoteDirectory target) {
        if (sources.isEmpty()) {
            return;
        }

        String destination = target == RemoteDirectory.BIN ? params.getBinDir() : params.getProjectDir();

        List<String> command = new ArrayList<>();
        command.add("rsync");
        command.add("-vPrc");
        command.add("-e");
        command.add("ssh " + String.join(" ", params.sshOptions()));
        sources.forEach(source -> command.add(source.toString()));
        command.add(params.target(host) + ":" + destination + "/");

        runner.run(command, params.getTransferTimeout()).orThrow(command);
    }

    @Override
    public long launch(LaunchSpec spec) {
        String envPrefix = spec.getEnvironment().entrySet().stream()
                .map(entry -> entry.getKey() + "=" + ShellUtils.quote(entry.getValue()) + " ")
                .collect(Collectors.joining());
        String trackingFile = TRACKING_DIR + "/" + spec.getName() + TRACKING_SUFFIX;
        String remoteLog = spec.getName() + ".log";

        String script = String.join("; ", ImmutableList.of(
                "cd ~/" + params.getProjectDir(),
                "mkdir -p " + TRACKING_DIR,
                envPrefix + "setsid nohup ./" + spec.getLauncher() + " " + ShellUtils.quoteAll(spec.getArgs())
                        + " > " + remoteLog + " 2>&1 < /dev/null & pgid=$!",
                "echo $pgid > " + trackingFile,
                "echo $pgid"
        ));

        CommandResult result = ssh(script, params.getCommandTimeout())
                .orThrow(ImmutableList.of("launch", spec.getLauncher()));
        List<String> lines = Splitter.on('\n').omitEmptyStrings().trimResults().splitToList(result.getOutput());
        if (lines.isEmpty()) {
            throw new RemoteException("Launch of " + spec.getLauncher() + " on " + host + " reported no process group");
        }

        String processGroup = lines.get(lines.size() - 1);
        try {
            return Long.parseLong(processGroup);
        } catch (NumberFormatException e) {
            throw new RemoteException("Launch of " + spec.getLauncher() + " on " + host
                    + " reported an invalid process group: " + processGroup, e);
        }
    }

    @Override
    public boolean isProcessGroupAlive(long processGroup) {
        return ssh("kill -0 -- -" + processGroup, params.getCommandTimeout()).isSuccess();
    }

    @Override
    public ImmutableList<Long> trackedProcessGroups() {
        String pattern = "~/" + params.getProjectDir() + "/" + TRACKING_DIR + "/*" + TRACKING_SUFFIX;
        CommandResult result = ssh("cat " + pattern + " 2>/dev/null || true", params.getCommandTimeout());
        if (!result.isSuccess()) {
            throw new RemoteException("Can't read tracked process groups on " + host + ": " + result.getOutput());
        }
        return processGroups(result.getOutput());
    }

    @Override
    public ImmutableList<Long> auxiliaryProcessGroups(List<String> pidFiles) {
        if (pidFiles.isEmpty()) {
            return ImmutableList.of();
        }

        String script = "cd ~/" + params.getProjectDir() + " && for pid in " + ShellUtils.quoteAll(pidFiles)
                + "; do [ -f \"$pid\" ] && ps -o pgid= -p \"$(cat \"$pid\")\"; done; true";
        CommandResult result = ssh(script, params.getCommandTimeout());
        if (!result.isSuccess()) {
            throw new RemoteException("Can't read auxiliary process groups on " + host + ": " + result.getOutput());
        }
        return processGroups(result.getOutput());
    }

    @Override
    public void endInteractiveSessions() {
        ssh("! tmux list-sessions || tmux kill-session", params.getCommandTimeout())
                .orThrow(ImmutableList.of("endInteractiveSessions"));
    }

    @Override
    public void killProcessGroup(long processGroup) {
        String kill = (params.isSudoKill() ? "sudo " : "") + "kill -- -" + processGroup;
        ssh(kill, params.getCommandTimeout()).orThrow(ImmutableList.of("killProcessGroup", String.valueOf(processGroup)));
    }

    @Override
    public void killPrivilegedProcessGroup(long processGroup) {
        ssh("sudo kill -- -" + processGroup, params.getCommandTimeout())
                .orThrow(ImmutableList.of("killPrivilegedProcessGroup", String.valueOf(processGroup)));
    }

    @Override
    public void killByPattern(String pattern) {
        CommandResult result = ssh("pkill -9 " + ShellUtils.quote(pattern), params.getCommandTimeout());
        // pkill exits with 1 when nothing matched
        if (result.getExitCode() > 1) {
            throw new RemoteException("Can't kill processes matching '" + pattern + "' on " + host + ": "
                    + result.getOutput());
        }
    }

    @Override
    public CommandResult execute(List<String> command, Duration timeout) {
        return ssh("cd ~/" + params.getProjectDir() + " && " + ShellUtils.quoteAll(command), timeout);
    }

    @Override
    public void fetch(String remotePath, Path localFile, Duration timeout) {
        List<String> command = new ArrayList<>();
        command.add("scp");
        command.addAll(params.sshOptions());
        command.add(params.target(host) + ":" + params.getProjectDir() + "/" + remotePath);
        command.add(localFile.toString());

        runner.run(command, timeout).orThrow(command);
    }

    private ImmutableList<Long> processGroups(String output) {
        ImmutableList.Builder<Long> groups = ImmutableList.builder();
        for (String line : Splitter.on('\n').omitEmptyStrings().trimResults().split(output)) {
            try {
                groups.add(Long.parseLong(line));
            } catch (NumberFormatException e) {
                log.warn("Ignoring corrupt process group entry on {}: {}", host, line);
            }
        }
        return groups.build();
    }

    private CommandResult ssh(String script, Duration timeout) {
        List<String> command = new ArrayList<>();
        command.add("ssh");
        command.addAll(params.sshOptions());
        command.add("-n");
        command.add(params.target(host));
        command.add(script);
        return runner.run(command, ImmutableMap.of(), null, timeout);
    }
}
