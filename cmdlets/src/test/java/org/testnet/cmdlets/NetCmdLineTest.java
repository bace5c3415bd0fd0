package org.testnet.cmdlets;

import org.docopt.DocoptExitException;
import org.junit.jupiter.api.Test;
import org.testnet.universe.artifact.ArtifactSource;
import org.testnet.universe.artifact.DeployMethod;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NetCmdLineTest {

    @Test
    public void defaults() {
        NetCmdLine cmdLine = NetCmdLine.parse("start");

        assertThat(cmdLine.getCommand()).isEqualTo(NetCommand.START);
        assertThat(cmdLine.getConfigFile()).isEqualTo(Paths.get("net/config/config.json"));
        assertThat(cmdLine.isReuse()).isFalse();
        assertThat(cmdLine.getArtifactSource()).isEqualTo(ArtifactSource.local());
        assertThat(cmdLine.getSanityOptions().isSkipLedgerVerify()).isFalse();
        assertThat(cmdLine.getSanityOptions().isSkipValidatorSanity()).isFalse();
    }

    @Test
    public void everyCommand() {
        for (NetCommand command : NetCommand.values()) {
            assertThat(NetCmdLine.parse(command.getName()).getCommand()).isEqualTo(command);
        }
    }

    @Test
    public void localBuildOptions() {
        NetCmdLine cmdLine = NetCmdLine.parse("restart", "-c", "my-config.json", "-f", "cuda, chacha", "-D", "programs",
                "-r");

        assertThat(cmdLine.getConfigFile()).isEqualTo(Paths.get("my-config.json"));
        assertThat(cmdLine.isReuse()).isTrue();
        assertThat(cmdLine.getArtifactSource().getFeatures()).containsExactly("cuda", "chacha");
        assertThat(cmdLine.getArtifactSource().getCustomPrograms()).contains(Paths.get("programs"));
    }

    @Test
    public void releaseSources() {
        ArtifactSource tarball = NetCmdLine.parse("start", "-T", "solana-release.tar.bz2").getArtifactSource();
        assertThat(tarball.getKind()).isEqualTo(ArtifactSource.Kind.TARBALL);
        assertThat(tarball.getDeployMethod()).isEqualTo(DeployMethod.TAR);

        ArtifactSource channel = NetCmdLine.parse("start", "--channel=beta").getArtifactSource();
        assertThat(channel.getChannel()).contains("beta");
    }

    @Test
    public void invalidChannel() {
        assertThatThrownBy(() -> NetCmdLine.parse("start", "-t", "nightly"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nightly");
    }

    @Test
    public void tarballAndChannelAreExclusive() {
        assertThatThrownBy(() -> NetCmdLine.parse("start", "-T", "release.tar.bz2", "-t", "edge"))
                .isInstanceOf(DocoptExitException.class);
    }

    @Test
    public void repeatedSanityOptions() {
        NetCmdLine cmdLine = NetCmdLine.parse("sanity", "-o", "noLedgerVerify", "-o", "rejectExtraNodes");

        assertThat(cmdLine.getSanityOptions().isSkipLedgerVerify()).isTrue();
        assertThat(cmdLine.getSanityOptions().isSkipValidatorSanity()).isFalse();
        assertThat(cmdLine.getSanityOptions().isRejectExtraNodes()).isTrue();
    }

    @Test
    public void unknownSanityOption() {
        assertThatThrownBy(() -> NetCmdLine.parse("sanity", "-o", "noSanity"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void unknownCommand() {
        assertThatThrownBy(() -> NetCmdLine.parse("deploy"))
                .isInstanceOfSatisfying(DocoptExitException.class, e -> assertThat(e.getExitCode()).isEqualTo(1));
    }

    @Test
    public void help() {
        assertThatThrownBy(() -> NetCmdLine.parse("--help"))
                .isInstanceOfSatisfying(DocoptExitException.class, e -> assertThat(e.getExitCode()).isZero());
    }
}
