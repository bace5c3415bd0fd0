package org.testnet.universe.logging;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testnet.universe.node.NodeRecord;
import org.testnet.universe.node.NodeRole;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class RunLogsTest {

    @TempDir
    Path logDir;

    @Test
    public void tailReturnsLastLines() {
        RunLogs runLogs = new RunLogs(LoggingParams.builder().logDir(logDir).surfacedLogLines(2).build()).prepare();
        NodeRecord node = new NodeRecord("10.0.0.1", NodeRole.FULLNODE, runLogs.nodeLog(NodeRole.FULLNODE, "10.0.0.1"));

        runLogs.append(node, "one");
        runLogs.append(node, "two");
        runLogs.append(node, "three");

        assertThat(runLogs.tail(node)).containsExactly("two", "three");
    }

    @Test
    public void tailOfMissingLogIsEmpty() {
        RunLogs runLogs = new RunLogs(LoggingParams.builder().logDir(logDir).build());
        NodeRecord node = new NodeRecord("10.0.0.1", NodeRole.FULLNODE, runLogs.nodeLog(NodeRole.FULLNODE, "10.0.0.1"));

        assertThat(runLogs.tail(node)).isEmpty();
    }

    @Test
    public void concurrentNodesWriteSeparateFiles() {
        RunLogs runLogs = new RunLogs(LoggingParams.builder().logDir(logDir).build()).prepare();
        NodeRecord first = new NodeRecord("10.0.0.1", NodeRole.FULLNODE, runLogs.nodeLog(NodeRole.FULLNODE, "10.0.0.1"));
        NodeRecord second = new NodeRecord("10.0.0.2", NodeRole.FULLNODE, runLogs.nodeLog(NodeRole.FULLNODE, "10.0.0.2"));

        CompletableFuture.allOf(
                CompletableFuture.runAsync(() -> writeLines(runLogs, first)),
                CompletableFuture.runAsync(() -> writeLines(runLogs, second))
        ).join();

        assertThat(runLogs.tail(first)).hasSize(100).allMatch(line -> line.startsWith("10.0.0.1"));
        assertThat(runLogs.tail(second)).hasSize(100).allMatch(line -> line.startsWith("10.0.0.2"));
    }

    @Test
    public void aliasPointsToNodeLog() throws IOException {
        RunLogs runLogs = new RunLogs(LoggingParams.builder().logDir(logDir).build()).prepare();
        NodeRecord node = new NodeRecord("10.0.0.1", NodeRole.FULLNODE, runLogs.nodeLog(NodeRole.FULLNODE, "10.0.0.1"));
        runLogs.append(node, "started");

        runLogs.alias(node, 4242);

        Path alias = logDir.resolve("fullnode-4242.log");
        assertThat(Files.isSymbolicLink(alias)).isTrue();
        assertThat(Files.readAllLines(alias)).containsExactly("started");
    }

    private static void writeLines(RunLogs runLogs, NodeRecord node) {
        for (int i = 0; i < 100; i++) {
            runLogs.append(node, node.getHost() + " line " + i);
        }
    }
}
