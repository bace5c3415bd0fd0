package org.testnet.universe.remote;

import com.google.common.io.ByteStreams;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs commands as child processes of the controlling JVM. Stdout and stderr are merged and
 * drained on a separate thread so that a chatty command never blocks on a full pipe.
 */
@Slf4j
public class LocalCommandRunner implements CommandRunner {

    private static final ExecutorService OUTPUT_READERS = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("command-output-%d")
                    .build()
    );

    private static final Duration OUTPUT_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    @Override
    public CommandResult run(List<String> command, Map<String, String> environment, Path workDir,
                             Duration timeout) {
        log.debug("Run: {}", String.join(" ", command));

        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        builder.environment().putAll(environment);
        if (workDir != null) {
            builder.directory(workDir.toFile());
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new RemoteException("Can't start command: " + String.join(" ", command), e);
        }

        Future<String> output = OUTPUT_READERS.submit(() -> readAll(process.getInputStream()));

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly().waitFor(OUTPUT_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                throw new RemoteException("Command timed out after " + timeout + ": " + String.join(" ", command));
            }

            String text = output.get(OUTPUT_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            return new CommandResult(process.exitValue(), text.trim());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new RemoteException("Interrupted while running: " + String.join(" ", command), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new RemoteException("Can't read the output of: " + String.join(" ", command), e);
        }
    }

    private static String readAll(InputStream inputStream) throws IOException {
        try (InputStream in = inputStream) {
            return new String(ByteStreams.toByteArray(in), StandardCharsets.UTF_8);
        }
    }
}
