package org.testnet.universe.remote;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.List;

/**
 * Exit code and combined output of a finished command.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class CommandResult {
    private final int exitCode;
    @NonNull
    private final String output;

    public static CommandResult success(String output) {
        return new CommandResult(0, output);
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * Returns this result if the command succeeded.
     *
     * @throws RemoteException if the command exited with a non zero code
     */
    public CommandResult orThrow(List<String> command) {
        if (!isSuccess()) {
            throw new RemoteException("Command failed with exit code " + exitCode
                    + ": " + String.join(" ", command) + System.lineSeparator() + output);
        }
        return this;
    }
}
