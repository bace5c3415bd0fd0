package org.testnet.universe.util;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Quoting for the commands sent to a remote shell.
 */
public final class ShellUtils {

    private ShellUtils() {
        // prevent instantiation of this class
    }

    /**
     * Wraps an argument in single quotes so the remote shell passes it through verbatim.
     */
    public static String quote(String arg) {
        return "'" + arg.replace("'", "'\\''") + "'";
    }

    public static String quoteAll(List<String> args) {
        return args.stream().map(ShellUtils::quote).collect(Collectors.joining(" "));
    }
}
