package org.testnet.cmdlets;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Subcommands of the net tool.
 */
@AllArgsConstructor
public enum NetCommand {
    START("start"),
    STOP("stop"),
    RESTART("restart"),
    SANITY("sanity"),
    UPDATE("update"),
    LOGS("logs");

    @Getter
    private final String name;
}
