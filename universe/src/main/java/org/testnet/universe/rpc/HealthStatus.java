package org.testnet.universe.rpc;

import java.util.Locale;

/**
 * Health reported by a node's getHealth call.
 */
public enum HealthStatus {
    OK,
    BEHIND,
    UNKNOWN;

    static HealthStatus parse(String status) {
        switch (status.toLowerCase(Locale.ROOT)) {
            case "ok":
                return OK;
            case "behind":
                return BEHIND;
            default:
                return UNKNOWN;
        }
    }

    public boolean isOk() {
        return this == OK;
    }
}
