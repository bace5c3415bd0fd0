package org.testnet.universe.node;

/**
 * Lifecycle state of a {@link NodeRecord}.
 * <p>
 * PENDING -> STARTING -> RUNNING moves forward only. Any non-terminal state may end in STOPPED
 * or FAILED. STOPPED and FAILED are terminal: re-entering the same terminal state is allowed
 * (and is a no-op), leaving it is not.
 */
public enum NodeState {
    PENDING,
    STARTING,
    RUNNING,
    STOPPED,
    FAILED;

    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }

    public boolean canTransitionTo(NodeState next) {
        if (isTerminal()) {
            return next == this;
        }

        if (next.isTerminal()) {
            return true;
        }

        return next.ordinal() > ordinal();
    }
}
