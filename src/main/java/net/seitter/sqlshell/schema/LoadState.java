package net.seitter.sqlshell.schema;

/**
 * Lifecycle of the one-shot schema load.
 */
public enum LoadState {
    PENDING,
    RUNNING,
    /** Rows were published into the index. */
    LOADED,
    /** The metadata query failed; the index stays empty. */
    FAILED,
    /** An unexpected error escaped the loader. */
    CRASHED;

    public boolean isTerminal() {
        return this == LOADED || this == FAILED || this == CRASHED;
    }
}
