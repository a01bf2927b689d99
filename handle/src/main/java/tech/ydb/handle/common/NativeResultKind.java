package tech.ydb.handle.common;

/**
 * Status of a completed query execution as seen by the driver.
 */
public enum NativeResultKind {
    /** Statement returned a row set, possibly empty */
    ROWS(true),
    /** Statement completed without returning rows */
    COMMAND(true),
    /** Nothing was executed */
    EMPTY_QUERY(false),
    /** Execution failed, the result carries only the failure */
    FAILURE(false);

    private final boolean isQueryResult;

    NativeResultKind(boolean isQueryResult) {
        this.isQueryResult = isQueryResult;
    }

    public boolean isQueryResult() {
        return isQueryResult;
    }
}
