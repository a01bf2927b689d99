package tech.ydb.handle.exception;

import tech.ydb.handle.YdbHandleConst;

/**
 * Row position outside of the result.
 */
public class OutOfBoundsException extends YdbHandleException {
    private static final long serialVersionUID = 3075162409848261937L;

    public OutOfBoundsException(String reason) {
        super(reason, YdbHandleConst.SQLSTATE_NUMERIC_VALUE_OUT_OF_RANGE);
    }
}
