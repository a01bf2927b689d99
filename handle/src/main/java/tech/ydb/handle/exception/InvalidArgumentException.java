package tech.ydb.handle.exception;

import tech.ydb.handle.YdbHandleConst;

/**
 * Malformed caller input: a resource that is not a query result, a column position out of range or an unknown
 * column name.
 */
public class InvalidArgumentException extends YdbHandleException {
    private static final long serialVersionUID = -2203941541846514311L;

    public InvalidArgumentException(String reason) {
        super(reason, YdbHandleConst.SQLSTATE_INVALID_PARAMETER_VALUE);
    }
}
