package tech.ydb.handle.exception;

import tech.ydb.core.Status;
import tech.ydb.core.UnexpectedResultException;
import tech.ydb.handle.YdbHandleConst;

/**
 * The driver reported a failure for an otherwise valid request.
 */
public class ResultStatusException extends YdbHandleException {
    private static final long serialVersionUID = 8764190587437620932L;

    private final Status status;

    public ResultStatusException(String message, Status status) {
        super(message, YdbHandleConst.SQLSTATE_INTERNAL_ERROR, new UnexpectedResultException(message, status));
        this.status = status;
    }

    public Status getStatus() {
        return status;
    }
}
