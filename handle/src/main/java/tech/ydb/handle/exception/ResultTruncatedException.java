package tech.ydb.handle.exception;

import tech.ydb.handle.YdbHandleConst;

public class ResultTruncatedException extends YdbHandleException {
    private static final long serialVersionUID = 5630129834472718820L;

    public ResultTruncatedException(String reason) {
        super(reason, YdbHandleConst.SQLSTATE_DATA_EXCEPTION);
    }
}
