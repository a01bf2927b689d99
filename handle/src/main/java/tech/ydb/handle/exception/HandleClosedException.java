package tech.ydb.handle.exception;

import tech.ydb.handle.YdbHandleConst;

public class HandleClosedException extends OutOfBoundsException {
    private static final long serialVersionUID = -6532815204380914107L;

    public HandleClosedException() {
        super(YdbHandleConst.HANDLE_IS_FREED);
    }
}
