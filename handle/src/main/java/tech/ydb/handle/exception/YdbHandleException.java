package tech.ydb.handle.exception;

import java.sql.SQLException;

public class YdbHandleException extends SQLException {
    private static final long serialVersionUID = 4418342716526303529L;

    public YdbHandleException(String reason) {
        super(reason);
    }

    public YdbHandleException(String reason, String sqlState) {
        super(reason, sqlState);
    }

    public YdbHandleException(String reason, String sqlState, Throwable cause) {
        super(reason, sqlState, cause);
    }
}
