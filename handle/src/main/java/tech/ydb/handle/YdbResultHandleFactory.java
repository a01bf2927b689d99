package tech.ydb.handle;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Logger;

import tech.ydb.handle.common.NativeResult;
import tech.ydb.handle.exception.ResultTruncatedException;
import tech.ydb.handle.impl.JdbcNativeResult;
import tech.ydb.handle.impl.YdbNativeResult;
import tech.ydb.handle.settings.YdbHandleProperties;
import tech.ydb.table.result.ResultSetReader;

/**
 * Creates result handles for results of query execution.
 */
public class YdbResultHandleFactory {
    private static final Logger LOGGER = Logger.getLogger(YdbResultHandleFactory.class.getName());

    private final YdbHandleProperties properties;

    public YdbResultHandleFactory(YdbHandleProperties properties) {
        this.properties = Objects.requireNonNull(properties);
    }

    public static YdbResultHandleFactory fromProperties(Properties props) throws SQLException {
        return new YdbResultHandleFactory(new YdbHandleProperties(props));
    }

    public YdbHandleProperties getProperties() {
        return properties;
    }

    public YdbResultHandle wrap(ResultSetReader rs) throws SQLException {
        return wrap(YdbNativeResult.of(rs));
    }

    public YdbResultHandle wrap(ResultSetReader rs, long affectedRows) throws SQLException {
        return wrap(YdbNativeResult.of(rs, affectedRows));
    }

    /**
     * Reads the JDBC result set into memory and wraps it. The result set is closed when the handle is freed.
     *
     * @param rs result set positioned before the first row
     * @return handle owning the result set
     * @throws SQLException if the result set cannot be read or was truncated by {@code maxRows}
     */
    public YdbResultHandle wrap(ResultSet rs) throws SQLException {
        return wrap(JdbcNativeResult.of(rs, properties.getMaxRows()));
    }

    public YdbResultHandle wrap(Statement statement) throws SQLException {
        return wrap(JdbcNativeResult.ofStatement(statement, properties.getMaxRows()));
    }

    public YdbResultHandle wrapUpdateCount(long updateCount) throws SQLException {
        return wrap(JdbcNativeResult.ofUpdateCount(updateCount));
    }

    public YdbResultHandle wrap(NativeResult result) throws SQLException {
        if (result != null && result.isTruncated()) {
            String msg = String.format(YdbHandleConst.RESULT_IS_TRUNCATED, result.getRowCount());
            if (properties.isFailOnTruncatedResult()) {
                throw new ResultTruncatedException(msg);
            }
            LOGGER.warning(msg);
        }
        return new YdbResultHandle(result);
    }
}
