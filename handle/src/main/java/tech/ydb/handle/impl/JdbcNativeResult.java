package tech.ydb.handle.impl;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Strings;

import tech.ydb.core.Result;
import tech.ydb.core.Status;
import tech.ydb.core.StatusCode;
import tech.ydb.handle.YdbHandleConst;
import tech.ydb.handle.common.BaseNativeResult;
import tech.ydb.handle.common.NativeResultKind;

/**
 * Native result materialized from a JDBC {@link ResultSet}. Values are read as text while the result is built, the
 * source result set is closed on release.
 */
public class JdbcNativeResult extends BaseNativeResult {
    private static final String[] NO_COLUMNS = new String[0];

    private final ResultSet source;
    private final String[] names;
    private final String[] typeNames;
    private final int[] sqlTypes;
    private final List<String[]> rows;
    private final long affectedRows;
    private final boolean isTruncated;

    private JdbcNativeResult(NativeResultKind kind, @Nullable ResultSet source, String[] names, String[] typeNames,
            int[] sqlTypes, List<String[]> rows, long affectedRows, boolean isTruncated) {
        super(kind);
        this.source = source;
        this.names = names;
        this.typeNames = typeNames;
        this.sqlTypes = sqlTypes;
        this.rows = rows;
        this.affectedRows = affectedRows;
        this.isTruncated = isTruncated;
    }

    public static JdbcNativeResult of(ResultSet rs) throws SQLException {
        return of(rs, 0);
    }

    /**
     * Reads the whole result set into memory
     *
     * @param rs result set positioned before the first row
     * @param maxRows max count of rows to read, 0 means no limit
     * @return materialized result, truncated if the result set has more than {@code maxRows} rows
     * @throws SQLException if the result set cannot be read
     */
    public static JdbcNativeResult of(ResultSet rs, int maxRows) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int count = md.getColumnCount();

        String[] names = new String[count];
        String[] typeNames = new String[count];
        int[] sqlTypes = new int[count];
        for (int idx = 0; idx < count; idx += 1) {
            names[idx] = md.getColumnLabel(idx + 1);
            typeNames[idx] = md.getColumnTypeName(idx + 1);
            sqlTypes[idx] = md.getColumnType(idx + 1);
        }

        List<String[]> rows = new ArrayList<>();
        boolean isTruncated = false;
        while (rs.next()) {
            if (maxRows > 0 && rows.size() >= maxRows) {
                isTruncated = true;
                break;
            }
            String[] row = new String[count];
            for (int idx = 0; idx < count; idx += 1) {
                row[idx] = rs.getString(idx + 1);
            }
            rows.add(row);
        }

        return new JdbcNativeResult(NativeResultKind.ROWS, rs, names, typeNames, sqlTypes, rows, 0, isTruncated);
    }

    public static JdbcNativeResult ofUpdateCount(long updateCount) {
        return new JdbcNativeResult(NativeResultKind.COMMAND, null, NO_COLUMNS, NO_COLUMNS, new int[0],
                Collections.emptyList(), updateCount, false);
    }

    /**
     * Takes the current result of an executed statement
     *
     * @param statement executed statement
     * @param maxRows max count of rows to read, 0 means no limit
     * @return materialized result set, update count or an empty result if the statement has no current result
     * @throws SQLException if the statement result cannot be read
     */
    public static JdbcNativeResult ofStatement(Statement statement, int maxRows) throws SQLException {
        ResultSet rs = statement.getResultSet();
        if (rs != null) {
            return of(rs, maxRows);
        }

        int updateCount = statement.getUpdateCount();
        if (updateCount < 0) {
            return new JdbcNativeResult(NativeResultKind.EMPTY_QUERY, null, NO_COLUMNS, NO_COLUMNS, new int[0],
                    Collections.emptyList(), 0, false);
        }
        return ofUpdateCount(updateCount);
    }

    @Override
    public boolean isTruncated() {
        return isTruncated;
    }

    @Override
    public int getColumnCount() {
        return names.length;
    }

    @Override
    public int getRowCount() {
        return rows.size();
    }

    @Override
    public long getAffectedRowCount() {
        return affectedRows;
    }

    @Override
    public String getColumnName(int column) {
        return names[column];
    }

    @Override
    public String getColumnTypeName(int column) {
        String typeName = typeNames[column];
        return Strings.isNullOrEmpty(typeName) ? YdbHandleConst.UNKNOWN_TYPE_NAME : typeName;
    }

    @Override
    public Result<Long> getColumnTypeOid(int column) {
        int sqlType = sqlTypes[column];
        if (sqlType == Types.OTHER || sqlType == Types.NULL) {
            return Result.fail(Status.of(StatusCode.SCHEME_ERROR));
        }
        return Result.success((long) sqlType);
    }

    @Override
    public String getText(int row, int column) {
        return rows.get(row)[column];
    }

    @Override
    protected void doRelease() throws SQLException {
        if (source != null) {
            source.close();
        }
    }
}
