package tech.ydb.handle.common;

import java.sql.SQLException;

import javax.annotation.Nullable;

import tech.ydb.core.Result;

/**
 * Driver level result of one query execution. Rows and columns are addressed by zero-based positions.
 */
public interface NativeResult {

    NativeResultKind getKind();

    /**
     * Marks this result as owned by a handle
     *
     * @return {@code false} if the result already has an owner
     */
    boolean claim();

    boolean isReleased();

    boolean isTruncated();

    int getColumnCount();

    int getRowCount();

    long getAffectedRowCount();

    String getColumnName(int column);

    /**
     * Resolves a column identifier. A quoted identifier matches the column name exactly, an unquoted one is folded
     * to lower case first.
     *
     * @param identifier column identifier
     * @return column position or -1 if there is no such column
     */
    int findColumn(String identifier);

    /**
     * Returns the declared type name of the column
     *
     * @param column column, 0..N-1
     * @return type name or {@link tech.ydb.handle.YdbHandleConst#UNKNOWN_TYPE_NAME}
     */
    String getColumnTypeName(int column);

    Result<Long> getColumnTypeOid(int column);

    @Nullable
    String getText(int row, int column);

    void release() throws SQLException;
}
