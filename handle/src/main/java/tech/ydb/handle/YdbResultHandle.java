package tech.ydb.handle;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import tech.ydb.core.Result;
import tech.ydb.handle.common.Identifiers;
import tech.ydb.handle.common.NativeResult;
import tech.ydb.handle.exception.HandleClosedException;
import tech.ydb.handle.exception.InvalidArgumentException;
import tech.ydb.handle.exception.OutOfBoundsException;
import tech.ydb.handle.exception.ResultStatusException;

/**
 * Owner of the native result of one query execution. The handle releases the result exactly once, either by an
 * explicit {@link #free()} or when it is closed at the end of a try-with-resources block.
 * <p>
 * Rows and columns are addressed by zero-based positions. The handle is not thread safe.
 */
public class YdbResultHandle implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(YdbResultHandle.class.getName());

    private NativeResult result;

    /**
     * Takes ownership of the given result
     *
     * @param result completed query result
     * @throws InvalidArgumentException if the result is not a query result, was released or is already owned
     */
    public YdbResultHandle(NativeResult result) throws InvalidArgumentException {
        this.result = ensureIsAQueryResult(result);
        LOGGER.log(Level.FINEST, "Result handle owns {0} result", result);
    }

    /**
     * Releases the native result. Subsequent calls do nothing.
     *
     * @return this handle
     * @throws SQLException if the driver fails to release the result
     */
    public YdbResultHandle free() throws SQLException {
        NativeResult current = result;
        if (current != null) {
            result = null;
            LOGGER.log(Level.FINE, "Release {0} result", current);
            current.release();
        }
        return this;
    }

    @Override
    public void close() throws SQLException {
        free();
    }

    public boolean isFreed() {
        return result == null;
    }

    /**
     * Returns the row as a map of column names to text values
     *
     * @param index row, 0..N-1
     * @return column values in column order, {@code null} for SQL NULL
     * @throws OutOfBoundsException if there is no such row or the handle is freed
     */
    public Map<String, String> fetchRow(int index) throws SQLException {
        NativeResult rs = alive();
        if (index < 0 || index >= rs.getRowCount()) {
            throw new OutOfBoundsException(String.format(YdbHandleConst.ROW_NOT_FOUND, index));
        }

        Map<String, String> row = new LinkedHashMap<>();
        for (int idx = 0; idx < rs.getColumnCount(); idx += 1) {
            row.put(rs.getColumnName(idx), rs.getText(index, idx));
        }
        return Collections.unmodifiableMap(row);
    }

    public int countFields() throws SQLException {
        return alive().getColumnCount();
    }

    /**
     * Returns count of rows, results of statements without rows have no rows.
     *
     * @return count of rows
     * @throws SQLException if the handle is freed
     */
    public int countRows() throws SQLException {
        return alive().getRowCount();
    }

    public long countAffectedRows() throws SQLException {
        return alive().getAffectedRowCount();
    }

    public List<String> getFieldNames() throws SQLException {
        ImmutableList.Builder<String> names = ImmutableList.builder();
        for (int idx = 0; idx < countFields(); idx += 1) {
            names.add(getFieldName(idx));
        }
        return names.build();
    }

    /**
     * Returns the name of the column
     *
     * @param fieldNo column, 0..N-1
     * @return column name
     * @throws InvalidArgumentException if there is no such column
     */
    public String getFieldName(int fieldNo) throws SQLException {
        NativeResult rs = alive();
        if (fieldNo < 0 || fieldNo >= rs.getColumnCount()) {
            throw new InvalidArgumentException(YdbHandleConst.COLUMN_NUMBER_NOT_FOUND + fieldNo);
        }
        return rs.getColumnName(fieldNo);
    }

    /**
     * Returns the declared type name of the column
     *
     * @param name exact column name
     * @return type name or {@code null} if the driver cannot resolve the type
     * @throws InvalidArgumentException if there is no such column
     */
    @Nullable
    public String getFieldType(String name) throws SQLException {
        String type = alive().getColumnTypeName(getFieldNumber(name));
        return YdbHandleConst.UNKNOWN_TYPE_NAME.equals(type) ? null : type;
    }

    /**
     * Returns the type identifier of the column
     *
     * @param name exact column name
     * @return type identifier
     * @throws InvalidArgumentException if there is no such column
     * @throws ResultStatusException if the driver fails to resolve the identifier
     */
    public long getTypeOid(String name) throws SQLException {
        int fieldNo = getFieldNumber(name);
        Result<Long> oid = alive().getColumnTypeOid(fieldNo);
        if (!oid.isSuccess()) {
            throw new ResultStatusException(String.format(YdbHandleConst.TYPE_OID_FAILED, name), oid.getStatus());
        }
        return oid.getValue();
    }

    /**
     * Returns values of the column for all rows
     *
     * @param name exact column name
     * @return column values in row order, {@code null} for SQL NULL
     * @throws InvalidArgumentException if there is no such column
     */
    public List<String> fetchColumn(String name) throws SQLException {
        int fieldNo = getFieldNumber(name);
        NativeResult rs = alive();

        List<String> values = new ArrayList<>(rs.getRowCount());
        for (int row = 0; row < rs.getRowCount(); row += 1) {
            values.add(rs.getText(row, fieldNo));
        }
        return Collections.unmodifiableList(values);
    }

    public boolean fieldExist(String name) throws SQLException {
        return findField(name) >= 0;
    }

    int getFieldNumber(String name) throws SQLException {
        int fieldNo = findField(name);
        if (fieldNo < 0) {
            String available = Joiner.on(", ").join(getFieldNames());
            throw new InvalidArgumentException(String.format(YdbHandleConst.FIELD_NOT_FOUND, name, available));
        }
        return fieldNo;
    }

    private int findField(String name) throws SQLException {
        NativeResult rs = alive();
        if (name == null) {
            return -1;
        }
        // names are exact, quoting turns off case folding
        return rs.findColumn(Identifiers.quote(name));
    }

    private NativeResult alive() throws HandleClosedException {
        if (result == null) {
            throw new HandleClosedException();
        }
        return result;
    }

    private static NativeResult ensureIsAQueryResult(NativeResult result) throws InvalidArgumentException {
        if (result == null) {
            throw new InvalidArgumentException(String.format(YdbHandleConst.NOT_A_QUERY_RESULT, "null"));
        }
        if (!result.getKind().isQueryResult()) {
            throw new InvalidArgumentException(String.format(YdbHandleConst.NOT_A_QUERY_RESULT, result));
        }
        if (result.isReleased()) {
            throw new InvalidArgumentException(String.format(YdbHandleConst.RESULT_ALREADY_RELEASED, result));
        }
        if (!result.claim()) {
            throw new InvalidArgumentException(String.format(YdbHandleConst.RESULT_ALREADY_OWNED, result));
        }
        return result;
    }
}
