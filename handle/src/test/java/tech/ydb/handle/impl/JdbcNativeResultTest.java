package tech.ydb.handle.impl;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import tech.ydb.core.Result;
import tech.ydb.core.StatusCode;
import tech.ydb.handle.YdbResultHandle;
import tech.ydb.handle.common.NativeResultKind;
import tech.ydb.handle.helper.ExceptionAssert;
import tech.ydb.handle.helper.JdbcResultSets;

public class JdbcNativeResultTest {

    private static JdbcResultSets idNameRows() {
        return JdbcResultSets.newResultSet()
                .column("id", Types.INTEGER, "INTEGER")
                .column("name", Types.VARCHAR, "VARCHAR")
                .row(1, "a")
                .row(2, null);
    }

    @Test
    public void materialize() throws SQLException {
        JdbcNativeResult result = JdbcNativeResult.of(idNameRows().build());

        Assertions.assertEquals(NativeResultKind.ROWS, result.getKind());
        Assertions.assertFalse(result.isTruncated());
        Assertions.assertEquals(2, result.getColumnCount());
        Assertions.assertEquals(2, result.getRowCount());
        Assertions.assertEquals("id", result.getColumnName(0));
        Assertions.assertEquals("name", result.getColumnName(1));
        Assertions.assertEquals("1", result.getText(0, 0));
        Assertions.assertEquals("a", result.getText(0, 1));
        Assertions.assertEquals("2", result.getText(1, 0));
        Assertions.assertNull(result.getText(1, 1));
    }

    @Test
    public void rowOrderIsKept() throws SQLException {
        ResultSet rs = JdbcResultSets.newResultSet()
                .column("id", Types.INTEGER, "INTEGER")
                .row(1)
                .row(2)
                .row(3)
                .build();

        try (YdbResultHandle handle = new YdbResultHandle(JdbcNativeResult.of(rs))) {
            Assertions.assertEquals(Arrays.asList("1", "2", "3"), handle.fetchColumn("id"));
            Assertions.assertEquals("1", handle.fetchRow(0).get("id"));
            Assertions.assertEquals("3", handle.fetchRow(2).get("id"));
        }
    }

    @Test
    public void typeNamesAndOids() throws SQLException {
        JdbcNativeResult result = JdbcNativeResult.of(JdbcResultSets.newResultSet()
                .column("id", Types.BIGINT, "BIGINT")
                .column("payload", Types.OTHER, "")
                .row(1L, "data")
                .build());

        Assertions.assertEquals("BIGINT", result.getColumnTypeName(0));
        Assertions.assertEquals((long) Types.BIGINT, result.getColumnTypeOid(0).getValue());

        Assertions.assertEquals("unknown", result.getColumnTypeName(1));
        Result<Long> oid = result.getColumnTypeOid(1);
        Assertions.assertFalse(oid.isSuccess());
        Assertions.assertEquals(StatusCode.SCHEME_ERROR, oid.getStatus().getCode());
    }

    @Test
    public void handleOverJdbcResult() throws SQLException {
        try (YdbResultHandle handle = new YdbResultHandle(JdbcNativeResult.of(JdbcResultSets.newResultSet()
                .column("id", Types.BIGINT, "BIGINT")
                .column("payload", Types.OTHER, "")
                .row(1L, "data")
                .build()))) {
            Assertions.assertEquals("BIGINT", handle.getFieldType("id"));
            Assertions.assertNull(handle.getFieldType("payload"));
            Assertions.assertEquals((long) Types.BIGINT, handle.getTypeOid("id"));
            ExceptionAssert.resultStatus("Error while fetching type oid for field 'payload'.",
                    () -> handle.getTypeOid("payload"));
            Assertions.assertEquals(Arrays.asList("data"), handle.fetchColumn("payload"));
        }
    }

    @Test
    public void maxRows() throws SQLException {
        JdbcNativeResult limited = JdbcNativeResult.of(idNameRows().build(), 1);
        Assertions.assertTrue(limited.isTruncated());
        Assertions.assertEquals(1, limited.getRowCount());

        JdbcNativeResult exact = JdbcNativeResult.of(idNameRows().build(), 2);
        Assertions.assertFalse(exact.isTruncated());
        Assertions.assertEquals(2, exact.getRowCount());
    }

    @Test
    public void updateCount() {
        JdbcNativeResult result = JdbcNativeResult.ofUpdateCount(12);

        Assertions.assertEquals(NativeResultKind.COMMAND, result.getKind());
        Assertions.assertEquals(12, result.getAffectedRowCount());
        Assertions.assertEquals(0, result.getColumnCount());
        Assertions.assertEquals(0, result.getRowCount());
    }

    @Test
    public void releaseClosesSource() throws SQLException {
        AtomicInteger closeCount = new AtomicInteger();
        ResultSet rs = JdbcResultSets.trackClose(idNameRows().build(), closeCount);
        JdbcNativeResult result = JdbcNativeResult.of(rs);

        // values are still readable after the source is read to the end
        Assertions.assertEquals("a", result.getText(0, 1));
        Assertions.assertEquals(0, closeCount.get());

        result.release();
        result.release();
        Assertions.assertEquals(1, closeCount.get());
        Assertions.assertEquals("a", result.getText(0, 1));

        JdbcNativeResult.ofUpdateCount(1).release();
    }
}
