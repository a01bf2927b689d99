package tech.ydb.handle;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Arrays;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import tech.ydb.handle.common.NativeResult;
import tech.ydb.handle.helper.ExceptionAssert;
import tech.ydb.handle.helper.JdbcResultSets;
import tech.ydb.handle.helper.MemoryResult;
import tech.ydb.handle.helper.YdbResultSets;
import tech.ydb.table.values.PrimitiveType;
import tech.ydb.table.values.PrimitiveValue;

public class YdbResultHandleFactoryTest {

    private static YdbResultHandleFactory factory(String... keyValues) throws SQLException {
        Properties props = new Properties();
        for (int idx = 0; idx + 1 < keyValues.length; idx += 2) {
            props.setProperty(keyValues[idx], keyValues[idx + 1]);
        }
        return YdbResultHandleFactory.fromProperties(props);
    }

    @Test
    public void wrapYdbResultSet() throws SQLException {
        YdbResultSets rs = YdbResultSets.newResultSet()
                .column("id", PrimitiveType.Int32)
                .column("name", PrimitiveType.Text)
                .row(PrimitiveValue.newInt32(1), PrimitiveValue.newText("a"))
                .row(PrimitiveValue.newInt32(2), PrimitiveValue.newText("b"));

        try (YdbResultHandle handle = factory().wrap(rs.build(), 2)) {
            Assertions.assertEquals(2, handle.countRows());
            Assertions.assertEquals(2, handle.countAffectedRows());
            Assertions.assertEquals(Arrays.asList("a", "b"), handle.fetchColumn("name"));
        }
    }

    @Test
    public void wrapJdbcResultSet() throws SQLException {
        AtomicInteger closeCount = new AtomicInteger();
        ResultSet rs = JdbcResultSets.trackClose(JdbcResultSets.newResultSet()
                .column("id", Types.INTEGER, "INTEGER")
                .column("name", Types.VARCHAR, "VARCHAR")
                .row(1, "a")
                .row(2, "b")
                .build(), closeCount);

        YdbResultHandle handle = factory().wrap(rs);
        Assertions.assertEquals(Arrays.asList("id", "name"), handle.getFieldNames());
        Assertions.assertEquals(Arrays.asList("1", "2"), handle.fetchColumn("id"));
        Assertions.assertEquals(0, closeCount.get());

        handle.free().free();
        Assertions.assertEquals(1, closeCount.get());
    }

    @Test
    public void wrapUpdateCount() throws SQLException {
        try (YdbResultHandle handle = factory().wrapUpdateCount(5)) {
            Assertions.assertEquals(5, handle.countAffectedRows());
            Assertions.assertEquals(0, handle.countRows());
        }
    }

    @Test
    public void truncatedResultIsAcceptedByDefault() throws SQLException {
        YdbResultHandleFactory factory = factory();
        Assertions.assertFalse(factory.getProperties().isFailOnTruncatedResult());

        try (YdbResultHandle handle = factory.wrap(new MemoryResult().column("id", "Int32", 10005).row("1")
                .truncated())) {
            Assertions.assertEquals(1, handle.countRows());
        }
    }

    @Test
    public void truncatedResultIsRejected() throws SQLException {
        YdbResultHandleFactory factory = factory("failOnTruncatedResult", "true");
        MemoryResult result = new MemoryResult().column("id", "Int32", 10005).row("1").row("2").truncated();

        ExceptionAssert.resultTruncated("Result was truncated to 2 rows", () -> factory.wrap(result));
        Assertions.assertFalse(result.isReleased());
        Assertions.assertTrue(result.claim(), "Rejected result must stay unowned");
    }

    @Test
    public void truncatedYdbResultSetIsRejected() throws SQLException {
        YdbResultHandleFactory factory = factory("failOnTruncatedResult", "true");
        YdbResultSets rs = YdbResultSets.newResultSet()
                .column("id", PrimitiveType.Int32)
                .row(PrimitiveValue.newInt32(1))
                .truncated();

        ExceptionAssert.resultTruncated("Result was truncated to 1 rows", () -> factory.wrap(rs.build()));
    }

    @Test
    public void maxRowsTruncatesJdbcResultSet() throws SQLException {
        ResultSet rs = JdbcResultSets.newResultSet()
                .column("id", Types.INTEGER, "INTEGER")
                .row(1)
                .row(2)
                .row(3)
                .build();

        try (YdbResultHandle handle = factory("maxRows", "2").wrap(rs)) {
            Assertions.assertEquals(2, handle.countRows());
            Assertions.assertEquals(Arrays.asList("1", "2"), handle.fetchColumn("id"));
        }

        ResultSet rs2 = JdbcResultSets.newResultSet()
                .column("id", Types.INTEGER, "INTEGER")
                .row(1)
                .row(2)
                .row(3)
                .build();

        YdbResultHandleFactory strict = factory("maxRows", "2", "failOnTruncatedResult", "true");
        ExceptionAssert.resultTruncated("Result was truncated to 2 rows", () -> strict.wrap(rs2));
    }

    @Test
    public void nullResultIsRejected() throws SQLException {
        YdbResultHandleFactory factory = factory();
        ExceptionAssert.invalidArgument("Given result is not a query result ('null' given).",
                () -> factory.wrap((NativeResult) null));
    }
}
