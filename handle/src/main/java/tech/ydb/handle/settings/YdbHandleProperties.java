package tech.ydb.handle.settings;

import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.util.Properties;

public class YdbHandleProperties {
    static final YdbHandleProperty<Boolean> FAIL_ON_TRUNCATED_RESULT = YdbHandleProperty
            .bool("failOnTruncatedResult", "Throw an exception when a truncated result is wrapped", false);

    static final YdbHandleProperty<Integer> MAX_ROWS = YdbHandleProperty
            .nonNegativeInt("maxRows", "Max count of rows read from a JDBC result set, 0 means no limit", 0);

    private final boolean failOnTruncatedResult;
    private final int maxRows;

    public YdbHandleProperties(Properties props) throws SQLException {
        this.failOnTruncatedResult = FAIL_ON_TRUNCATED_RESULT.readValue(props);
        this.maxRows = MAX_ROWS.readValue(props);
    }

    public boolean isFailOnTruncatedResult() {
        return failOnTruncatedResult;
    }

    public int getMaxRows() {
        return maxRows;
    }

    public DriverPropertyInfo[] toDriverProperties() {
        return new DriverPropertyInfo[] {
            FAIL_ON_TRUNCATED_RESULT.toInfo(failOnTruncatedResult),
            MAX_ROWS.toInfo(maxRows),
        };
    }
}
