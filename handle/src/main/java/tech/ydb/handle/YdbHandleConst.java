package tech.ydb.handle;

public final class YdbHandleConst {

    // Type catalog
    public static final int SQL_KIND_PRIMITIVE = 10000;
    public static final int SQL_KIND_DECIMAL = 1 << 14; // 16384

    // Type name reported by drivers for columns they cannot resolve
    public static final String UNKNOWN_TYPE_NAME = "unknown";

    // SQLSTATE codes
    public static final String SQLSTATE_INVALID_PARAMETER_VALUE = "22023";
    public static final String SQLSTATE_NUMERIC_VALUE_OUT_OF_RANGE = "22003";
    public static final String SQLSTATE_DATA_EXCEPTION = "22000";
    public static final String SQLSTATE_INTERNAL_ERROR = "XX000";

    // Messages
    public static final String NOT_A_QUERY_RESULT = "Given result is not a query result ('%s' given).";
    public static final String RESULT_ALREADY_RELEASED = "Given result was already released ('%s' given).";
    public static final String RESULT_ALREADY_OWNED = "Given result is already owned by another handle ('%s' given).";
    public static final String RESULT_IS_TRUNCATED = "Result was truncated to %s rows";
    public static final String HANDLE_IS_FREED = "Result handle is freed";

    public static final String ROW_NOT_FOUND = "Cannot jump to non existing row %d.";
    public static final String COLUMN_NUMBER_NOT_FOUND = "Column is out of range: ";
    public static final String FIELD_NOT_FOUND = "Could not find field name '%s'. Available fields are {%s}.";
    public static final String TYPE_OID_FAILED = "Error while fetching type oid for field '%s'.";

    private YdbHandleConst() {
        //
    }
}
