package tech.ydb.handle.impl;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import tech.ydb.core.Result;
import tech.ydb.core.Status;
import tech.ydb.core.StatusCode;
import tech.ydb.handle.common.BaseNativeResult;
import tech.ydb.handle.common.NativeResultKind;
import tech.ydb.table.result.ResultSetReader;
import tech.ydb.table.result.ValueReader;
import tech.ydb.table.values.PrimitiveType;
import tech.ydb.table.values.Type;

/**
 * Native result over a {@link ResultSetReader} received from query execution.
 */
public class YdbNativeResult extends BaseNativeResult {
    private static final Status SUCCESS = Status.of(StatusCode.SUCCESS);

    private final long affectedRows;
    private final Status status;

    private ResultSetReader rs;

    private YdbNativeResult(NativeResultKind kind, ResultSetReader rs, long affectedRows, Status status) {
        super(kind);
        this.rs = rs;
        this.affectedRows = affectedRows;
        this.status = status;
    }

    public static YdbNativeResult of(ResultSetReader rs) {
        return of(rs, 0);
    }

    public static YdbNativeResult of(ResultSetReader rs, long affectedRows) {
        return new YdbNativeResult(NativeResultKind.ROWS, Objects.requireNonNull(rs), affectedRows, SUCCESS);
    }

    public static YdbNativeResult ofCommand(long affectedRows) {
        return new YdbNativeResult(NativeResultKind.COMMAND, null, affectedRows, SUCCESS);
    }

    public static YdbNativeResult ofFailure(Status status) {
        return new YdbNativeResult(NativeResultKind.FAILURE, null, 0, Objects.requireNonNull(status));
    }

    public Status getStatus() {
        return status;
    }

    @Override
    public boolean isTruncated() {
        return rs != null && rs.isTruncated();
    }

    @Override
    public int getColumnCount() {
        return rs != null ? rs.getColumnCount() : 0;
    }

    @Override
    public int getRowCount() {
        return rs != null ? rs.getRowCount() : 0;
    }

    @Override
    public long getAffectedRowCount() {
        return affectedRows;
    }

    @Override
    public String getColumnName(int column) {
        return reader().getColumnName(column);
    }

    @Override
    public String getColumnTypeName(int column) {
        return YdbTypeCatalog.typeName(reader().getColumnType(column));
    }

    @Override
    public Result<Long> getColumnTypeOid(int column) {
        return YdbTypeCatalog.typeOid(reader().getColumnType(column));
    }

    @Override
    public String getText(int row, int column) {
        ResultSetReader reader = reader();
        reader.setRowIndex(row);

        ValueReader value = reader.getColumn(column);
        Type type = reader.getColumnType(column);
        while (type.getKind() == Type.Kind.OPTIONAL) {
            if (value == null || !value.isOptionalItemPresent()) {
                return null;
            }
            type = type.unwrapOptional();
            if (type.getKind() == Type.Kind.OPTIONAL) {
                value = value.getOptionalItem();
            }
        }

        switch (type.getKind()) {
            case PRIMITIVE:
                return primitiveText((PrimitiveType) type, value);
            case DECIMAL:
                return value.getDecimal().toBigDecimal().toPlainString();
            case NULL:
            case VOID:
                return null;
            default:
                return defaultText(value);
        }
    }

    @Override
    protected void doRelease() {
        rs = null;
    }

    @Override
    public String toString() {
        if (getKind() == NativeResultKind.FAILURE) {
            return getKind().name() + " " + status;
        }
        return super.toString();
    }

    private ResultSetReader reader() {
        if (rs == null) {
            throw new IllegalStateException("Result " + this + " has no rows to read");
        }
        return rs;
    }

    private static String primitiveText(PrimitiveType type, ValueReader value) {
        switch (type) {
            case Bool:
                return String.valueOf(value.getBool());
            case Int8:
                return String.valueOf(value.getInt8());
            case Uint8:
                return String.valueOf(value.getUint8());
            case Int16:
                return String.valueOf(value.getInt16());
            case Uint16:
                return String.valueOf(value.getUint16());
            case Int32:
                return String.valueOf(value.getInt32());
            case Uint32:
                return String.valueOf(value.getUint32());
            case Int64:
                return String.valueOf(value.getInt64());
            case Uint64:
                return Long.toUnsignedString(value.getUint64());
            case Float:
                return String.valueOf(value.getFloat());
            case Double:
                return String.valueOf(value.getDouble());
            case Bytes:
                return new String(value.getBytes(), StandardCharsets.UTF_8);
            case Yson:
                return new String(value.getYson(), StandardCharsets.UTF_8);
            case Text:
                return value.getText();
            case Json:
                return value.getJson();
            case JsonDocument:
                return value.getJsonDocument();
            case Uuid:
                return value.getUuid().toString();
            case Date:
                return value.getDate().toString();
            case Datetime:
                return value.getDatetime().toString();
            case Timestamp:
                return value.getTimestamp().toString();
            case Interval:
                return value.getInterval().toString();
            case TzDate:
                return value.getTzDate().toString();
            case TzDatetime:
                return value.getTzDatetime().toString();
            case TzTimestamp:
                return value.getTzTimestamp().toString();
            case Date32:
                return value.getDate32().toString();
            case Datetime64:
                return value.getDatetime64().toString();
            case Timestamp64:
                return value.getTimestamp64().toString();
            case Interval64:
                return value.getInterval64().toString();
            default:
                return defaultText(value);
        }
    }

    private static String defaultText(ValueReader value) {
        StringBuilder sb = new StringBuilder();
        value.toString(sb);
        return sb.toString();
    }
}
