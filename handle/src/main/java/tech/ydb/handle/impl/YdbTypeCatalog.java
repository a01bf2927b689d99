package tech.ydb.handle.impl;

import java.util.EnumMap;
import java.util.Map;

import tech.ydb.core.Result;
import tech.ydb.core.Status;
import tech.ydb.core.StatusCode;
import tech.ydb.handle.YdbHandleConst;
import tech.ydb.table.values.DecimalType;
import tech.ydb.table.values.PrimitiveType;
import tech.ydb.table.values.Type;

/**
 * Names and numeric identifiers of YDB types.
 */
public final class YdbTypeCatalog {
    private static final YdbTypeCatalog INSTANCE = new YdbTypeCatalog();

    private final Map<PrimitiveType, Integer> oidByPrimitive;

    private YdbTypeCatalog() {
        oidByPrimitive = new EnumMap<>(PrimitiveType.class);

        oidByPrimitive.put(PrimitiveType.Bool, YdbHandleConst.SQL_KIND_PRIMITIVE + 0);

        oidByPrimitive.put(PrimitiveType.Int8, YdbHandleConst.SQL_KIND_PRIMITIVE + 1);
        oidByPrimitive.put(PrimitiveType.Uint8, YdbHandleConst.SQL_KIND_PRIMITIVE + 2);
        oidByPrimitive.put(PrimitiveType.Int16, YdbHandleConst.SQL_KIND_PRIMITIVE + 3);
        oidByPrimitive.put(PrimitiveType.Uint16, YdbHandleConst.SQL_KIND_PRIMITIVE + 4);
        oidByPrimitive.put(PrimitiveType.Int32, YdbHandleConst.SQL_KIND_PRIMITIVE + 5);
        oidByPrimitive.put(PrimitiveType.Uint32, YdbHandleConst.SQL_KIND_PRIMITIVE + 6);
        oidByPrimitive.put(PrimitiveType.Int64, YdbHandleConst.SQL_KIND_PRIMITIVE + 7);
        oidByPrimitive.put(PrimitiveType.Uint64, YdbHandleConst.SQL_KIND_PRIMITIVE + 8);

        oidByPrimitive.put(PrimitiveType.Float, YdbHandleConst.SQL_KIND_PRIMITIVE + 9);
        oidByPrimitive.put(PrimitiveType.Double, YdbHandleConst.SQL_KIND_PRIMITIVE + 10);

        oidByPrimitive.put(PrimitiveType.Bytes, YdbHandleConst.SQL_KIND_PRIMITIVE + 11);
        oidByPrimitive.put(PrimitiveType.Text, YdbHandleConst.SQL_KIND_PRIMITIVE + 12);
        oidByPrimitive.put(PrimitiveType.Yson, YdbHandleConst.SQL_KIND_PRIMITIVE + 13);
        oidByPrimitive.put(PrimitiveType.Json, YdbHandleConst.SQL_KIND_PRIMITIVE + 14);

        oidByPrimitive.put(PrimitiveType.Uuid, YdbHandleConst.SQL_KIND_PRIMITIVE + 15);

        oidByPrimitive.put(PrimitiveType.Date, YdbHandleConst.SQL_KIND_PRIMITIVE + 16);
        oidByPrimitive.put(PrimitiveType.Datetime, YdbHandleConst.SQL_KIND_PRIMITIVE + 17);
        oidByPrimitive.put(PrimitiveType.Timestamp, YdbHandleConst.SQL_KIND_PRIMITIVE + 18);
        oidByPrimitive.put(PrimitiveType.Interval, YdbHandleConst.SQL_KIND_PRIMITIVE + 19);
        oidByPrimitive.put(PrimitiveType.TzDate, YdbHandleConst.SQL_KIND_PRIMITIVE + 20);
        oidByPrimitive.put(PrimitiveType.TzDatetime, YdbHandleConst.SQL_KIND_PRIMITIVE + 21);
        oidByPrimitive.put(PrimitiveType.TzTimestamp, YdbHandleConst.SQL_KIND_PRIMITIVE + 22);

        oidByPrimitive.put(PrimitiveType.JsonDocument, YdbHandleConst.SQL_KIND_PRIMITIVE + 23);

        // wide date and time types
        oidByPrimitive.put(PrimitiveType.Date32, YdbHandleConst.SQL_KIND_PRIMITIVE + 24);
        oidByPrimitive.put(PrimitiveType.Datetime64, YdbHandleConst.SQL_KIND_PRIMITIVE + 25);
        oidByPrimitive.put(PrimitiveType.Timestamp64, YdbHandleConst.SQL_KIND_PRIMITIVE + 26);
        oidByPrimitive.put(PrimitiveType.Interval64, YdbHandleConst.SQL_KIND_PRIMITIVE + 27);
    }

    /**
     * Returns the type name without optional wrappers
     *
     * @param type YDB type
     * @return type name, {@link YdbHandleConst#UNKNOWN_TYPE_NAME} for Null and Void
     */
    public static String typeName(Type type) {
        Type base = unwrap(type);
        if (base.getKind() == Type.Kind.NULL || base.getKind() == Type.Kind.VOID) {
            return YdbHandleConst.UNKNOWN_TYPE_NAME;
        }
        return base.toString();
    }

    public static Result<Long> typeOid(Type type) {
        return INSTANCE.typeOidImpl(type);
    }

    private Result<Long> typeOidImpl(Type type) {
        Type base = unwrap(type);
        switch (base.getKind()) {
            case PRIMITIVE:
                Integer oid = oidByPrimitive.get((PrimitiveType) base);
                if (oid != null) {
                    return Result.success(oid.longValue());
                }
                break;
            case DECIMAL:
                DecimalType decimal = (DecimalType) base;
                long code = YdbHandleConst.SQL_KIND_DECIMAL + (decimal.getPrecision() << 6) + decimal.getScale();
                return Result.success(code);
            default:
                break;
        }
        return Result.fail(Status.of(StatusCode.SCHEME_ERROR));
    }

    static Type unwrap(Type type) {
        Type base = type;
        while (base.getKind() == Type.Kind.OPTIONAL) {
            base = base.unwrapOptional();
        }
        return base;
    }
}
