package tech.ydb.handle.settings;

import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;

/**
 * Named option of the result handle with its default value. A value is taken from its text form, so both strings
 * and typed objects are accepted.
 */
class YdbHandleProperty<T> {
    private interface Parser<T> {
        T parse(String value);
    }

    private final String name;
    private final String description;
    private final T defaultValue;
    private final Parser<T> parser;

    private YdbHandleProperty(String name, String description, T defaultValue, Parser<T> parser) {
        this.name = Objects.requireNonNull(name);
        this.description = Objects.requireNonNull(description);
        this.defaultValue = Objects.requireNonNull(defaultValue);
        this.parser = Objects.requireNonNull(parser);
    }

    public T readValue(Properties props) throws SQLException {
        Object value = props.get(name);
        if (value == null) {
            return defaultValue;
        }

        try {
            return parser.parse(value.toString().trim());
        } catch (IllegalArgumentException e) {
            throw new SQLException("Unable to convert property " + name + ": " + e.getMessage(), e);
        }
    }

    DriverPropertyInfo toInfo(T value) {
        DriverPropertyInfo info = new DriverPropertyInfo(name, String.valueOf(value));
        info.description = description;
        info.required = false;
        return info;
    }

    static YdbHandleProperty<Boolean> bool(String name, String description, boolean defaultValue) {
        return new YdbHandleProperty<>(name, description, defaultValue, value -> {
            if ("true".equalsIgnoreCase(value)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(value)) {
                return Boolean.FALSE;
            }
            throw new IllegalArgumentException("Unable to parse value [" + value + "] as Boolean");
        });
    }

    static YdbHandleProperty<Integer> nonNegativeInt(String name, String description, int defaultValue) {
        return new YdbHandleProperty<>(name, description, defaultValue, value -> {
            int parsed;
            try {
                parsed = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Unable to parse value [" + value + "] as Integer", e);
            }
            if (parsed < 0) {
                throw new IllegalArgumentException("Value must not be negative, got " + parsed);
            }
            return parsed;
        });
    }
}
