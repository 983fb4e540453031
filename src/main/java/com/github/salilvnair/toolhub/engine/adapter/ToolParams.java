package com.github.salilvnair.toolhub.engine.adapter;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Typed reads over a params map that has already passed contract validation.
 */
@UtilityClass
public class ToolParams {

    public static String string(Map<String, Object> params, String key) {
        Object value = params.get(key);
        return value == null ? null : value.toString();
    }

    public static Long longValue(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value instanceof BigInteger big) {
            return big.longValueExact();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.longValueExact();
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return value == null ? null : Long.valueOf(value.toString().trim());
    }

    public static boolean bool(Map<String, Object> params, String key, boolean defaultValue) {
        Object value = params.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value == null ? defaultValue : Boolean.parseBoolean(value.toString());
    }

    public static List<String> stringList(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).toList();
        }
        return value == null ? List.of() : List.of(value.toString());
    }
}
