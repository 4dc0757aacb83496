package com.trustbridge.secrets;

import lombok.experimental.UtilityClass;

import java.util.Map;

/**
 * Environment definitions mark secret values as {@code {"fn::secret": "value"}}.
 */
@UtilityClass
public class SecretMarker {

    public static final String KEY = "fn::secret";

    public static boolean isMarker(Object value) {
        return value instanceof Map<?, ?> map && map.size() == 1 && map.containsKey(KEY);
    }

    public static Object unwrap(Object value) {
        return isMarker(value) ? ((Map<?, ?>) value).get(KEY) : value;
    }

    public static Map<String, Object> wrap(Object value) {
        return Map.of(KEY, value);
    }
}
