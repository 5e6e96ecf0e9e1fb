package io.workgate.util;

import java.util.Map;

/**
 * Encodes flat string maps (lease values, task arguments) as JSON objects.
 *
 * <p>The default implementation has no dependencies. Deployments that already carry a
 * JSON library can supply their own.
 */
public interface JsonCodec {

    static JsonCodec getDefault() {
        return FlatJsonCodec.INSTANCE;
    }

    /**
     * @return a JSON object; {@code "{}"} for a null or empty map
     */
    String toJson(Map<String, String> fields);

    /**
     * Parses a JSON object whose values are strings, numbers, booleans or null. Non-string
     * scalars are returned in their literal form; null values are dropped.
     *
     * @throws IllegalArgumentException if the input is not a flat JSON object
     */
    Map<String, String> parseObject(String json);
}
