package org.testnet.universe.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Shared Gson instance.
 */
public final class JsonUtils {

    private static final Gson REGULAR_PARSER = new GsonBuilder().disableHtmlEscaping().create();

    private JsonUtils() {
        // prevent instantiation of this class
    }

    public static <T> T fromJson(String json, Class<T> type) {
        return REGULAR_PARSER.fromJson(json, type);
    }
}
