package org.oldskooler.pgschema4j.serialization;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.lang.reflect.Type;

/**
 * Converts field values of json and jsonb columns to and from JSON text.
 */
public class JsonColumnCodec {
    private static final JsonColumnCodec DEFAULT = new JsonColumnCodec();

    private final Gson gson;

    public JsonColumnCodec() {
        this.gson = new GsonBuilder()
                .disableHtmlEscaping()
                .create();
    }

    public JsonColumnCodec(Gson customGson) {
        this.gson = customGson;
    }

    /** The codec used by query building and scanning. */
    public static JsonColumnCodec getDefault() {
        return DEFAULT;
    }

    public Gson getGson() {
        return gson;
    }

    /**
     * Serialize a field value to JSON text. Strings are taken as JSON already.
     */
    public String toJson(Object value) {
        if (value instanceof String) return (String) value;
        return gson.toJson(value);
    }

    /**
     * Deserialize column text into a value of the given field type.
     *
     * @throws JsonParseException if the text is not valid for {@code type}
     */
    public Object fromJson(String json, Type type) {
        if (json == null) return null;
        if (type == String.class) return json;
        return gson.fromJson(json, type);
    }

    public <T> T fromJson(String json, Class<T> type) {
        if (json == null) return null;
        return gson.fromJson(json, type);
    }
}
