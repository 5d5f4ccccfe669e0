package org.oldskooler.pgschema4j.query;

import java.util.Objects;

/** JSON text bound to a json ({@code binary == false}) or jsonb column. */
public final class JsonParameter {
    public final String json;
    public final boolean binary;

    public JsonParameter(String json, boolean binary) {
        this.json = json;
        this.binary = binary;
    }

    public String typeName() {
        return binary ? "jsonb" : "json";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JsonParameter)) return false;
        JsonParameter that = (JsonParameter) o;
        return binary == that.binary && Objects.equals(json, that.json);
    }

    @Override
    public int hashCode() {
        return Objects.hash(json, binary);
    }

    @Override
    public String toString() {
        return json;
    }
}
