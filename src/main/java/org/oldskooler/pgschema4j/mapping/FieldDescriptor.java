package org.oldskooler.pgschema4j.mapping;

import java.lang.reflect.Type;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** One mapped field of a record type: its name, Java type, raw annotation and accessor. */
public final class FieldDescriptor {
    public final String name;
    public final Class<?> type;
    public final Type genericType;
    public final String tag;
    public final FieldAccessor accessor;
    /** Field names from the record down to this field, e.g. [audit, createdAt]. */
    public final List<String> path;

    public FieldDescriptor(String name, Class<?> type, Type genericType, String tag,
                           FieldAccessor accessor, List<String> path) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.genericType = genericType == null ? type : genericType;
        this.tag = tag == null ? "" : tag;
        this.accessor = Objects.requireNonNull(accessor, "accessor");
        this.path = Collections.unmodifiableList(path);
    }

    public boolean isEmbedded() {
        return path.size() > 1;
    }

    @Override
    public String toString() {
        return String.join(".", path);
    }
}
