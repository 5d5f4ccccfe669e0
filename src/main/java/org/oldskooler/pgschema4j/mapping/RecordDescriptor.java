package org.oldskooler.pgschema4j.mapping;

import org.oldskooler.pgschema4j.annotations.Pg;
import org.oldskooler.pgschema4j.exceptions.AnnotationException;
import org.oldskooler.pgschema4j.util.ReflectionUtils;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.time.temporal.Temporal;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The mapped fields of a record type, resolved once. Fields of embedded values are
 * flattened in declaration order and reached through nested accessors.
 */
public final class RecordDescriptor<T> {
    private static final Map<Class<?>, RecordDescriptor<?>> REFLECTED = new ConcurrentHashMap<>();

    public final Class<T> type;
    public final List<FieldDescriptor> fields;
    private final Supplier<T> factory;

    RecordDescriptor(Class<T> type, List<FieldDescriptor> fields, Supplier<T> factory) {
        this.type = Objects.requireNonNull(type, "type");
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.factory = factory;
    }

    public T newInstance() {
        if (factory == null) {
            throw new IllegalStateException("No factory registered for " + type.getName());
        }
        return factory.get();
    }

    /**
     * Descriptor built from the {@link Pg} annotations of {@code type}, cached per type.
     */
    @SuppressWarnings("unchecked")
    public static <T> RecordDescriptor<T> of(Class<T> type) {
        return (RecordDescriptor<T>) REFLECTED.computeIfAbsent(type, RecordDescriptor::reflect);
    }

    public static <T> Builder<T> builder(Class<T> type, Supplier<T> factory) {
        return new Builder<>(type, factory, Collections.emptyList());
    }

    private static <T> RecordDescriptor<T> reflect(Class<T> type) {
        List<FieldDescriptor> out = new ArrayList<>();
        Set<Class<?>> walking = new HashSet<>();
        walking.add(type);
        collect(type, Collections.emptyList(), null, null, walking, out);
        Supplier<T> factory = lazyFactory(type);
        return new RecordDescriptor<>(type, out, factory);
    }

    /**
     * @param walking the types on the current embedding path; an untagged field pointing
     *                back into it is skipped, a tagged one is an error
     */
    private static void collect(Class<?> type, List<String> path, FieldAccessor parent,
                                Supplier<?> parentFactory, Set<Class<?>> walking, List<FieldDescriptor> out) {
        for (Field f : ReflectionUtils.getInstanceFields(type)) {
            Pg pg = f.getAnnotation(Pg.class);
            String tag = pg == null ? "" : pg.value().trim();
            if (Pg.SKIP.equals(tag)) continue;

            List<String> fieldPath = new ArrayList<>(path);
            fieldPath.add(f.getName());

            FieldAccessor accessor = FieldAccessor.reflective(f);
            if (parent != null) {
                accessor = FieldAccessor.nested(parent, accessor, parentFactory);
            }

            Class<?> ft = f.getType();
            if (isComposite(ft) && !isJsonTag(tag) && (!tag.isEmpty() || declaresColumns(ft))) {
                if (walking.contains(ft)) {
                    if (tag.isEmpty()) continue;
                    throw new AnnotationException(type.getName() + "." + f.getName()
                            + ": embedded type " + ft.getName() + " contains itself");
                }

                List<FieldDescriptor> nested = new ArrayList<>();
                walking.add(ft);
                try {
                    collect(ft, fieldPath, accessor, lazyFactory(ft), walking, nested);
                } finally {
                    walking.remove(ft);
                }
                if (!nested.isEmpty()) {
                    if (!ColumnTagParser.isEnabled(tag, "presenter")) {
                        out.addAll(nested);
                    }
                    continue;
                }
            }

            if (tag.isEmpty()) continue;

            out.add(new FieldDescriptor(f.getName(), f.getType(), f.getGenericType(), tag, accessor, fieldPath));
        }
    }

    private static <E> Supplier<E> lazyFactory(Class<E> type) {
        return () -> {
            Constructor<E> ctor = ReflectionUtils.noArgConstructor(type);
            return ReflectionUtils.newInstance(ctor);
        };
    }

    private static boolean isJsonTag(String tag) {
        for (ColumnTagParser.Option o : ColumnTagParser.tokenize(tag)) {
            if (o.key.equals("type")) return DataType.parse(o.value).type.isJson();
        }
        return false;
    }

    /** True if {@code c} has a field annotated with anything but {@code -}. */
    static boolean declaresColumns(Class<?> c) {
        for (Field f : ReflectionUtils.getInstanceFields(c)) {
            Pg pg = f.getAnnotation(Pg.class);
            if (pg != null && !pg.value().trim().isEmpty() && !Pg.SKIP.equals(pg.value().trim())) return true;
        }
        return false;
    }

    /** Types whose annotated fields are inlined into the owning record. */
    static boolean isComposite(Class<?> c) {
        if (c.isPrimitive() || c.isArray() || c.isEnum() || c.isInterface()) return false;
        if (Temporal.class.isAssignableFrom(c) || Date.class.isAssignableFrom(c)) return false;
        String name = c.getName();
        return !name.startsWith("java.") && !name.startsWith("javax.");
    }

    /** Explicit descriptor construction for records that are not annotated. */
    public static final class Builder<T> {
        private final Class<T> type;
        private final Supplier<T> factory;
        private final List<String> prefix;
        private final List<FieldDescriptor> fields = new ArrayList<>();

        private Builder(Class<T> type, Supplier<T> factory, List<String> prefix) {
            this.type = type;
            this.factory = factory;
            this.prefix = prefix;
        }

        public <V> Builder<T> field(String name, Class<V> fieldType, String tag,
                                    Function<T, V> getter, BiConsumer<T, V> setter) {
            List<String> path = new ArrayList<>(prefix);
            path.add(name);
            fields.add(new FieldDescriptor(name, fieldType, fieldType, tag,
                    FieldAccessor.of(getter, setter), path));
            return this;
        }

        /** Inlines the fields declared by {@code nested} for an embedded value. */
        public <E> Builder<T> embed(String name, Class<E> embeddedType,
                                    Function<T, E> getter, BiConsumer<T, E> setter, Supplier<E> embeddedFactory,
                                    Consumer<Builder<E>> nested) {
            List<String> path = new ArrayList<>(prefix);
            path.add(name);
            Builder<E> inner = new Builder<>(embeddedType, embeddedFactory, path);
            nested.accept(inner);

            FieldAccessor parent = FieldAccessor.of(getter, setter);
            for (FieldDescriptor fd : inner.fields) {
                fields.add(new FieldDescriptor(fd.name, fd.type, fd.genericType, fd.tag,
                        FieldAccessor.nested(parent, fd.accessor, embeddedFactory), fd.path));
            }
            return this;
        }

        public RecordDescriptor<T> build() {
            return new RecordDescriptor<>(type, fields, factory);
        }
    }
}
