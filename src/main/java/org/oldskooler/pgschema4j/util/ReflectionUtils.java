package org.oldskooler.pgschema4j.util;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public final class ReflectionUtils {
    private ReflectionUtils() {}

    /** Instance fields of the class and its superclasses, superclass fields first. */
    public static List<Field> getInstanceFields(Class<?> c) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> k = c; k != null && k != Object.class; k = k.getSuperclass()) {
            hierarchy.push(k);
        }

        ArrayList<Field> out = new ArrayList<>();
        for (Class<?> k : hierarchy) {
            for (Field f : k.getDeclaredFields()) {
                if (Modifier.isStatic(f.getModifiers()) || f.isSynthetic()) continue;
                out.add(f);
            }
        }
        return out;
    }

    public static <T> Constructor<T> noArgConstructor(Class<T> type) {
        try {
            Constructor<T> ctor = type.getDeclaredConstructor();
            ctor.setAccessible(true);
            return ctor;
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("No no-arg constructor on " + type.getName(), e);
        }
    }

    public static <T> T newInstance(Constructor<T> ctor) {
        try {
            return ctor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot instantiate " + ctor.getDeclaringClass().getName(), e);
        }
    }

    public static Object getField(Object target, Field f) {
        try {
            return f.get(target);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read field " + f.getName(), e);
        }
    }

    public static void setField(Object target, Field f, Object val) {
        try {
            f.set(target, val);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot write field " + f.getName(), e);
        }
    }
}
