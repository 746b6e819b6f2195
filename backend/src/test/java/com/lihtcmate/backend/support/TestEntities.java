package com.lihtcmate.backend.support;

import java.lang.reflect.Field;
import java.util.UUID;

/**
 * Assigns generated ids to entities built outside a persistence context.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static <T> T withId(T entity, UUID id) {
        setField(entity, "id", id);
        return entity;
    }

    public static <T> T withRandomId(T entity) {
        return withId(entity, UUID.randomUUID());
    }

    public static void setField(Object target, String name, Object value) {
        Class<?> type = target.getClass();
        while (type != null) {
            try {
                Field field = type.getDeclaredField(name);
                field.setAccessible(true);
                field.set(target, value);
                return;
            } catch (NoSuchFieldException ex) {
                type = type.getSuperclass();
            } catch (IllegalAccessException ex) {
                throw new IllegalStateException(ex);
            }
        }
        throw new IllegalArgumentException("No field " + name + " on " + target.getClass().getName());
    }
}
