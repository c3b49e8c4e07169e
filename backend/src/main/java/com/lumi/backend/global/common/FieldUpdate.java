package com.lumi.backend.global.common;

import java.util.Objects;

/**
 * Describes how a nullable column should change: left alone, cleared, or set to a new value.
 * Instances come only from {@link #keep()}, {@link #clear()} and {@link #setTo(Object)}.
 *
 * @param <T> column value type
 */
public abstract class FieldUpdate<T> {

    private FieldUpdate() {
    }

    public abstract T applyTo(T current);

    public static <T> FieldUpdate<T> keep() {
        return new Keep<>();
    }

    public static <T> FieldUpdate<T> clear() {
        return new Clear<>();
    }

    public static <T> FieldUpdate<T> setTo(T value) {
        return new SetTo<>(value);
    }

    private static final class Keep<T> extends FieldUpdate<T> {
        @Override
        public T applyTo(T current) {
            return current;
        }
    }

    private static final class Clear<T> extends FieldUpdate<T> {
        @Override
        public T applyTo(T current) {
            return null;
        }
    }

    private static final class SetTo<T> extends FieldUpdate<T> {

        private final T value;

        private SetTo(T value) {
            this.value = Objects.requireNonNull(value, "value must not be null; use FieldUpdate.clear()");
        }

        @Override
        public T applyTo(T current) {
            return value;
        }
    }
}
