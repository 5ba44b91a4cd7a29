// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conslist.collection.maybe;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A maybe holding exactly one value, which may be {@code null}.
 *
 * @param <T> the type of the value
 */
public final class Just<T> extends Maybe<T> {
    Just(final T value) {
        this.value = value;
    }

    /**
     * Returns the value. Unlike {@link #get()}, this can never fail.
     */
    public T value() {
        return value;
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public T get() {
        return value;
    }

    @Override
    public T orElse(final T other) {
        return value;
    }

    @Override
    public T orElseGet(final Supplier<? extends T> supplier) {
        Objects.requireNonNull(supplier);
        return value;
    }

    @Override
    public void ifPresent(final Consumer<? super T> action) {
        action.accept(value);
    }

    @Override
    public <U> Maybe<U> map(final Function<? super T, ? extends U> function) {
        return new Just<>(function.apply(value));
    }

    @Override
    public <U> Maybe<U> flatMap(final Function<? super T, ? extends Maybe<? extends U>> function) {
        return narrow(Objects.requireNonNull(function.apply(value), "flatMap function returned null"));
    }

    @Override
    public Maybe<T> filter(final Predicate<? super T> predicate) {
        return predicate.test(value) ? this : nothing();
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public boolean equals(final @Nullable Object object) {
        return object instanceof Just<?> other && Objects.equals(value, other.value);
    }

    @Override
    public String toString() {
        return "Just(" + value + ")";
    }

    private final T value;
}
