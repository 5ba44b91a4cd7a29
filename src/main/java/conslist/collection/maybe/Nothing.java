// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conslist.collection.maybe;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import conslist.collection.EmptyAccessException;

/**
 * The empty maybe. There is exactly one instance, obtained with {@link Maybe#nothing()}; equality is identity.
 *
 * @param <T> the type of the value this maybe pretends to hold
 */
public final class Nothing<T> extends Maybe<T> {
    private Nothing() {
    }

    @SuppressWarnings("unchecked")
    static <T> Nothing<T> instance() {
        return (Nothing<T>) instance;
    }

    @Override
    public boolean isEmpty() {
        return true;
    }

    @Override
    public T get() {
        throw new EmptyAccessException("get", "maybe");
    }

    @Override
    public T orElse(final T other) {
        return other;
    }

    @Override
    public T orElseGet(final Supplier<? extends T> supplier) {
        return supplier.get();
    }

    @Override
    public void ifPresent(final Consumer<? super T> action) {
        Objects.requireNonNull(action);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <U> Maybe<U> map(final Function<? super T, ? extends U> function) {
        Objects.requireNonNull(function); // Check eagerly even though we never call it.
        return (Nothing<U>) this;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <U> Maybe<U> flatMap(final Function<? super T, ? extends Maybe<? extends U>> function) {
        Objects.requireNonNull(function);
        return (Nothing<U>) this;
    }

    @Override
    public Maybe<T> filter(final Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate);
        return this;
    }

    @Override
    public String toString() {
        return "Nothing";
    }

    private static final Nothing<?> instance = new Nothing<>();
}
