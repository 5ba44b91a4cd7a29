// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conslist.collection.maybe;

import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import conslist.collection.EmptyAccessException;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable container of at most one value: either {@link Just} a value, or {@link Nothing}.
 * <p>
 * Unlike {@link java.util.Optional}, a maybe can hold {@code null}: {@code Maybe.just(null)} is a present value, only
 * {@link #ofNullable(Object)} maps {@code null} to nothing.
 * <p>
 * The higher-order methods never increase the number of values: mapping, flat-mapping and filtering always produce
 * nothing from nothing. Exceptions thrown by the functions passed to them are passed through to the caller.
 *
 * @param <T> the type of the value
 */
public abstract sealed class Maybe<T> permits Nothing, Just {
    Maybe() {
    }

    /**
     * Returns a maybe holding the given value.
     */
    public static <T> Maybe<T> just(final T value) {
        return new Just<>(value);
    }

    /**
     * Returns the empty maybe pretending to hold a value of the given type.
     */
    public static <T> Maybe<T> nothing() {
        return Nothing.instance();
    }

    /**
     * Returns nothing if the given value is {@code null}, a maybe holding the given value otherwise.
     */
    public static <T> Maybe<T> ofNullable(final @Nullable T value) {
        return (value != null) ? just(value) : nothing();
    }

    /**
     * Returns {@code true} iff this maybe is {@link Nothing}.
     */
    public abstract boolean isEmpty();

    /**
     * Returns the value held by this maybe.
     *
     * @throws EmptyAccessException if this maybe is nothing
     */
    public abstract T get();

    /**
     * Returns the value held by this maybe, or the given value if this maybe is nothing.
     */
    public abstract T orElse(T other);

    /**
     * Returns the value held by this maybe, or the result of calling the given supplier if this maybe is nothing.
     * The supplier is not called otherwise.
     */
    public abstract T orElseGet(Supplier<? extends T> supplier);

    /**
     * Performs the given action on the value held by this maybe, if any.
     */
    public abstract void ifPresent(Consumer<? super T> action);

    /**
     * Returns a maybe holding the result of applying the given function to the value of this maybe, or nothing if
     * this maybe is nothing.
     */
    @CheckReturnValue
    public abstract <U> Maybe<U> map(Function<? super T, ? extends U> function);

    /**
     * Returns the result of applying the given function to the value of this maybe, or nothing if this maybe is
     * nothing. The result of the function is returned as-is, it isn't wrapped again.
     *
     * @throws NullPointerException if the function returns {@code null}
     */
    @CheckReturnValue
    public abstract <U> Maybe<U> flatMap(Function<? super T, ? extends Maybe<? extends U>> function);

    /**
     * Returns this maybe if it holds a value satisfying the given predicate, nothing otherwise.
     */
    @CheckReturnValue
    public abstract Maybe<T> filter(Predicate<? super T> predicate);

    /**
     * Returns the given maybe, typed as a maybe of a supertype of its value type.
     */
    @SuppressWarnings("unchecked")
    public static <T> Maybe<T> narrow(final Maybe<? extends T> maybe) {
        return (Maybe<T>) maybe; // This cast is fine because maybes are immutable.
    }
}
