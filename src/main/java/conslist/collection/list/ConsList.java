// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conslist.collection.list;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import conslist.collection.EmptyAccessException;
import conslist.collection.maybe.Maybe;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A persistent (immutable) singly-linked list. A list is either {@link Nil}, the empty list, or a {@link Cons} cell
 * holding the first element and the list of remaining elements. No other variants exist.
 * <p>
 * There are no restrictions on what elements are permitted. {@code null} is allowed, just like any other possible
 * element.
 * <p>
 * Every operation leaves the receiver untouched and returns a new list. New lists share existing cells wherever the
 * result allows it: {@link #prepended(Object)} shares the whole receiver, {@link #concat(ConsList)} shares its
 * argument. Since no list is ever mutated after construction, sharing is unobservable, and any list may be read by
 * multiple threads without synchronization.
 * <p>
 * Java has no declaration-site variance, so a {@code ConsList<Integer>} is not a {@code ConsList<Number>}. Methods
 * accept lists and functions with the appropriate wildcards, and {@link #narrow(ConsList)} re-types a list of a
 * subtype as a list of its supertype without copying.
 * <p>
 * All traversals are iterative, so stack usage doesn't depend on the length of the list. Functions passed to the
 * higher-order methods are invoked in head-to-tail order, at most once per element. Exceptions they throw are passed
 * through to the caller.
 * <p>
 * Immutability is shallow: it doesn't extend to the elements themselves. Prefer element types which are immutable
 * themselves.
 *
 * @param <T> the type of elements in this list
 */
public abstract sealed class ConsList<T> implements Iterable<T> permits Nil, Cons {
    ConsList() {
    }

    /**
     * Returns the empty list pretending to contain objects of the given type.
     * <p>
     * The empty list is a single shared instance, but relying on identity-based operations such as synchronization
     * is discouraged.
     * <p>
     * Complexity: constant time.
     */
    public static <T> ConsList<T> empty() {
        return Nil.instance();
    }

    /**
     * Returns a new list with the given head and tail.
     * <p>
     * Complexity: constant time.
     */
    public static <T> Cons<T> cons(final T head, final ConsList<? extends T> tail) {
        return new Cons<>(head, narrow(tail));
    }

    /**
     * Returns a new list containing the given elements, in order.
     * <p>
     * Complexity: linear time.
     */
    @SafeVarargs
    public static <T> ConsList<T> of(final T... elements) {
        ConsList<T> result = empty();
        for (int i = elements.length - 1; i >= 0; i -= 1) {
            result = new Cons<>(elements[i], result);
        }
        return result;
    }

    /**
     * Returns a list containing the elements of the given iterable in iteration order.
     * <p>
     * Complexity: constant time if the iterable is already a {@code ConsList}, linear time otherwise.
     */
    public static <T> ConsList<T> fromIterable(final Iterable<? extends T> iterable) {
        if (iterable instanceof ConsList<? extends T> list) {
            return narrow(list);
        }
        final var builder = new Builder<T>();
        builder.appendAll(iterable);
        return builder.toConsList();
    }

    /**
     * Returns the given list, typed as a list of a supertype of its element type.
     * <p>
     * Complexity: constant time.
     */
    @SuppressWarnings("unchecked")
    public static <T> ConsList<T> narrow(final ConsList<? extends T> list) {
        return (ConsList<T>) list; // This cast is fine because lists are immutable.
    }

    /**
     * Returns the first element of this list.
     * <p>
     * Complexity: constant time.
     *
     * @throws EmptyAccessException if this list is empty
     * @see #headOption()
     */
    public abstract T head();

    /**
     * Returns the list of all elements of this list except the first.
     * <p>
     * Complexity: constant time.
     *
     * @throws EmptyAccessException if this list is empty
     * @see #tailOption()
     */
    public abstract ConsList<T> tail();

    /**
     * Returns {@code true} iff this list is {@link Nil}.
     * <p>
     * Complexity: constant time.
     */
    public abstract boolean isEmpty();

    /**
     * Returns the first element of this list, or nothing if this list is empty.
     * <p>
     * Complexity: constant time.
     */
    @CheckReturnValue
    public final Maybe<T> headOption() {
        return (this instanceof Cons<T> cons) ? Maybe.just(cons.head) : Maybe.nothing();
    }

    /**
     * Returns the tail of this list, or nothing if this list is empty.
     * <p>
     * Complexity: constant time.
     */
    @CheckReturnValue
    public final Maybe<ConsList<T>> tailOption() {
        return (this instanceof Cons<T> cons) ? Maybe.just(cons.tail) : Maybe.nothing();
    }

    /**
     * Returns the number of elements in this list.
     * <p>
     * Complexity: linear time.
     */
    public final int size() {
        int size = 0;
        ConsList<T> rest = this;
        while (rest instanceof Cons<T> cons) {
            size += 1;
            rest = cons.tail;
        }
        return size;
    }

    /**
     * Returns a new list with the given element as its head and this list as its tail.
     * <p>
     * To prepend an element of a supertype, {@linkplain #narrow(ConsList) narrow} this list first.
     * <p>
     * Complexity: constant time.
     */
    @CheckReturnValue
    public final Cons<T> prepended(final T element) {
        return new Cons<>(element, this);
    }

    /**
     * Returns a new list containing the results of applying the given function to the elements of this list, in
     * order.
     * <p>
     * Complexity: linear time.
     */
    @CheckReturnValue
    public final <U> ConsList<U> map(final Function<? super T, ? extends U> transformer) {
        Objects.requireNonNull(transformer);
        final var builder = new Builder<U>();
        ConsList<T> rest = this;
        while (rest instanceof Cons<T> cons) {
            builder.append(transformer.apply(cons.head));
            rest = cons.tail;
        }
        return builder.toConsList();
    }

    /**
     * Returns a list containing only the elements of this list that satisfy the given predicate, in their original
     * order.
     * <p>
     * If every element satisfies the predicate, this list itself is returned.
     * <p>
     * Complexity: linear time.
     */
    @CheckReturnValue
    public final ConsList<T> filter(final Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate);
        final var builder = new Builder<T>();
        boolean dropped = false;
        ConsList<T> rest = this;
        while (rest instanceof Cons<T> cons) {
            if (predicate.test(cons.head)) {
                builder.append(cons.head);
            } else {
                dropped = true;
            }
            rest = cons.tail;
        }
        return dropped ? builder.toConsList() : this;
    }

    /**
     * Returns a list containing the elements of this list followed by the elements of the given list.
     * <p>
     * The cells of this list are copied, the given list becomes the tail of the result as-is. The empty list is the
     * identity of concatenation on both sides.
     * <p>
     * Complexity: linear in the size of this list.
     */
    @CheckReturnValue
    public final ConsList<T> concat(final ConsList<? extends T> other) {
        Objects.requireNonNull(other);
        final var builder = new Builder<T>();
        builder.appendAll(this);
        return builder.buildOnto(narrow(other));
    }

    /**
     * Returns the concatenation, in order, of the lists obtained by applying the given function to each element of
     * this list.
     * <p>
     * Complexity: linear in the size of the result plus the size of this list.
     *
     * @throws NullPointerException if the function returns {@code null}
     */
    @CheckReturnValue
    public final <U> ConsList<U> flatMap(final Function<? super T, ? extends ConsList<? extends U>> transformer) {
        Objects.requireNonNull(transformer);
        final var builder = new Builder<U>();
        ConsList<T> rest = this;
        while (rest instanceof Cons<T> cons) {
            final var part = transformer.apply(cons.head);
            builder.appendAll(Objects.requireNonNull(part, "flatMap function returned null"));
            rest = cons.tail;
        }
        return builder.toConsList();
    }

    /**
     * Performs the given action on each element of this list, from head to tail.
     * <p>
     * Complexity: linear time.
     */
    @Override
    public final void forEach(final Consumer<? super T> action) {
        Objects.requireNonNull(action); // Check eagerly in case we're empty.
        ConsList<T> rest = this;
        while (rest instanceof Cons<T> cons) {
            action.accept(cons.head);
            rest = cons.tail;
        }
    }

    /**
     * Returns a list containing the elements of this list sorted according to the given comparator.
     * <p>
     * This is an insertion sort: the tail is sorted first, then the head is inserted immediately before the first
     * element it compares less than or equal to. Elements that compare equal therefore keep their relative order,
     * i.e. the sort is stable. Any function returning a negative, zero or positive integer is accepted as the
     * comparator, such as {@code (x, y) -> x - y}.
     * <p>
     * Complexity: quadratic time.
     */
    @CheckReturnValue
    public final ConsList<T> sorted(final Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator);
        ConsList<T> sorted = empty();
        ConsList<T> rest = reversed();
        while (rest instanceof Cons<T> cons) {
            sorted = insertSorted(cons.head, sorted, comparator);
            rest = cons.tail;
        }
        return sorted;
    }

    /**
     * Returns a list of the results of applying the given function to pairs of elements at the same position in this
     * list and the given list.
     * <p>
     * Both lists must have the same size. The sizes are checked before the function is ever invoked, so there is never
     * a partial result.
     * <p>
     * Complexity: linear time.
     *
     * @throws LengthMismatchException if the lists have different sizes
     * @see #tryZipWith(ConsList, BiFunction)
     */
    @CheckReturnValue
    public final <U, R> ConsList<R> zipWith(
        final ConsList<? extends U> other,
        final BiFunction<? super T, ? super U, ? extends R> combiner
    ) {
        Objects.requireNonNull(combiner);
        final var size = size();
        final var otherSize = other.size();
        if (size != otherSize) {
            throw new LengthMismatchException(size, otherSize);
        }
        return zipWithImpl(ConsList.<U>narrow(other), combiner);
    }

    /**
     * Like {@link #zipWith(ConsList, BiFunction)}, but returns nothing instead of throwing when the lists have
     * different sizes.
     * <p>
     * Complexity: linear time.
     */
    @CheckReturnValue
    public final <U, R> Maybe<ConsList<R>> tryZipWith(
        final ConsList<? extends U> other,
        final BiFunction<? super T, ? super U, ? extends R> combiner
    ) {
        Objects.requireNonNull(combiner);
        if (size() != other.size()) {
            return Maybe.nothing();
        }
        final ConsList<R> zipped = zipWithImpl(ConsList.<U>narrow(other), combiner);
        return Maybe.just(zipped);
    }

    /**
     * Combines the elements of this list into a single value, starting with the given seed and applying the given
     * operator to the accumulated value and each element from head to tail.
     * <p>
     * For the list {@code [a b c]}, the result is {@code operator(operator(operator(seed, a), b), c)}.
     * <p>
     * Complexity: linear time.
     */
    public final <U> U fold(final U seed, final BiFunction<? super U, ? super T, ? extends U> operator) {
        Objects.requireNonNull(operator);
        U accumulator = seed;
        ConsList<T> rest = this;
        while (rest instanceof Cons<T> cons) {
            accumulator = operator.apply(accumulator, cons.head);
            rest = cons.tail;
        }
        return accumulator;
    }

    /**
     * Returns a list containing the elements of this list in reverse order.
     * <p>
     * Complexity: linear time.
     */
    @CheckReturnValue
    public final ConsList<T> reversed() {
        ConsList<T> result = empty();
        ConsList<T> rest = this;
        while (rest instanceof Cons<T> cons) {
            result = new Cons<>(cons.head, result);
            rest = cons.tail;
        }
        return result;
    }

    /**
     * Returns a new iterator over the elements of this list, from head to tail. The iterator doesn't support removal.
     * <p>
     * Complexity: constant time.
     */
    @Override
    public final Iterator<T> iterator() {
        return new Itr<>(this);
    }

    /**
     * Returns the hash code of this list, following the algorithm specified by {@link java.util.List#hashCode()}.
     * <p>
     * Complexity: linear time.
     */
    @Override
    public final int hashCode() {
        int hash = 1;
        ConsList<T> rest = this;
        while (rest instanceof Cons<T> cons) {
            hash = 31 * hash + Objects.hashCode(cons.head);
            rest = cons.tail;
        }
        return hash;
    }

    /**
     * Returns {@code true} iff the given object is a list of the same size, containing equal elements in the same
     * order.
     * <p>
     * Element equality is determined according to {@link Objects#equals(Object, Object)}.
     * <p>
     * Complexity: linear time.
     */
    @Override
    public final boolean equals(final @Nullable Object object) {
        if (!(object instanceof ConsList<?> other)) {
            return false;
        }
        ConsList<?> left = this;
        ConsList<?> right = other;
        while (left != right) {
            if (!(left instanceof Cons<?> leftCons && right instanceof Cons<?> rightCons)) {
                return false; // Exactly one of them is empty.
            }
            if (!Objects.equals(leftCons.head, rightCons.head)) {
                return false;
            }
            left = leftCons.tail;
            right = rightCons.tail;
        }
        return true;
    }

    /**
     * Returns a string representation of this list.
     * <p>
     * The string representation of a list consists of the string representations of its elements, separated by
     * single spaces, enclosed in square brackets: {@code [1 2 3]}. The empty list is represented as {@code []}.
     * <p>
     * Complexity: linear time.
     */
    @Override
    public final String toString() {
        final var builder = new StringBuilder();
        builder.append('[');
        ConsList<T> rest = this;
        while (rest instanceof Cons<T> cons) {
            builder.append(cons.head);
            rest = cons.tail;
            if (!rest.isEmpty()) {
                builder.append(' ');
            }
        }
        builder.append(']');
        return builder.toString();
    }

    static EmptyAccessException emptyAccess(final String operation) {
        throw new EmptyAccessException(operation, "list");
    }

    private <U, R> ConsList<R> zipWithImpl(
        final ConsList<U> other,
        final BiFunction<? super T, ? super U, ? extends R> combiner
    ) {
        final var builder = new Builder<R>();
        ConsList<T> left = this;
        ConsList<U> right = other;
        while (left instanceof Cons<T> leftCons && right instanceof Cons<U> rightCons) {
            builder.append(combiner.apply(leftCons.head, rightCons.head));
            left = leftCons.tail;
            right = rightCons.tail;
        }
        assert left.isEmpty() && right.isEmpty();
        return builder.toConsList();
    }

    private static <T> ConsList<T> insertSorted(
        final T element,
        final ConsList<T> sorted,
        final Comparator<? super T> comparator
    ) {
        final var prefix = new Builder<T>();
        ConsList<T> rest = sorted;
        while (rest instanceof Cons<T> cons && comparator.compare(element, cons.head) > 0) {
            prefix.append(cons.head);
            rest = cons.tail;
        }
        return prefix.buildOnto(new Cons<>(element, rest));
    }

    /**
     * A builder of lists, allowing efficient construction of a list in head-to-tail order.
     * <p>
     * The builder is mutable, and so not thread-safe.
     */
    public static final class Builder<T> {
        /**
         * Initializes a new, empty list builder.
         */
        public Builder() {
        }

        /**
         * Appends a new element to the list this builder represents.
         * <p>
         * Complexity: amortized constant time.
         */
        public void append(final T element) {
            buffer.add(element);
        }

        /**
         * Appends all elements of the given iterable to the list this builder represents, in iteration order.
         * <p>
         * Complexity: linear in the number of appended elements.
         */
        public void appendAll(final Iterable<? extends T> elements) {
            for (final var element : elements) {
                buffer.add(element);
            }
        }

        /**
         * Returns a new list containing the elements appended so far.
         * <p>
         * The state of the builder remains unchanged.
         * <p>
         * Complexity: linear time.
         */
        @CheckReturnValue
        public ConsList<T> toConsList() {
            return buildOnto(empty());
        }

        ConsList<T> buildOnto(final ConsList<T> tail) {
            ConsList<T> result = tail;
            for (int i = buffer.size() - 1; i >= 0; i -= 1) {
                result = new Cons<>(buffer.get(i), result);
            }
            return result;
        }

        private final ArrayList<T> buffer = new ArrayList<>();
    }

    private static final class Itr<T> implements Iterator<T> {
        private Itr(final ConsList<T> list) {
            rest = list;
        }

        @Override
        public boolean hasNext() {
            return !rest.isEmpty();
        }

        @Override
        public T next() {
            if (!(rest instanceof Cons<T> cons)) {
                throw new NoSuchElementException("Iterator has no more elements");
            }
            rest = cons.tail;
            return cons.head;
        }

        private ConsList<T> rest;
    }
}
