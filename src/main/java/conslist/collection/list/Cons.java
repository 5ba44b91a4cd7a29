// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conslist.collection.list;

/**
 * A non-empty list: a head element followed by the list of remaining elements.
 * <p>
 * Callers that need to destructure a list can test for this class with {@code instanceof} and read its components
 * directly:
 * <pre>{@code
 * if (list instanceof Cons<Integer> cons && cons.tail().isEmpty()) {
 *     return "Single element " + cons.head();
 * }
 * }</pre>
 *
 * @param <T> the type of elements in this list
 */
public final class Cons<T> extends ConsList<T> {
    Cons(final T head, final ConsList<T> tail) {
        this.head = head;
        this.tail = tail;
    }

    @Override
    public T head() {
        return head;
    }

    @Override
    public ConsList<T> tail() {
        return tail;
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    final T head;
    final ConsList<T> tail;
}
