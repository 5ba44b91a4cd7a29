// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conslist.collection.list;

import conslist.collection.EmptyAccessException;

/**
 * The empty list.
 * <p>
 * There is exactly one instance, shared between all element types; obtain it with {@link ConsList#empty()}.
 *
 * @param <T> the type of elements this list pretends to contain
 */
public final class Nil<T> extends ConsList<T> {
    private Nil() {
    }

    @SuppressWarnings("unchecked")
    static <T> Nil<T> instance() {
        return (Nil<T>) instance;
    }

    /**
     * Always throws, the empty list has no head.
     *
     * @throws EmptyAccessException always
     */
    @Override
    public T head() {
        throw emptyAccess("head");
    }

    /**
     * Always throws, the empty list has no tail.
     *
     * @throws EmptyAccessException always
     */
    @Override
    public ConsList<T> tail() {
        throw emptyAccess("tail");
    }

    @Override
    public boolean isEmpty() {
        return true;
    }

    private static final Nil<?> instance = new Nil<>();
}
