// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conslist.collection;

import java.util.NoSuchElementException;

/**
 * Thrown when an element is requested from a collection that holds none, such as the head of an empty list or the
 * value of an empty maybe.
 * <p>
 * This is a precondition violation: callers are expected to check for emptiness first, or use the variants of the
 * accessors that return a {@link conslist.collection.maybe.Maybe} instead.
 */
public final class EmptyAccessException extends NoSuchElementException {
    /**
     * Initializes a new exception reporting that the given operation was invoked on an empty collection of the given
     * kind, e.g. {@code "head called on an empty list"}.
     */
    public EmptyAccessException(final String operation, final String collectionKind) {
        super(operation + " called on an empty " + collectionKind);
        this.operation = operation;
    }

    /**
     * Returns the name of the operation that failed.
     */
    public String operation() {
        return operation;
    }

    private static final long serialVersionUID = 1L;

    private final String operation;
}
