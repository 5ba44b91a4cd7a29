// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conslist.collection.list;

/**
 * Thrown by {@link ConsList#zipWith} when the two lists don't have the same size.
 */
public final class LengthMismatchException extends IllegalArgumentException {
    public LengthMismatchException(final int leftSize, final int rightSize) {
        super("Lists do not have the same length: " + leftSize + " and " + rightSize);
        this.leftSize = leftSize;
        this.rightSize = rightSize;
    }

    /**
     * Returns the size of the list {@code zipWith} was called on.
     */
    public int leftSize() {
        return leftSize;
    }

    /**
     * Returns the size of the list passed to {@code zipWith}.
     */
    public int rightSize() {
        return rightSize;
    }

    private static final long serialVersionUID = 1L;

    private final int leftSize;
    private final int rightSize;
}
