// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Persistent (immutable) collections: a singly-linked {@link conslist.collection.list.ConsList} and a zero-or-one
 * element {@link conslist.collection.maybe.Maybe}.
 */
@NonNullByDefault
package conslist.collection;

import conslist.util.annotation.NonNullByDefault;
