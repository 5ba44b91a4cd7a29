// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The persistent singly-linked list, {@link conslist.collection.list.ConsList}, and its two variants.
 */
@NonNullByDefault
package conslist.collection.list;

import conslist.util.annotation.NonNullByDefault;
