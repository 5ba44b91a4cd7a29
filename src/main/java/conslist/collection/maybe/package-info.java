// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * {@link conslist.collection.maybe.Maybe}, a container of zero or one value.
 */
@NonNullByDefault
package conslist.collection.maybe;

import conslist.util.annotation.NonNullByDefault;
