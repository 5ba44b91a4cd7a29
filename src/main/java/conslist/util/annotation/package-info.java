// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Nullness annotations shared by the whole library.
 */
package conslist.util.annotation;
