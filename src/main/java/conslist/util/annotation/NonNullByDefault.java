// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package conslist.util.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import javax.annotation.Nonnull;
import javax.annotation.meta.TypeQualifierDefault;

/**
 * Declares that fields, method return values and parameters in the annotated package or class are non-nullable
 * unless marked otherwise.
 * <p>
 * Element types of lists and maybes are left to the caller: a {@code ConsList<@Nullable String>} is perfectly valid.
 * Locally override the default with {@link org.checkerframework.checker.nullness.qual.Nullable}.
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target({ElementType.PACKAGE, ElementType.TYPE})
@TypeQualifierDefault({
    ElementType.FIELD,
    ElementType.METHOD,
    ElementType.PARAMETER,
})
@Nonnull
public @interface NonNullByDefault {
}
