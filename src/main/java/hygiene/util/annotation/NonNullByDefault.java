// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.util.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import javax.annotation.Nonnull;
import javax.annotation.meta.TypeQualifierDefault;

/**
 * Declares every field, method, parameter and record component of the annotated package or class non-nullable,
 * unless explicitly marked with {@link org.checkerframework.checker.nullness.qual.Nullable}.
 * <p>
 * Every package of this library carries this annotation in its {@code package-info.java}. Syntax trees never contain
 * {@code null}: absence is represented by the empty list, by {@code void} or by a missing source location, and only
 * the last one is ever modelled as a nullable reference.
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target({ElementType.PACKAGE, ElementType.TYPE})
@TypeQualifierDefault({
    ElementType.FIELD,
    ElementType.METHOD,
    ElementType.PARAMETER,
    ElementType.RECORD_COMPONENT,
})
@Nonnull
public @interface NonNullByDefault {
}
