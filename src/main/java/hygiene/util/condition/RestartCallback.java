// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.util.condition;

/**
 * The body executed under a restart point; receives the restart so that handlers established inside can target it.
 */
@FunctionalInterface
public interface RestartCallback<T> {
    T call(Restart restart);
}
