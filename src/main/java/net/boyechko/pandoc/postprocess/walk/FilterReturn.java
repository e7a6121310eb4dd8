/*
 * Pandoc-Postprocess - Canonicalizing rewrite passes for Pandoc document trees
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pandoc.postprocess.walk;

import java.util.List;

/**
 * Outcome of a callback. {@link Unchanged} keeps the node (possibly with rewritten fields) and
 * lets later callbacks see it; {@link Replaced} substitutes the given replacement and, when
 * {@code rescan} is set, has the walker process the replacement again.
 *
 * @param <T> type of a kept value
 * @param <R> type of a replacement
 */
public sealed interface FilterReturn<T, R> {
    record Unchanged<T, R>(T value) implements FilterReturn<T, R> {}

    record Replaced<T, R>(R replacement, boolean rescan) implements FilterReturn<T, R> {}

    static <T, R> FilterReturn<T, R> unchanged(T value) {
        return new Unchanged<>(value);
    }

    static <T, R> FilterReturn<T, R> replaced(R replacement, boolean rescan) {
        return new Replaced<>(replacement, rescan);
    }

    /** Replacement that is final; the walker will not revisit it. */
    static <T, R> FilterReturn<T, R> replaced(R replacement) {
        return new Replaced<>(replacement, false);
    }

    default boolean isUnchanged() {
        return this instanceof Unchanged;
    }
}
