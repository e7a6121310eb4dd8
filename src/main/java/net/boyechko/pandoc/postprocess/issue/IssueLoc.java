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
package net.boyechko.pandoc.postprocess.issue;

import net.boyechko.pandoc.postprocess.document.SourceRange;

/** Where in the source an issue was found. */
public sealed interface IssueLoc {
    record None() implements IssueLoc {}

    record AtRange(SourceRange range) implements IssueLoc {}

    static IssueLoc none() {
        return new None();
    }

    static IssueLoc at(SourceRange range) {
        return range == null || range.isEmpty() ? none() : new AtRange(range);
    }

    /** Returns the source range if available, null otherwise. */
    default SourceRange range() {
        if (this instanceof AtRange at) {
            return at.range();
        }
        return null;
    }

    /** Start offset used for ordering; locationless issues sort first. */
    default int sortKey() {
        SourceRange range = range();
        return range != null ? range.start() : -1;
    }
}
