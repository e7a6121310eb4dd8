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
package net.boyechko.pandoc.postprocess.document;

import java.util.List;

/** Table or figure caption; {@code shortCaption} is null when absent. */
public record Caption(List<Inline> shortCaption, List<Block> longCaption, SourceRange range) {
    public Caption {
        shortCaption = shortCaption != null ? List.copyOf(shortCaption) : null;
        longCaption = List.copyOf(longCaption);
        range = range != null ? range : SourceRange.EMPTY;
    }

    public static Caption empty() {
        return new Caption(null, List.of(), SourceRange.EMPTY);
    }

    public static Caption of(List<Block> longCaption, SourceRange range) {
        return new Caption(null, longCaption, range);
    }

    public boolean isEmpty() {
        return shortCaption == null && longCaption.isEmpty();
    }
}
