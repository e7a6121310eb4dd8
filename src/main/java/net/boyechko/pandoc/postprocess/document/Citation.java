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

/** One citation inside a Cite; {@code noteNum} is assigned during postprocessing. */
public record Citation(
        String id,
        List<Inline> prefix,
        List<Inline> suffix,
        Mode mode,
        int noteNum,
        int hash) {

    public enum Mode {
        NORMAL,
        AUTHOR_IN_TEXT,
        SUPPRESS_AUTHOR
    }

    public Citation {
        prefix = List.copyOf(prefix);
        suffix = List.copyOf(suffix);
    }

    public static Citation of(String id, Mode mode) {
        return new Citation(id, List.of(), List.of(), mode, 0, 0);
    }

    public Citation withNoteNum(int newNoteNum) {
        return new Citation(id, prefix, suffix, mode, newNoteNum, hash);
    }

    public Citation withPrefix(List<Inline> newPrefix) {
        return new Citation(id, newPrefix, suffix, mode, noteNum, hash);
    }

    public Citation withSuffix(List<Inline> newSuffix) {
        return new Citation(id, prefix, newSuffix, mode, noteNum, hash);
    }
}
