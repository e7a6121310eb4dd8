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

/**
 * Byte range of a node in its source file. Nodes created by a rewrite rather than the parser
 * carry {@link #EMPTY}.
 */
public record SourceRange(int fileId, int start, int end) {
    public static final SourceRange EMPTY = new SourceRange(-1, 0, 0);

    public SourceRange {
        if (fileId >= 0 && end < start) {
            throw new IllegalArgumentException(
                    "Range end " + end + " precedes start " + start);
        }
    }

    public static SourceRange of(int start, int end) {
        return new SourceRange(0, start, end);
    }

    public boolean isEmpty() {
        return fileId < 0;
    }

    /** Returns the smallest range covering both ranges; an empty range contributes nothing. */
    public SourceRange combine(SourceRange other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return new SourceRange(fileId, Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public String toString() {
        return isEmpty() ? "@-" : "@" + start + "-" + end;
    }
}
