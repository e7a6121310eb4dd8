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

/** Horizontal alignment of a table column or cell. */
public enum Alignment {
    LEFT,
    CENTER,
    RIGHT,
    DEFAULT;

    /** Maps the list-table codes {@code l}, {@code c} and {@code r}; anything else is DEFAULT. */
    public static Alignment fromCode(String code) {
        if (code == null) {
            return DEFAULT;
        }
        return switch (code.trim()) {
            case "l" -> LEFT;
            case "c" -> CENTER;
            case "r" -> RIGHT;
            default -> DEFAULT;
        };
    }
}
