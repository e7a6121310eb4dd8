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

public record ListAttributes(int start, Style style, Delimiter delimiter) {
    public static final ListAttributes DEFAULT =
            new ListAttributes(1, Style.DEFAULT, Delimiter.DEFAULT);

    public enum Style {
        DEFAULT,
        EXAMPLE,
        DECIMAL,
        LOWER_ROMAN,
        UPPER_ROMAN,
        LOWER_ALPHA,
        UPPER_ALPHA
    }

    public enum Delimiter {
        DEFAULT,
        PERIOD,
        ONE_PAREN,
        TWO_PARENS
    }
}
