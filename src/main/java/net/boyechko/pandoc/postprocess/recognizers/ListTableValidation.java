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
package net.boyechko.pandoc.postprocess.recognizers;

import net.boyechko.pandoc.postprocess.document.SourceRange;

/** Result of checking whether a Div is a well-formed list-table. */
public sealed interface ListTableValidation {
    record Valid() implements ListTableValidation {}

    /** The Div does not carry the {@code list-table} class; not a problem. */
    record NotListTable() implements ListTableValidation {}

    record Invalid(String reason, SourceRange location) implements ListTableValidation {}

    static ListTableValidation valid() {
        return new Valid();
    }

    static ListTableValidation notListTable() {
        return new NotListTable();
    }

    static ListTableValidation invalid(String reason, SourceRange location) {
        return new Invalid(reason, location);
    }
}
