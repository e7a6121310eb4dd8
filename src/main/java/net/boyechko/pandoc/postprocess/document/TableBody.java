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

public record TableBody(
        Attr attr, int rowHeadColumns, List<Row> head, List<Row> body, SourceRange range) {
    public TableBody {
        head = List.copyOf(head);
        body = List.copyOf(body);
    }

    public TableBody withRows(List<Row> newHead, List<Row> newBody) {
        return new TableBody(attr, rowHeadColumns, newHead, newBody, range);
    }
}
