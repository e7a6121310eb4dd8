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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Document metadata value. Inline and block values are rewritten like body content. */
public sealed interface MetaValue {
    record MetaString(String value) implements MetaValue {}

    record MetaBool(boolean value) implements MetaValue {}

    record MetaInlines(List<Inline> content) implements MetaValue {
        public MetaInlines {
            content = List.copyOf(content);
        }
    }

    record MetaBlocks(List<Block> content) implements MetaValue {
        public MetaBlocks {
            content = List.copyOf(content);
        }
    }

    record MetaList(List<MetaValue> items) implements MetaValue {
        public MetaList {
            items = List.copyOf(items);
        }
    }

    record MetaMap(Map<String, MetaValue> entries) implements MetaValue {
        public MetaMap {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }
}
