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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Parsed document: metadata plus the top-level block sequence. Rewritten in place. */
public final class Document {
    private final Map<String, MetaValue> meta;
    private List<Block> blocks;

    public Document(List<Block> blocks) {
        this(new LinkedHashMap<>(), blocks);
    }

    public Document(Map<String, MetaValue> meta, List<Block> blocks) {
        this.meta = new LinkedHashMap<>(meta);
        this.blocks = new ArrayList<>(blocks);
    }

    public Map<String, MetaValue> meta() {
        return meta;
    }

    public List<Block> blocks() {
        return blocks;
    }

    public void setBlocks(List<Block> newBlocks) {
        this.blocks = new ArrayList<>(newBlocks);
    }

    public Document copy() {
        return new Document(meta, blocks);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document other)) return false;
        return meta.equals(other.meta) && blocks.equals(other.blocks);
    }

    @Override
    public int hashCode() {
        return 31 * meta.hashCode() + blocks.hashCode();
    }

    @Override
    public String toString() {
        return "Document[meta=" + meta.keySet() + ", blocks=" + blocks.size() + "]";
    }
}
