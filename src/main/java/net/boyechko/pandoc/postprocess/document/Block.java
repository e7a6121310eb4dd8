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

/** Block-level node. Every block carries its source range. */
public sealed interface Block {

    NodeKind kind();

    SourceRange range();

    record Plain(List<Inline> content, SourceRange range) implements Block {
        public Plain {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.PLAIN;
        }

        public Plain withContent(List<Inline> newContent) {
            return new Plain(newContent, range);
        }
    }

    record Paragraph(List<Inline> content, SourceRange range) implements Block {
        public Paragraph {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.PARAGRAPH;
        }

        public Paragraph withContent(List<Inline> newContent) {
            return new Paragraph(newContent, range);
        }
    }

    record LineBlock(List<List<Inline>> lines, SourceRange range) implements Block {
        public LineBlock {
            lines = lines.stream().map(List::copyOf).toList();
        }

        public NodeKind kind() {
            return NodeKind.LINE_BLOCK;
        }
    }

    record Header(int level, Attr attr, List<Inline> content, SourceRange range)
            implements Block {
        public Header {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.HEADER;
        }

        public Header withAttr(Attr newAttr) {
            return new Header(level, newAttr, content, range);
        }

        public Header withContent(List<Inline> newContent) {
            return new Header(level, attr, newContent, range);
        }
    }

    record BlockQuote(List<Block> content, SourceRange range) implements Block {
        public BlockQuote {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.BLOCK_QUOTE;
        }
    }

    record BulletList(List<List<Block>> items, SourceRange range) implements Block {
        public BulletList {
            items = items.stream().map(List::copyOf).toList();
        }

        public NodeKind kind() {
            return NodeKind.BULLET_LIST;
        }

        public BulletList withItems(List<List<Block>> newItems) {
            return new BulletList(newItems, range);
        }
    }

    record OrderedList(ListAttributes listAttributes, List<List<Block>> items, SourceRange range)
            implements Block {
        public OrderedList {
            items = items.stream().map(List::copyOf).toList();
        }

        public NodeKind kind() {
            return NodeKind.ORDERED_LIST;
        }
    }

    record DefinitionList(List<DefinitionItem> items, SourceRange range) implements Block {
        public DefinitionList {
            items = List.copyOf(items);
        }

        public NodeKind kind() {
            return NodeKind.DEFINITION_LIST;
        }
    }

    record CodeBlock(Attr attr, String text, SourceRange range) implements Block {
        public NodeKind kind() {
            return NodeKind.CODE_BLOCK;
        }
    }

    record RawBlock(String format, String text, SourceRange range) implements Block {
        public NodeKind kind() {
            return NodeKind.RAW_BLOCK;
        }
    }

    record Table(
            Attr attr,
            Caption caption,
            List<ColSpec> colSpecs,
            TableHead head,
            List<TableBody> bodies,
            TableFoot foot,
            SourceRange range)
            implements Block {
        public Table {
            colSpecs = List.copyOf(colSpecs);
            bodies = List.copyOf(bodies);
        }

        public NodeKind kind() {
            return NodeKind.TABLE;
        }

        public Table withAttr(Attr newAttr) {
            return new Table(newAttr, caption, colSpecs, head, bodies, foot, range);
        }

        public Table withCaption(Caption newCaption) {
            return new Table(attr, newCaption, colSpecs, head, bodies, foot, range);
        }

        public Table withBodies(List<TableBody> newBodies) {
            return new Table(attr, caption, colSpecs, head, newBodies, foot, range);
        }

        public Table withRange(SourceRange newRange) {
            return new Table(attr, caption, colSpecs, head, bodies, foot, newRange);
        }
    }

    record Figure(Attr attr, Caption caption, List<Block> content, SourceRange range)
            implements Block {
        public Figure {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.FIGURE;
        }
    }

    record Div(Attr attr, List<Block> content, SourceRange range) implements Block {
        public Div {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.DIV;
        }

        public Div withContent(List<Block> newContent) {
            return new Div(attr, newContent, range);
        }
    }

    record HorizontalRule(SourceRange range) implements Block {
        public NodeKind kind() {
            return NodeKind.HORIZONTAL_RULE;
        }
    }

    /** Caption written after a table; attached to that table during postprocessing. */
    record CaptionBlock(List<Inline> content, SourceRange range) implements Block {
        public CaptionBlock {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.CAPTION_BLOCK;
        }
    }

    /** Extension node with named block slots, e.g. a callout with header and body. */
    record Custom(String typeName, Attr attr, Map<String, List<Block>> slots, SourceRange range)
            implements Block {
        public Custom {
            Map<String, List<Block>> copied = new LinkedHashMap<>();
            slots.forEach((name, blocks) -> copied.put(name, List.copyOf(blocks)));
            slots = Collections.unmodifiableMap(copied);
        }

        public NodeKind kind() {
            return NodeKind.CUSTOM;
        }
    }
}
