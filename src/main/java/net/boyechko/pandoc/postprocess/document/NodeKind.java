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

import java.util.HashMap;
import java.util.Map;

/** Tag for every node kind in the tree, used to key callback dispatch. */
public enum NodeKind {
    DOCUMENT(Document.class),

    PLAIN(Block.Plain.class),
    PARAGRAPH(Block.Paragraph.class),
    LINE_BLOCK(Block.LineBlock.class),
    HEADER(Block.Header.class),
    BLOCK_QUOTE(Block.BlockQuote.class),
    BULLET_LIST(Block.BulletList.class),
    ORDERED_LIST(Block.OrderedList.class),
    DEFINITION_LIST(Block.DefinitionList.class),
    CODE_BLOCK(Block.CodeBlock.class),
    RAW_BLOCK(Block.RawBlock.class),
    TABLE(Block.Table.class),
    FIGURE(Block.Figure.class),
    DIV(Block.Div.class),
    HORIZONTAL_RULE(Block.HorizontalRule.class),
    CAPTION_BLOCK(Block.CaptionBlock.class),
    CUSTOM(Block.Custom.class),

    STR(Inline.Str.class),
    SPACE(Inline.Space.class),
    SOFT_BREAK(Inline.SoftBreak.class),
    LINE_BREAK(Inline.LineBreak.class),
    EMPH(Inline.Emph.class),
    STRONG(Inline.Strong.class),
    UNDERLINE(Inline.Underline.class),
    STRIKEOUT(Inline.Strikeout.class),
    SUPERSCRIPT(Inline.Superscript.class),
    SUBSCRIPT(Inline.Subscript.class),
    SMALL_CAPS(Inline.SmallCaps.class),
    QUOTED(Inline.Quoted.class),
    CODE(Inline.Code.class),
    MATH(Inline.Math.class),
    RAW_INLINE(Inline.RawInline.class),
    LINK(Inline.Link.class),
    IMAGE(Inline.Image.class),
    NOTE(Inline.Note.class),
    SPAN(Inline.Span.class),
    CITE(Inline.Cite.class),
    ATTR_MARKER(Inline.AttrMarker.class),
    INSERT(Inline.Insert.class),
    DELETE(Inline.Delete.class),
    HIGHLIGHT(Inline.Highlight.class),
    EDIT_COMMENT(Inline.EditComment.class),
    NOTE_REFERENCE(Inline.NoteReference.class),
    SHORTCODE(Inline.Shortcode.class);

    public enum Category {
        ROOT,
        BLOCK,
        INLINE
    }

    private static final Map<Class<?>, NodeKind> BY_TYPE = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            BY_TYPE.put(kind.type, kind);
        }
    }

    private final Class<?> type;
    private final Category category;

    NodeKind(Class<?> type) {
        this.type = type;
        if (Block.class.isAssignableFrom(type)) {
            this.category = Category.BLOCK;
        } else if (Inline.class.isAssignableFrom(type)) {
            this.category = Category.INLINE;
        } else {
            this.category = Category.ROOT;
        }
    }

    /** Returns the kind whose node class is exactly {@code type}. */
    public static NodeKind of(Class<?> type) {
        NodeKind kind = BY_TYPE.get(type);
        if (kind == null) {
            throw new IllegalArgumentException("Not a node type: " + type.getName());
        }
        return kind;
    }

    public Class<?> type() {
        return type;
    }

    public Category category() {
        return category;
    }

    public boolean isBlock() {
        return category == Category.BLOCK;
    }

    public boolean isInline() {
        return category == Category.INLINE;
    }
}
