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

/**
 * Inline node. AttrMarker, Insert, Delete, Highlight, EditComment, NoteReference and Shortcode
 * are produced by the parser only and never survive postprocessing.
 */
public sealed interface Inline {

    NodeKind kind();

    SourceRange range();

    /** Inlines that only wrap other inlines. */
    sealed interface Container extends Inline {
        List<Inline> content();

        Container withContent(List<Inline> newContent);
    }

    enum MathType {
        INLINE,
        DISPLAY
    }

    enum QuoteType {
        SINGLE,
        DOUBLE
    }

    record Str(String text, SourceRange range) implements Inline {
        public NodeKind kind() {
            return NodeKind.STR;
        }

        public Str withText(String newText) {
            return new Str(newText, range);
        }
    }

    record Space(SourceRange range) implements Inline {
        public NodeKind kind() {
            return NodeKind.SPACE;
        }
    }

    record SoftBreak(SourceRange range) implements Inline {
        public NodeKind kind() {
            return NodeKind.SOFT_BREAK;
        }
    }

    record LineBreak(SourceRange range) implements Inline {
        public NodeKind kind() {
            return NodeKind.LINE_BREAK;
        }
    }

    record Emph(List<Inline> content, SourceRange range) implements Container {
        public Emph {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.EMPH;
        }

        public Emph withContent(List<Inline> newContent) {
            return new Emph(newContent, range);
        }
    }

    record Strong(List<Inline> content, SourceRange range) implements Container {
        public Strong {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.STRONG;
        }

        public Strong withContent(List<Inline> newContent) {
            return new Strong(newContent, range);
        }
    }

    record Underline(List<Inline> content, SourceRange range) implements Container {
        public Underline {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.UNDERLINE;
        }

        public Underline withContent(List<Inline> newContent) {
            return new Underline(newContent, range);
        }
    }

    record Strikeout(List<Inline> content, SourceRange range) implements Container {
        public Strikeout {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.STRIKEOUT;
        }

        public Strikeout withContent(List<Inline> newContent) {
            return new Strikeout(newContent, range);
        }
    }

    record Superscript(List<Inline> content, SourceRange range) implements Container {
        public Superscript {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.SUPERSCRIPT;
        }

        public Superscript withContent(List<Inline> newContent) {
            return new Superscript(newContent, range);
        }
    }

    record Subscript(List<Inline> content, SourceRange range) implements Container {
        public Subscript {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.SUBSCRIPT;
        }

        public Subscript withContent(List<Inline> newContent) {
            return new Subscript(newContent, range);
        }
    }

    record SmallCaps(List<Inline> content, SourceRange range) implements Container {
        public SmallCaps {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.SMALL_CAPS;
        }

        public SmallCaps withContent(List<Inline> newContent) {
            return new SmallCaps(newContent, range);
        }
    }

    record Quoted(QuoteType quoteType, List<Inline> content, SourceRange range)
            implements Container {
        public Quoted {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.QUOTED;
        }

        public Quoted withContent(List<Inline> newContent) {
            return new Quoted(quoteType, newContent, range);
        }
    }

    record Code(Attr attr, String text, SourceRange range) implements Inline {
        public NodeKind kind() {
            return NodeKind.CODE;
        }
    }

    record Math(MathType mathType, String text, SourceRange range) implements Inline {
        public NodeKind kind() {
            return NodeKind.MATH;
        }
    }

    record RawInline(String format, String text, SourceRange range) implements Inline {
        public NodeKind kind() {
            return NodeKind.RAW_INLINE;
        }
    }

    record Link(Attr attr, List<Inline> content, Target target, SourceRange range)
            implements Inline {
        public Link {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.LINK;
        }

        public Link withContent(List<Inline> newContent) {
            return new Link(attr, newContent, target, range);
        }
    }

    record Image(Attr attr, List<Inline> content, Target target, SourceRange range)
            implements Inline {
        public Image {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.IMAGE;
        }

        public Image withAttr(Attr newAttr) {
            return new Image(newAttr, content, target, range);
        }

        public Image withContent(List<Inline> newContent) {
            return new Image(attr, newContent, target, range);
        }
    }

    record Note(List<Block> content, SourceRange range) implements Inline {
        public Note {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.NOTE;
        }
    }

    record Span(Attr attr, List<Inline> content, SourceRange range) implements Container {
        public Span {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.SPAN;
        }

        public Span withContent(List<Inline> newContent) {
            return new Span(attr, newContent, range);
        }
    }

    record Cite(List<Citation> citations, List<Inline> content, SourceRange range)
            implements Inline {
        public Cite {
            citations = List.copyOf(citations);
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.CITE;
        }

        public Cite withCitations(List<Citation> newCitations) {
            return new Cite(newCitations, content, range);
        }

        public Cite withContent(List<Inline> newContent) {
            return new Cite(citations, newContent, range);
        }
    }

    /** Attribute block such as <code>{#id .class}</code> awaiting attachment to its owner. */
    record AttrMarker(Attr attr, SourceRange range) implements Inline {
        public NodeKind kind() {
            return NodeKind.ATTR_MARKER;
        }
    }

    record Insert(Attr attr, List<Inline> content, SourceRange range) implements Container {
        public Insert {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.INSERT;
        }

        public Insert withContent(List<Inline> newContent) {
            return new Insert(attr, newContent, range);
        }
    }

    record Delete(Attr attr, List<Inline> content, SourceRange range) implements Container {
        public Delete {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.DELETE;
        }

        public Delete withContent(List<Inline> newContent) {
            return new Delete(attr, newContent, range);
        }
    }

    record Highlight(Attr attr, List<Inline> content, SourceRange range) implements Container {
        public Highlight {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.HIGHLIGHT;
        }

        public Highlight withContent(List<Inline> newContent) {
            return new Highlight(attr, newContent, range);
        }
    }

    record EditComment(Attr attr, List<Inline> content, SourceRange range)
            implements Container {
        public EditComment {
            content = List.copyOf(content);
        }

        public NodeKind kind() {
            return NodeKind.EDIT_COMMENT;
        }

        public EditComment withContent(List<Inline> newContent) {
            return new EditComment(attr, newContent, range);
        }
    }

    record NoteReference(String id, SourceRange range) implements Inline {
        public NodeKind kind() {
            return NodeKind.NOTE_REFERENCE;
        }
    }

    /** Unresolved <code>{{&lt; name args &gt;}}</code> shortcode. */
    record Shortcode(
            boolean escaped,
            String name,
            List<ShortcodeArg> positionalArgs,
            Map<String, ShortcodeArg> keywordArgs,
            SourceRange range)
            implements Inline {
        public Shortcode {
            positionalArgs = List.copyOf(positionalArgs);
            keywordArgs = Collections.unmodifiableMap(new LinkedHashMap<>(keywordArgs));
        }

        public NodeKind kind() {
            return NodeKind.SHORTCODE;
        }
    }
}
