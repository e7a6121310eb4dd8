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
import java.util.Locale;
import java.util.Map;

/** Renders a document as an indented outline, one node per line. */
public final class TreeDump {
    private static final String INDENT = "  ";

    private final StringBuilder out = new StringBuilder();
    private final boolean withRanges;

    private TreeDump(boolean withRanges) {
        this.withRanges = withRanges;
    }

    public static String dump(Document doc) {
        return dump(doc, false);
    }

    public static String dump(Document doc, boolean withRanges) {
        TreeDump dumper = new TreeDump(withRanges);
        for (Map.Entry<String, MetaValue> entry : doc.meta().entrySet()) {
            dumper.line(0, "Meta " + entry.getKey());
            dumper.meta(entry.getValue(), 1);
        }
        dumper.blocks(doc.blocks(), 0);
        return dumper.out.toString();
    }

    public static String dumpBlocks(List<Block> blocks) {
        TreeDump dumper = new TreeDump(false);
        dumper.blocks(blocks, 0);
        return dumper.out.toString();
    }

    public static String dumpInlines(List<Inline> inlines) {
        TreeDump dumper = new TreeDump(false);
        dumper.inlines(inlines, 0);
        return dumper.out.toString();
    }

    private void line(int depth, String text) {
        out.append(INDENT.repeat(depth)).append(text).append('\n');
    }

    private void line(int depth, String text, SourceRange range) {
        line(depth, withRanges ? text + " " + range : text);
    }

    private void meta(MetaValue value, int depth) {
        if (value instanceof MetaValue.MetaString s) {
            line(depth, "MetaString " + quote(s.value()));
        } else if (value instanceof MetaValue.MetaBool b) {
            line(depth, "MetaBool " + b.value());
        } else if (value instanceof MetaValue.MetaInlines mi) {
            line(depth, "MetaInlines");
            inlines(mi.content(), depth + 1);
        } else if (value instanceof MetaValue.MetaBlocks mb) {
            line(depth, "MetaBlocks");
            blocks(mb.content(), depth + 1);
        } else if (value instanceof MetaValue.MetaList ml) {
            line(depth, "MetaList");
            for (MetaValue item : ml.items()) {
                meta(item, depth + 1);
            }
        } else if (value instanceof MetaValue.MetaMap mm) {
            line(depth, "MetaMap");
            for (Map.Entry<String, MetaValue> entry : mm.entries().entrySet()) {
                line(depth + 1, "Key " + entry.getKey());
                meta(entry.getValue(), depth + 2);
            }
        }
    }

    private void blocks(List<Block> blocks, int depth) {
        for (Block block : blocks) {
            block(block, depth);
        }
    }

    private void items(String label, List<List<Block>> items, int depth) {
        for (List<Block> item : items) {
            line(depth, label);
            blocks(item, depth + 1);
        }
    }

    private void block(Block block, int depth) {
        if (block instanceof Block.Plain p) {
            line(depth, "Plain", p.range());
            inlines(p.content(), depth + 1);
        } else if (block instanceof Block.Paragraph p) {
            line(depth, "Para", p.range());
            inlines(p.content(), depth + 1);
        } else if (block instanceof Block.LineBlock lb) {
            line(depth, "LineBlock", lb.range());
            for (List<Inline> l : lb.lines()) {
                line(depth + 1, "Line");
                inlines(l, depth + 2);
            }
        } else if (block instanceof Block.Header h) {
            line(depth, "Header " + h.level() + " " + attr(h.attr()), h.range());
            inlines(h.content(), depth + 1);
        } else if (block instanceof Block.BlockQuote bq) {
            line(depth, "BlockQuote", bq.range());
            blocks(bq.content(), depth + 1);
        } else if (block instanceof Block.BulletList bl) {
            line(depth, "BulletList", bl.range());
            items("Item", bl.items(), depth + 1);
        } else if (block instanceof Block.OrderedList ol) {
            line(depth, "OrderedList start=" + ol.listAttributes().start(), ol.range());
            items("Item", ol.items(), depth + 1);
        } else if (block instanceof Block.DefinitionList dl) {
            line(depth, "DefinitionList", dl.range());
            for (DefinitionItem item : dl.items()) {
                line(depth + 1, "Term");
                inlines(item.term(), depth + 2);
                items("Definition", item.definitions(), depth + 2);
            }
        } else if (block instanceof Block.CodeBlock cb) {
            line(depth, "CodeBlock " + attr(cb.attr()) + " " + quote(cb.text()), cb.range());
        } else if (block instanceof Block.RawBlock rb) {
            line(depth, "RawBlock " + rb.format() + " " + quote(rb.text()), rb.range());
        } else if (block instanceof Block.Table t) {
            table(t, depth);
        } else if (block instanceof Block.Figure f) {
            line(depth, "Figure " + attr(f.attr()), f.range());
            caption(f.caption(), depth + 1);
            blocks(f.content(), depth + 1);
        } else if (block instanceof Block.Div d) {
            line(depth, "Div " + attr(d.attr()), d.range());
            blocks(d.content(), depth + 1);
        } else if (block instanceof Block.HorizontalRule hr) {
            line(depth, "HorizontalRule", hr.range());
        } else if (block instanceof Block.CaptionBlock cap) {
            line(depth, "CaptionBlock", cap.range());
            inlines(cap.content(), depth + 1);
        } else if (block instanceof Block.Custom c) {
            line(depth, "Custom " + c.typeName() + " " + attr(c.attr()), c.range());
            for (Map.Entry<String, List<Block>> slot : c.slots().entrySet()) {
                line(depth + 1, "Slot " + slot.getKey());
                blocks(slot.getValue(), depth + 2);
            }
        }
    }

    private void table(Block.Table t, int depth) {
        line(depth, "Table " + attr(t.attr()), t.range());
        caption(t.caption(), depth + 1);
        StringBuilder specs = new StringBuilder("ColSpecs");
        for (ColSpec spec : t.colSpecs()) {
            specs.append(' ').append(spec.alignment()).append('/');
            if (spec.width() instanceof ColWidth.Percentage pct) {
                specs.append(String.format(Locale.ROOT, "%.4f", pct.fraction()));
            } else {
                specs.append("default");
            }
        }
        line(depth + 1, specs.toString());
        line(depth + 1, "Head " + attr(t.head().attr()));
        rows(t.head().rows(), depth + 2);
        for (TableBody body : t.bodies()) {
            line(depth + 1, "Body rowHeadColumns=" + body.rowHeadColumns());
            rows(body.head(), depth + 2);
            rows(body.body(), depth + 2);
        }
        line(depth + 1, "Foot " + attr(t.foot().attr()));
        rows(t.foot().rows(), depth + 2);
    }

    private void rows(List<Row> rows, int depth) {
        for (Row row : rows) {
            line(depth, "Row " + attr(row.attr()), row.range());
            for (Cell cell : row.cells()) {
                line(
                        depth + 1,
                        "Cell "
                                + attr(cell.attr())
                                + " "
                                + cell.alignment()
                                + " "
                                + cell.rowSpan()
                                + "x"
                                + cell.colSpan(),
                        cell.range());
                blocks(cell.content(), depth + 2);
            }
        }
    }

    private void caption(Caption caption, int depth) {
        if (caption.isEmpty()) {
            return;
        }
        line(depth, "Caption", caption.range());
        if (caption.shortCaption() != null) {
            line(depth + 1, "Short");
            inlines(caption.shortCaption(), depth + 2);
        }
        blocks(caption.longCaption(), depth + 1);
    }

    private void inlines(List<Inline> inlines, int depth) {
        for (Inline inline : inlines) {
            inline(inline, depth);
        }
    }

    private void inline(Inline inline, int depth) {
        if (inline instanceof Inline.Str s) {
            line(depth, "Str " + quote(s.text()), s.range());
        } else if (inline instanceof Inline.Space sp) {
            line(depth, "Space", sp.range());
        } else if (inline instanceof Inline.SoftBreak sb) {
            line(depth, "SoftBreak", sb.range());
        } else if (inline instanceof Inline.LineBreak lb) {
            line(depth, "LineBreak", lb.range());
        } else if (inline instanceof Inline.Code c) {
            line(depth, "Code " + attr(c.attr()) + " " + quote(c.text()), c.range());
        } else if (inline instanceof Inline.Math m) {
            line(depth, "Math " + m.mathType() + " " + quote(m.text()), m.range());
        } else if (inline instanceof Inline.RawInline r) {
            line(depth, "RawInline " + r.format() + " " + quote(r.text()), r.range());
        } else if (inline instanceof Inline.Link l) {
            line(depth, "Link " + attr(l.attr()) + " " + quote(l.target().url()), l.range());
            inlines(l.content(), depth + 1);
        } else if (inline instanceof Inline.Image img) {
            line(
                    depth,
                    "Image " + attr(img.attr()) + " " + quote(img.target().url()),
                    img.range());
            inlines(img.content(), depth + 1);
        } else if (inline instanceof Inline.Note n) {
            line(depth, "Note", n.range());
            blocks(n.content(), depth + 1);
        } else if (inline instanceof Inline.Cite cite) {
            line(depth, "Cite", cite.range());
            for (Citation c : cite.citations()) {
                line(depth + 1, "Citation @" + c.id() + " " + c.mode() + " note=" + c.noteNum());
                if (!c.prefix().isEmpty()) {
                    line(depth + 2, "Prefix");
                    inlines(c.prefix(), depth + 3);
                }
                if (!c.suffix().isEmpty()) {
                    line(depth + 2, "Suffix");
                    inlines(c.suffix(), depth + 3);
                }
            }
            inlines(cite.content(), depth + 1);
        } else if (inline instanceof Inline.AttrMarker am) {
            line(depth, "AttrMarker " + attr(am.attr()), am.range());
        } else if (inline instanceof Inline.NoteReference nr) {
            line(depth, "NoteReference " + nr.id(), nr.range());
        } else if (inline instanceof Inline.Shortcode sc) {
            line(depth, "Shortcode " + sc.name(), sc.range());
        } else if (inline instanceof Inline.Span span) {
            line(depth, "Span " + attr(span.attr()), span.range());
            inlines(span.content(), depth + 1);
        } else if (inline instanceof Inline.Quoted q) {
            line(depth, "Quoted " + q.quoteType(), q.range());
            inlines(q.content(), depth + 1);
        } else if (inline instanceof Inline.Container c) {
            line(depth, containerLabel(c), c.range());
            inlines(c.content(), depth + 1);
        }
    }

    private static String containerLabel(Inline.Container c) {
        String name = c.getClass().getSimpleName();
        if (c instanceof Inline.Insert i) return name + " " + attr(i.attr());
        if (c instanceof Inline.Delete d) return name + " " + attr(d.attr());
        if (c instanceof Inline.Highlight h) return name + " " + attr(h.attr());
        if (c instanceof Inline.EditComment e) return name + " " + attr(e.attr());
        return name;
    }

    /** Renders attributes in Pandoc source syntax, e.g. {@code {#id .cls key="value"}}. */
    public static String attr(Attr attr) {
        StringBuilder sb = new StringBuilder("{");
        String sep = "";
        if (!attr.id().isEmpty()) {
            sb.append('#').append(attr.id());
            sep = " ";
        }
        for (String cls : attr.classes()) {
            sb.append(sep).append('.').append(cls);
            sep = " ";
        }
        for (Map.Entry<String, String> kv : attr.attributes().entrySet()) {
            sb.append(sep).append(kv.getKey()).append('=').append(quote(kv.getValue()));
            sep = " ";
        }
        return sb.append('}').toString();
    }

    private static String quote(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (char ch : text.toCharArray()) {
            switch (ch) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\u00A0' -> sb.append("\\u00A0");
                default -> sb.append(ch);
            }
        }
        return sb.append('"').toString();
    }
}
