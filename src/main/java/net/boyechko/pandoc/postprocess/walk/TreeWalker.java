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
package net.boyechko.pandoc.postprocess.walk;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pandoc.postprocess.document.Block;
import net.boyechko.pandoc.postprocess.document.Caption;
import net.boyechko.pandoc.postprocess.document.Cell;
import net.boyechko.pandoc.postprocess.document.Citation;
import net.boyechko.pandoc.postprocess.document.DefinitionItem;
import net.boyechko.pandoc.postprocess.document.Document;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.MetaValue;
import net.boyechko.pandoc.postprocess.document.NodeKind;
import net.boyechko.pandoc.postprocess.document.Row;
import net.boyechko.pandoc.postprocess.document.TableBody;
import net.boyechko.pandoc.postprocess.issue.IssueList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a document bottom-up, applying one {@link Filter}. Each node's children are rewritten
 * before the node's own callbacks run, and a sequence callback runs after every element of the
 * sequence. Replacements returned with {@code rescan} set are walked again, up to {@link
 * #MAX_RESCAN_DEPTH} times. A rescanned sequence has its elements walked again and then goes
 * back through the sequence callbacks.
 */
public class TreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(TreeWalker.class);

    public static final int MAX_RESCAN_DEPTH = 32;

    private final Filter filter;
    private final IssueList issues;

    public TreeWalker(Filter filter, IssueList issues) {
        this.filter = filter;
        this.issues = issues;
    }

    /** Rewrites the document's metadata and blocks in place and returns it. */
    public Document walk(Document doc) {
        for (Map.Entry<String, MetaValue> entry : doc.meta().entrySet()) {
            entry.setValue(walkMeta(entry.getValue()));
        }
        doc.setBlocks(walkBlocks(doc.blocks(), NodeKind.DOCUMENT));
        return doc;
    }

    private MetaValue walkMeta(MetaValue value) {
        if (value instanceof MetaValue.MetaInlines mi) {
            return new MetaValue.MetaInlines(walkInlines(mi.content(), NodeKind.DOCUMENT));
        } else if (value instanceof MetaValue.MetaBlocks mb) {
            return new MetaValue.MetaBlocks(walkBlocks(mb.content(), NodeKind.DOCUMENT));
        } else if (value instanceof MetaValue.MetaList ml) {
            return new MetaValue.MetaList(ml.items().stream().map(this::walkMeta).toList());
        } else if (value instanceof MetaValue.MetaMap mm) {
            Map<String, MetaValue> entries = new LinkedHashMap<>();
            mm.entries().forEach((key, v) -> entries.put(key, walkMeta(v)));
            return new MetaValue.MetaMap(entries);
        }
        return value;
    }

    // ---------------------------------------------------------------- sequences

    public List<Block> walkBlocks(List<Block> blocks, NodeKind owner) {
        WalkContext ctx = new WalkContext(issues, owner);
        List<Block> current = walkBlockElements(blocks, ctx, 0);
        for (int rescans = 0; ; rescans++) {
            FilterReturn<List<Block>, List<Block>> result = filter.applyBlocks(current, ctx);
            if (result instanceof FilterReturn.Unchanged<List<Block>, List<Block>> kept) {
                return kept.value();
            }
            FilterReturn.Replaced<List<Block>, List<Block>> swap =
                    (FilterReturn.Replaced<List<Block>, List<Block>>) result;
            if (!swap.rescan()) {
                return swap.replacement();
            }
            if (rescans >= MAX_RESCAN_DEPTH) {
                logger.warn(
                        "Rescan limit of {} reached at blocks of {}; keeping replacement as is",
                        MAX_RESCAN_DEPTH,
                        owner);
                return swap.replacement();
            }
            current = walkBlockElements(swap.replacement(), ctx, rescans + 1);
        }
    }

    public List<Inline> walkInlines(List<Inline> inlines, NodeKind owner) {
        WalkContext ctx = new WalkContext(issues, owner);
        List<Inline> current = walkInlineElements(inlines, ctx, 0);
        for (int rescans = 0; ; rescans++) {
            FilterReturn<List<Inline>, List<Inline>> result = filter.applyInlines(current, ctx);
            if (result instanceof FilterReturn.Unchanged<List<Inline>, List<Inline>> kept) {
                return kept.value();
            }
            FilterReturn.Replaced<List<Inline>, List<Inline>> swap =
                    (FilterReturn.Replaced<List<Inline>, List<Inline>>) result;
            if (!swap.rescan()) {
                return swap.replacement();
            }
            if (rescans >= MAX_RESCAN_DEPTH) {
                logger.warn(
                        "Rescan limit of {} reached at inlines of {}; keeping replacement as is",
                        MAX_RESCAN_DEPTH,
                        owner);
                return swap.replacement();
            }
            current = walkInlineElements(swap.replacement(), ctx, rescans + 1);
        }
    }

    private List<Block> walkBlockElements(List<Block> blocks, WalkContext ctx, int rescans) {
        List<Block> out = new ArrayList<>(blocks.size());
        for (Block block : blocks) {
            out.addAll(walkBlock(block, ctx, rescans));
        }
        return out;
    }

    private List<Inline> walkInlineElements(List<Inline> inlines, WalkContext ctx, int rescans) {
        List<Inline> out = new ArrayList<>(inlines.size());
        for (Inline inline : inlines) {
            out.addAll(walkInline(inline, ctx, rescans));
        }
        return out;
    }

    // ---------------------------------------------------------------- nodes

    private List<Block> walkBlock(Block block, WalkContext ctx, int rescans) {
        Block rebuilt = descend(block);
        FilterReturn<Block, List<Block>> result = filter.applyBlock(rebuilt, ctx);
        if (result instanceof FilterReturn.Unchanged<Block, List<Block>> kept) {
            return List.of(kept.value());
        }
        FilterReturn.Replaced<Block, List<Block>> swap =
                (FilterReturn.Replaced<Block, List<Block>>) result;
        if (!swap.rescan()) {
            return swap.replacement();
        }
        if (rescans >= MAX_RESCAN_DEPTH) {
            logger.warn(
                    "Rescan limit of {} reached at {} {}; keeping replacement as is",
                    MAX_RESCAN_DEPTH,
                    block.kind(),
                    block.range());
            return swap.replacement();
        }
        return walkBlockElements(swap.replacement(), ctx, rescans + 1);
    }

    private List<Inline> walkInline(Inline inline, WalkContext ctx, int rescans) {
        Inline rebuilt = descend(inline);
        FilterReturn<Inline, List<Inline>> result = filter.applyInline(rebuilt, ctx);
        if (result instanceof FilterReturn.Unchanged<Inline, List<Inline>> kept) {
            return List.of(kept.value());
        }
        FilterReturn.Replaced<Inline, List<Inline>> swap =
                (FilterReturn.Replaced<Inline, List<Inline>>) result;
        if (!swap.rescan()) {
            return swap.replacement();
        }
        if (rescans >= MAX_RESCAN_DEPTH) {
            logger.warn(
                    "Rescan limit of {} reached at {} {}; keeping replacement as is",
                    MAX_RESCAN_DEPTH,
                    inline.kind(),
                    inline.range());
            return swap.replacement();
        }
        return walkInlineElements(swap.replacement(), ctx, rescans + 1);
    }

    // ---------------------------------------------------------------- children

    private Block descend(Block block) {
        NodeKind kind = block.kind();
        if (block instanceof Block.Plain p) {
            return p.withContent(walkInlines(p.content(), kind));
        } else if (block instanceof Block.Paragraph p) {
            return p.withContent(walkInlines(p.content(), kind));
        } else if (block instanceof Block.LineBlock lb) {
            List<List<Inline>> lines = new ArrayList<>();
            for (List<Inline> line : lb.lines()) {
                lines.add(walkInlines(line, kind));
            }
            return new Block.LineBlock(lines, lb.range());
        } else if (block instanceof Block.Header h) {
            return h.withContent(walkInlines(h.content(), kind));
        } else if (block instanceof Block.BlockQuote bq) {
            return new Block.BlockQuote(walkBlocks(bq.content(), kind), bq.range());
        } else if (block instanceof Block.BulletList bl) {
            return bl.withItems(walkItems(bl.items(), kind));
        } else if (block instanceof Block.OrderedList ol) {
            return new Block.OrderedList(
                    ol.listAttributes(), walkItems(ol.items(), kind), ol.range());
        } else if (block instanceof Block.DefinitionList dl) {
            List<DefinitionItem> items = new ArrayList<>();
            for (DefinitionItem item : dl.items()) {
                items.add(
                        new DefinitionItem(
                                walkInlines(item.term(), kind),
                                walkItems(item.definitions(), kind)));
            }
            return new Block.DefinitionList(items, dl.range());
        } else if (block instanceof Block.Table t) {
            return descendTable(t);
        } else if (block instanceof Block.Figure f) {
            return new Block.Figure(
                    f.attr(),
                    walkCaption(f.caption(), kind),
                    walkBlocks(f.content(), kind),
                    f.range());
        } else if (block instanceof Block.Div d) {
            return d.withContent(walkBlocks(d.content(), kind));
        } else if (block instanceof Block.CaptionBlock cb) {
            return new Block.CaptionBlock(walkInlines(cb.content(), kind), cb.range());
        } else if (block instanceof Block.Custom c) {
            Map<String, List<Block>> slots = new LinkedHashMap<>();
            c.slots().forEach((name, blocks) -> slots.put(name, walkBlocks(blocks, kind)));
            return new Block.Custom(c.typeName(), c.attr(), slots, c.range());
        }
        // CodeBlock, RawBlock, HorizontalRule
        return block;
    }

    private List<List<Block>> walkItems(List<List<Block>> items, NodeKind owner) {
        List<List<Block>> out = new ArrayList<>(items.size());
        for (List<Block> item : items) {
            out.add(walkBlocks(item, owner));
        }
        return out;
    }

    private Caption walkCaption(Caption caption, NodeKind owner) {
        List<Inline> shortCaption =
                caption.shortCaption() != null ? walkInlines(caption.shortCaption(), owner) : null;
        return new Caption(shortCaption, walkBlocks(caption.longCaption(), owner), caption.range());
    }

    private Block descendTable(Block.Table t) {
        NodeKind kind = t.kind();
        List<TableBody> bodies = new ArrayList<>();
        for (TableBody body : t.bodies()) {
            bodies.add(body.withRows(walkRows(body.head(), kind), walkRows(body.body(), kind)));
        }
        return new Block.Table(
                t.attr(),
                walkCaption(t.caption(), kind),
                t.colSpecs(),
                t.head().withRows(walkRows(t.head().rows(), kind)),
                bodies,
                t.foot().withRows(walkRows(t.foot().rows(), kind)),
                t.range());
    }

    private List<Row> walkRows(List<Row> rows, NodeKind owner) {
        List<Row> out = new ArrayList<>(rows.size());
        for (Row row : rows) {
            List<Cell> cells = new ArrayList<>(row.cells().size());
            for (Cell cell : row.cells()) {
                cells.add(cell.withContent(walkBlocks(cell.content(), owner)));
            }
            out.add(row.withCells(cells));
        }
        return out;
    }

    private Inline descend(Inline inline) {
        NodeKind kind = inline.kind();
        if (inline instanceof Inline.Container c) {
            return c.withContent(walkInlines(c.content(), kind));
        } else if (inline instanceof Inline.Link l) {
            return l.withContent(walkInlines(l.content(), kind));
        } else if (inline instanceof Inline.Image img) {
            return img.withContent(walkInlines(img.content(), kind));
        } else if (inline instanceof Inline.Note n) {
            return new Inline.Note(walkBlocks(n.content(), kind), n.range());
        } else if (inline instanceof Inline.Cite cite) {
            List<Citation> citations = new ArrayList<>(cite.citations().size());
            for (Citation c : cite.citations()) {
                citations.add(
                        c.withPrefix(walkInlines(c.prefix(), kind))
                                .withSuffix(walkInlines(c.suffix(), kind)));
            }
            return new Inline.Cite(citations, walkInlines(cite.content(), kind), cite.range());
        }
        // Leaves and transient markers have no children to walk.
        return inline;
    }
}
