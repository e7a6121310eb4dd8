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
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pandoc.postprocess.document.Block;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.document.NodeKind;

/**
 * Registry of callbacks keyed by node kind, plus callbacks for whole block and inline sequences.
 * A kind with no callbacks is simply traversed.
 *
 * <p>Node callbacks for one kind run in registration order: each sees the value kept by the
 * previous one, and the first {@link FilterReturn.Replaced} ends the chain. Sequence callbacks
 * all run in registration order, each seeing the previous result.
 */
public final class Filter {
    private final Map<NodeKind, List<BlockCallback<Block>>> blockCallbacks;
    private final Map<NodeKind, List<InlineCallback<Inline>>> inlineCallbacks;
    private final List<SequenceCallback<Block>> blocksCallbacks;
    private final List<SequenceCallback<Inline>> inlinesCallbacks;

    private Filter(Builder builder) {
        this.blockCallbacks = builder.blockCallbacks;
        this.inlineCallbacks = builder.inlineCallbacks;
        this.blocksCallbacks = List.copyOf(builder.blocksCallbacks);
        this.inlinesCallbacks = List.copyOf(builder.inlinesCallbacks);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean handles(NodeKind kind) {
        return blockCallbacks.containsKey(kind) || inlineCallbacks.containsKey(kind);
    }

    public FilterReturn<Block, List<Block>> applyBlock(Block block, WalkContext ctx) {
        List<BlockCallback<Block>> chain =
                blockCallbacks.getOrDefault(block.kind(), Collections.emptyList());
        Block current = block;
        for (BlockCallback<Block> callback : chain) {
            FilterReturn<Block, List<Block>> result = callback.apply(current, ctx);
            if (result instanceof FilterReturn.Unchanged<Block, List<Block>> kept) {
                current = kept.value();
                if (current.kind() != block.kind()) {
                    break;
                }
            } else {
                return result;
            }
        }
        return FilterReturn.unchanged(current);
    }

    public FilterReturn<Inline, List<Inline>> applyInline(Inline inline, WalkContext ctx) {
        List<InlineCallback<Inline>> chain =
                inlineCallbacks.getOrDefault(inline.kind(), Collections.emptyList());
        Inline current = inline;
        for (InlineCallback<Inline> callback : chain) {
            FilterReturn<Inline, List<Inline>> result = callback.apply(current, ctx);
            if (result instanceof FilterReturn.Unchanged<Inline, List<Inline>> kept) {
                current = kept.value();
                if (current.kind() != inline.kind()) {
                    break;
                }
            } else {
                return result;
            }
        }
        return FilterReturn.unchanged(current);
    }

    public FilterReturn<List<Block>, List<Block>> applyBlocks(
            List<Block> blocks, WalkContext ctx) {
        return applySequence(blocksCallbacks, blocks, ctx);
    }

    public FilterReturn<List<Inline>, List<Inline>> applyInlines(
            List<Inline> inlines, WalkContext ctx) {
        return applySequence(inlinesCallbacks, inlines, ctx);
    }

    private static <T> FilterReturn<List<T>, List<T>> applySequence(
            List<SequenceCallback<T>> callbacks, List<T> sequence, WalkContext ctx) {
        List<T> current = sequence;
        boolean replaced = false;
        boolean rescan = false;
        for (SequenceCallback<T> callback : callbacks) {
            FilterReturn<List<T>, List<T>> result = callback.apply(current, ctx);
            if (result instanceof FilterReturn.Unchanged<List<T>, List<T>> kept) {
                current = kept.value();
            } else if (result instanceof FilterReturn.Replaced<List<T>, List<T>> swap) {
                current = swap.replacement();
                replaced = true;
                rescan |= swap.rescan();
            }
        }
        return replaced ? FilterReturn.replaced(current, rescan) : FilterReturn.unchanged(current);
    }

    public static final class Builder {
        private final Map<NodeKind, List<BlockCallback<Block>>> blockCallbacks =
                new EnumMap<>(NodeKind.class);
        private final Map<NodeKind, List<InlineCallback<Inline>>> inlineCallbacks =
                new EnumMap<>(NodeKind.class);
        private final List<SequenceCallback<Block>> blocksCallbacks = new ArrayList<>();
        private final List<SequenceCallback<Inline>> inlinesCallbacks = new ArrayList<>();

        private Builder() {}

        public <B extends Block> Builder onBlock(Class<B> type, BlockCallback<B> callback) {
            NodeKind kind = NodeKind.of(type);
            blockCallbacks
                    .computeIfAbsent(kind, k -> new ArrayList<>())
                    .add((block, ctx) -> callback.apply(type.cast(block), ctx));
            return this;
        }

        public <I extends Inline> Builder onInline(Class<I> type, InlineCallback<I> callback) {
            NodeKind kind = NodeKind.of(type);
            inlineCallbacks
                    .computeIfAbsent(kind, k -> new ArrayList<>())
                    .add((inline, ctx) -> callback.apply(type.cast(inline), ctx));
            return this;
        }

        public Builder onBlocks(SequenceCallback<Block> callback) {
            blocksCallbacks.add(callback);
            return this;
        }

        public Builder onInlines(SequenceCallback<Inline> callback) {
            inlinesCallbacks.add(callback);
            return this;
        }

        /** Registers every callback of {@code pass}. */
        public Builder add(RewritePass pass) {
            pass.register(this);
            return this;
        }

        public Filter build() {
            return new Filter(this);
        }
    }
}
