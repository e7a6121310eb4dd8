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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.boyechko.pandoc.postprocess.document.Block;
import net.boyechko.pandoc.postprocess.document.DefinitionItem;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.FilterReturn;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import net.boyechko.pandoc.postprocess.walk.WalkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts Divs with class {@code definition-list} into DefinitionLists. The Div holds one
 * bullet list whose items are a term (Plain or Paragraph) followed by a bullet list of
 * definitions. Malformed Divs are left alone without a diagnostic.
 */
public class DefinitionListRecognizer implements RewritePass {
    private static final Logger logger = LoggerFactory.getLogger(DefinitionListRecognizer.class);

    public static final String CLASS_NAME = "definition-list";

    @Override
    public String name() {
        return "Definition-list recognizer";
    }

    @Override
    public String description() {
        return "Divs of class definition-list become definition lists";
    }

    @Override
    public Set<Class<? extends RewritePass>> prerequisites() {
        return Set.of(ListTableRecognizer.class);
    }

    @Override
    public void register(Filter.Builder builder) {
        builder.onBlock(Block.Div.class, this::onDiv);
    }

    private FilterReturn<Block, List<Block>> onDiv(Block.Div div, WalkContext ctx) {
        // A malformed list-table keeps its warning and its shape.
        if (div.attr().hasClass(ListTableRecognizer.CLASS_NAME) || !isValid(div)) {
            return FilterReturn.unchanged(div);
        }
        return FilterReturn.replaced(List.of(transform(div)));
    }

    public static boolean isValid(Block.Div div) {
        if (!div.attr().hasClass(CLASS_NAME)) {
            return false;
        }
        if (div.content().size() != 1
                || !(div.content().get(0) instanceof Block.BulletList list)) {
            logger.debug("definition-list at {} must hold exactly one bullet list", div.range());
            return false;
        }
        for (List<Block> item : list.items()) {
            if (item.size() != 2
                    || !isTerm(item.get(0))
                    || !(item.get(1) instanceof Block.BulletList)) {
                logger.debug(
                        "definition-list at {} has an item that is not a term plus a bullet list",
                        div.range());
                return false;
            }
        }
        return true;
    }

    private static boolean isTerm(Block block) {
        return block instanceof Block.Plain || block instanceof Block.Paragraph;
    }

    /** Builds the DefinitionList for a Div that {@link #isValid} accepted. */
    public static Block.DefinitionList transform(Block.Div div) {
        if (!isValid(div)) {
            throw new IllegalStateException("definition-list transform requires a valid Div");
        }
        Block.BulletList list = (Block.BulletList) div.content().get(0);
        List<DefinitionItem> items = new ArrayList<>(list.items().size());
        for (List<Block> item : list.items()) {
            List<Inline> term =
                    item.get(0) instanceof Block.Plain plain
                            ? plain.content()
                            : ((Block.Paragraph) item.get(0)).content();
            Block.BulletList definitions = (Block.BulletList) item.get(1);
            items.add(new DefinitionItem(term, definitions.items()));
        }
        logger.debug("Built definition list of {} items at {}", items.size(), div.range());
        return new Block.DefinitionList(items, div.range());
    }
}
