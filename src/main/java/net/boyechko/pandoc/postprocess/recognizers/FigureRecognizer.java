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

import java.util.List;
import java.util.Set;
import net.boyechko.pandoc.postprocess.document.Attr;
import net.boyechko.pandoc.postprocess.document.Block;
import net.boyechko.pandoc.postprocess.document.Caption;
import net.boyechko.pandoc.postprocess.document.Inline;
import net.boyechko.pandoc.postprocess.normalizers.TrailingLineBreaks;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.FilterReturn;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import net.boyechko.pandoc.postprocess.walk.WalkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a paragraph holding nothing but an image with alt text into a Figure. The alt text
 * becomes the caption and the image's identifier moves to the figure.
 */
public class FigureRecognizer implements RewritePass {
    private static final Logger logger = LoggerFactory.getLogger(FigureRecognizer.class);

    @Override
    public String name() {
        return "Figure recognizer";
    }

    @Override
    public String description() {
        return "Single-image paragraphs become figures";
    }

    @Override
    public Set<Class<? extends RewritePass>> prerequisites() {
        return Set.of(TrailingLineBreaks.class);
    }

    @Override
    public void register(Filter.Builder builder) {
        builder.onBlock(Block.Paragraph.class, this::onParagraph);
    }

    private FilterReturn<Block, List<Block>> onParagraph(Block.Paragraph para, WalkContext ctx) {
        if (para.content().size() != 1
                || !(para.content().get(0) instanceof Inline.Image image)
                || image.content().isEmpty()) {
            return FilterReturn.unchanged(para);
        }

        Attr figureAttr = Attr.withId(image.attr().id());
        Inline.Image bareImage = image.withAttr(image.attr().id(""));
        Caption caption =
                Caption.of(
                        List.of(new Block.Plain(image.content(), image.range())), image.range());
        Block.Figure figure =
                new Block.Figure(
                        figureAttr,
                        caption,
                        List.of(new Block.Plain(List.of(bareImage), image.range())),
                        para.range());

        logger.debug("Paragraph at {} became figure '{}'", para.range(), figureAttr.id());
        return FilterReturn.replaced(List.of(figure));
    }
}
