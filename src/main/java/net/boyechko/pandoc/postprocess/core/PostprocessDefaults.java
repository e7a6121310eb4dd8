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
package net.boyechko.pandoc.postprocess.core;

import java.util.List;
import java.util.function.Supplier;
import net.boyechko.pandoc.postprocess.ids.CitationNumberer;
import net.boyechko.pandoc.postprocess.ids.HeaderIdAssigner;
import net.boyechko.pandoc.postprocess.ids.Slugifier;
import net.boyechko.pandoc.postprocess.normalizers.CaptionAttacher;
import net.boyechko.pandoc.postprocess.normalizers.EditorialMarks;
import net.boyechko.pandoc.postprocess.normalizers.EmptyListItems;
import net.boyechko.pandoc.postprocess.normalizers.InlineSequenceNormalizer;
import net.boyechko.pandoc.postprocess.normalizers.NoteReferences;
import net.boyechko.pandoc.postprocess.normalizers.Shortcodes;
import net.boyechko.pandoc.postprocess.normalizers.SuperscriptTrimmer;
import net.boyechko.pandoc.postprocess.normalizers.TrailingLineBreaks;
import net.boyechko.pandoc.postprocess.recognizers.DefinitionListRecognizer;
import net.boyechko.pandoc.postprocess.recognizers.FigureRecognizer;
import net.boyechko.pandoc.postprocess.recognizers.ListTableRecognizer;
import net.boyechko.pandoc.postprocess.recognizers.TableCaptionRowRecognizer;
import net.boyechko.pandoc.postprocess.walk.RewritePass;

/**
 * The standard passes in registration order. Passes that touch the same node kind must keep
 * their relative order: trailing line breaks before header ids and figures, list tables before
 * definition lists, caption blocks before caption rows.
 */
public final class PostprocessDefaults {
    private PostprocessDefaults() {}

    public static List<Supplier<RewritePass>> passSuppliers(Slugifier slugifier) {
        return List.of(
                CitationNumberer::new,
                SuperscriptTrimmer::new,
                TrailingLineBreaks::new,
                () -> new HeaderIdAssigner(slugifier),
                FigureRecognizer::new,
                ListTableRecognizer::new,
                DefinitionListRecognizer::new,
                EmptyListItems::new,
                Shortcodes::new,
                NoteReferences::new,
                EditorialMarks::new,
                InlineSequenceNormalizer::new,
                CaptionAttacher::new,
                TableCaptionRowRecognizer::new);
    }
}
