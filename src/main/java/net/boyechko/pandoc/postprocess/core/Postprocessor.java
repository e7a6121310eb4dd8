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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import net.boyechko.pandoc.postprocess.document.Document;
import net.boyechko.pandoc.postprocess.document.TreeDump;
import net.boyechko.pandoc.postprocess.ids.PandocSlugifier;
import net.boyechko.pandoc.postprocess.ids.Slugifier;
import net.boyechko.pandoc.postprocess.issue.Issue;
import net.boyechko.pandoc.postprocess.issue.IssueList;
import net.boyechko.pandoc.postprocess.issue.IssueType;
import net.boyechko.pandoc.postprocess.normalizers.AbbreviationCoalescer;
import net.boyechko.pandoc.postprocess.normalizers.AttrMarkerSweep;
import net.boyechko.pandoc.postprocess.normalizers.StrMerger;
import net.boyechko.pandoc.postprocess.walk.Filter;
import net.boyechko.pandoc.postprocess.walk.RewritePass;
import net.boyechko.pandoc.postprocess.walk.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a freshly parsed document into canonical form. All passes share one bottom-up walk;
 * a second walk then reports attribute blocks nothing claimed. String merging is a separate
 * step, see {@link #mergeStrs}.
 *
 * <p>Passes are instantiated anew for every document, so one instance can process any number
 * of documents one after another.
 */
public class Postprocessor {
    private static final Logger logger = LoggerFactory.getLogger(Postprocessor.class);

    private static final int MIN_GROUP_SIZE_FOR_GROUPING = 3;

    private final List<Supplier<RewritePass>> passSuppliers;
    private final PostprocessConfig config;
    private final PostprocessListener listener;

    public static class Builder {
        private PostprocessConfig config;
        private Slugifier slugifier = new PandocSlugifier();
        private PostprocessListener listener = PostprocessListener.silent();
        private final List<Supplier<RewritePass>> extraPasses = new ArrayList<>();
        private final Set<String> skipPasses = new HashSet<>();
        private final Set<String> includeOnlyPasses = new HashSet<>();

        public Builder withConfig(PostprocessConfig config) {
            this.config = config;
            return this;
        }

        public Builder withSlugifier(Slugifier slugifier) {
            this.slugifier = slugifier;
            return this;
        }

        public Builder withListener(PostprocessListener listener) {
            this.listener = listener;
            return this;
        }

        /** Appends a pass after the standard ones. */
        public Builder addPass(Supplier<RewritePass> passSupplier) {
            extraPasses.add(passSupplier);
            return this;
        }

        public Builder skipPasses(Set<String> passClassNames) {
            skipPasses.addAll(passClassNames);
            return this;
        }

        public Builder includeOnlyPasses(Set<String> passClassNames) {
            includeOnlyPasses.addAll(passClassNames);
            return this;
        }

        public Postprocessor build() {
            if (listener == null) {
                throw new IllegalStateException("Listener must not be null");
            }
            return new Postprocessor(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    private Postprocessor(Builder builder) {
        this.config = builder.config != null ? builder.config : PostprocessConfig.loadDefault();
        this.listener = builder.listener;

        List<Supplier<RewritePass>> all =
                new ArrayList<>(PostprocessDefaults.passSuppliers(builder.slugifier));
        all.addAll(builder.extraPasses);
        this.passSuppliers = filterPasses(all, builder.skipPasses, builder.includeOnlyPasses);
        validatePassPrerequisites(passSuppliers);
    }

    /** Filters the list of pass suppliers based on the skip and includeOnly sets. */
    private static List<Supplier<RewritePass>> filterPasses(
            List<Supplier<RewritePass>> defaults, Set<String> skip, Set<String> includeOnly) {
        if (skip.isEmpty() && includeOnly.isEmpty()) {
            return List.copyOf(defaults);
        }
        List<Supplier<RewritePass>> filtered = new ArrayList<>();
        Set<String> removedNames = new HashSet<>();
        for (Supplier<RewritePass> supplier : defaults) {
            String className = supplier.get().getClass().getSimpleName();
            if (!includeOnly.isEmpty()) {
                if (includeOnly.contains(className)) {
                    filtered.add(supplier);
                } else {
                    removedNames.add(className);
                }
            } else if (!skip.contains(className)) {
                filtered.add(supplier);
            } else {
                removedNames.add(className);
            }
        }
        validateNoMissingPrerequisites(filtered, removedNames);
        return List.copyOf(filtered);
    }

    private static void validateNoMissingPrerequisites(
            List<Supplier<RewritePass>> passes, Set<String> removedNames) {
        for (Supplier<RewritePass> supplier : passes) {
            RewritePass pass = supplier.get();
            for (Class<? extends RewritePass> prereq : pass.prerequisites()) {
                String prereqName = prereq.getSimpleName();
                if (removedNames.contains(prereqName)) {
                    throw new IllegalArgumentException(
                            pass.getClass().getSimpleName()
                                    + " requires "
                                    + prereqName
                                    + ", which was excluded."
                                    + " To skip both, skip "
                                    + prereqName
                                    + " and "
                                    + pass.getClass().getSimpleName());
                }
            }
        }
    }

    private static void validatePassPrerequisites(List<Supplier<RewritePass>> passes) {
        Set<Class<? extends RewritePass>> seen = new HashSet<>();
        for (Supplier<RewritePass> supplier : passes) {
            RewritePass pass = supplier.get();
            for (Class<? extends RewritePass> prereq : pass.prerequisites()) {
                if (!seen.contains(prereq)) {
                    throw new IllegalArgumentException(
                            pass.getClass().getSimpleName()
                                    + " requires "
                                    + prereq.getSimpleName()
                                    + " to run first, but it has not been registered"
                                    + " or appears later in the pass list");
                }
            }
            seen.add(pass.getClass());
        }
    }

    public PostprocessConfig config() {
        return config;
    }

    /**
     * Rewrites {@code doc} in place. Problems are appended to {@code issues}; the run fails when
     * any of them is an error.
     */
    public PostprocessResult postprocess(Document doc, IssueList issues) {
        int firstNew = issues.size();

        listener.onPhaseStart("Rewrite passes");
        Filter.Builder filter = Filter.builder();
        for (Supplier<RewritePass> supplier : passSuppliers) {
            RewritePass pass = supplier.get();
            if (pass == null) {
                throw new IllegalStateException("Pass supplier returned null");
            }
            logger.debug("Registering pass {}", pass.name());
            filter.add(pass);
        }
        new TreeWalker(filter.build(), issues).walk(doc);

        AttrMarkerSweep sweep = new AttrMarkerSweep();
        listener.onPhaseStart(sweep.name());
        new TreeWalker(Filter.builder().add(sweep).build(), issues).walk(doc);

        IssueList found = new IssueList(issues.subList(firstNew, issues.size()));
        reportIssuesGrouped(found);
        listener.onSummary(found);

        if (logger.isTraceEnabled()) {
            logger.trace("Postprocessed tree:\n{}", TreeDump.dump(doc, true));
        }
        if (issues.hasErrors()) {
            logger.debug("Postprocessing failed with {} error(s)", issues.getErrors().size());
            return PostprocessResult.failed(issues);
        }
        return PostprocessResult.success(doc, issues);
    }

    /**
     * Merges adjacent strings, applies smart typography and binds abbreviations to the next
     * word. Rewrites {@code doc} in place and never fails.
     */
    public Document mergeStrs(Document doc) {
        StrMerger merger =
                new StrMerger(
                        config.getSmartTypography(),
                        new AbbreviationCoalescer(config.getAbbreviations()));
        listener.onPhaseStart(merger.name());
        return new TreeWalker(Filter.builder().add(merger).build(), new IssueList()).walk(doc);
    }

    private void reportIssuesGrouped(IssueList issues) {
        Map<IssueType, List<Issue>> grouped =
                issues.stream()
                        .collect(
                                Collectors.groupingBy(
                                        Issue::type, LinkedHashMap::new, Collectors.toList()));

        for (Map.Entry<IssueType, List<Issue>> entry : grouped.entrySet()) {
            List<Issue> groupIssues = entry.getValue();
            if (groupIssues.size() >= MIN_GROUP_SIZE_FOR_GROUPING) {
                listener.onIssueGroup(entry.getKey().groupLabel(), groupIssues);
            } else {
                for (Issue issue : groupIssues) {
                    listener.onIssue(issue);
                }
            }
        }
    }
}
