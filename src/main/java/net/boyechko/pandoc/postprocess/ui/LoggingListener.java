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
package net.boyechko.pandoc.postprocess.ui;

import java.util.List;
import net.boyechko.pandoc.postprocess.core.PostprocessListener;
import net.boyechko.pandoc.postprocess.issue.Issue;
import net.boyechko.pandoc.postprocess.issue.IssueList;
import net.boyechko.pandoc.postprocess.issue.IssueSev;
import org.slf4j.LoggerFactory;

/**
 * A {@link PostprocessListener} that routes all events through SLF4J. Where the events end up
 * is decided by the logging configuration.
 */
public class LoggingListener implements PostprocessListener {

    static final String LOGGER_NAME = "net.boyechko.pandoc.postprocess.processing";

    private static final org.slf4j.Logger logger = LoggerFactory.getLogger(LOGGER_NAME);

    private final IssueFormatter issueFormatter;

    public LoggingListener() {
        this(new LogIssueFormatter());
    }

    public LoggingListener(IssueFormatter issueFormatter) {
        this.issueFormatter = issueFormatter;
    }

    @Override
    public void onPhaseStart(String phaseName) {
        logger.info("PHASE {}", phaseName);
    }

    @Override
    public void onIssue(Issue issue) {
        String message = "ISSUE " + issue.code() + " " + issueFormatter.format(issue);
        IssueSev severity = issue.severity();
        if (severity == IssueSev.INFO) {
            logger.info("{}", message);
        } else if (severity == IssueSev.WARNING) {
            logger.warn("{}", message);
        } else {
            logger.error("{}", message);
        }
    }

    @Override
    public void onIssueGroup(String groupLabel, List<Issue> issues) {
        logger.info("GROUP {} ({} issues)", groupLabel, issues.size());
        for (Issue issue : issues) {
            onIssue(issue);
        }
    }

    @Override
    public void onInfo(String message) {
        logger.info("{}", message);
    }

    @Override
    public void onVerboseOutput(String message) {
        logger.debug("{}", message);
    }

    @Override
    public void onSummary(IssueList allIssues) {
        int errors = allIssues.getErrors().size();
        int warnings = allIssues.getWarnings().size();
        logger.info("SUMMARY issues={} errors={} warnings={}", allIssues.size(), errors, warnings);
    }
}
