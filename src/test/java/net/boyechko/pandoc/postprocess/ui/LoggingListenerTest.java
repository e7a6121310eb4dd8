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

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import net.boyechko.pandoc.postprocess.document.SourceRange;
import net.boyechko.pandoc.postprocess.issue.Issue;
import net.boyechko.pandoc.postprocess.issue.IssueList;
import net.boyechko.pandoc.postprocess.issue.IssueLoc;
import net.boyechko.pandoc.postprocess.issue.IssueSev;
import net.boyechko.pandoc.postprocess.issue.IssueType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingListenerTest {
    private final Logger processingLogger =
            (Logger) LoggerFactory.getLogger(LoggingListener.LOGGER_NAME);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final LoggingListener listener = new LoggingListener();

    @BeforeEach
    void attachAppender() {
        appender.start();
        processingLogger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        processingLogger.detachAppender(appender);
    }

    private List<String> messages() {
        return appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
    }

    @Test
    void issueSeverityPicksLogLevel() {
        listener.onIssue(new Issue(IssueType.ORPHAN_CAPTION, IssueSev.WARNING, "orphan"));
        listener.onIssue(new Issue(IssueType.LEFTOVER_ATTR_MARKER, IssueSev.ERROR, "leftover"));

        assertEquals(Level.WARN, appender.list.get(0).getLevel());
        assertEquals(Level.ERROR, appender.list.get(1).getLevel());
        assertEquals("ISSUE Q-0-99 orphan", messages().get(0));
    }

    @Test
    void issueLocationProblemAndHintsAreRendered() {
        Issue issue =
                new Issue(
                        IssueType.INVALID_LIST_TABLE,
                        IssueSev.WARNING,
                        IssueLoc.at(SourceRange.of(10, 42)),
                        "Invalid list-table",
                        "row 2 has no cells",
                        List.of("add a nested bullet list"));

        listener.onIssue(issue);

        assertEquals(
                "ISSUE Q-2-35 Invalid list-table: row 2 has no cells (bytes 10-42)"
                        + " [hint: add a nested bullet list]",
                messages().get(0));
    }

    @Test
    void groupIsAnnouncedBeforeItsIssues() {
        List<Issue> issues =
                List.of(
                        new Issue(IssueType.ORPHAN_CAPTION, IssueSev.WARNING, "a"),
                        new Issue(IssueType.ORPHAN_CAPTION, IssueSev.WARNING, "b"));

        listener.onIssueGroup("caption without a preceding table", issues);

        assertEquals(
                List.of(
                        "GROUP caption without a preceding table (2 issues)",
                        "ISSUE Q-0-99 a",
                        "ISSUE Q-0-99 b"),
                messages());
    }

    @Test
    void summaryCountsBySeverity() {
        IssueList issues = new IssueList();
        issues.warn("w1");
        issues.warn("w2");
        issues.error("e1");

        listener.onSummary(issues);

        assertEquals("SUMMARY issues=3 errors=1 warnings=2", messages().get(0));
    }
}
