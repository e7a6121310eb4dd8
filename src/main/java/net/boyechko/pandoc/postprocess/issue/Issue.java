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
package net.boyechko.pandoc.postprocess.issue;

import java.util.List;

/** A problem found in a document while postprocessing it. */
public final class Issue {
    private final IssueType type;
    private final IssueSev severity;
    private final IssueLoc where;
    private final String message;
    private final String problem; // may be null when the message says it all
    private final List<String> hints;

    public Issue(IssueType type, IssueSev sev, String message) {
        this(type, sev, IssueLoc.none(), message, null, List.of());
    }

    public Issue(IssueType type, IssueSev sev, IssueLoc where, String message) {
        this(type, sev, where, message, null, List.of());
    }

    public Issue(
            IssueType type,
            IssueSev sev,
            IssueLoc where,
            String message,
            String problem,
            List<String> hints) {
        this.type = type;
        this.severity = sev;
        this.where = where != null ? where : IssueLoc.none();
        this.message = message;
        this.problem = problem;
        this.hints = hints != null ? List.copyOf(hints) : List.of();
    }

    public IssueType type() {
        return type;
    }

    public String code() {
        return type.code();
    }

    public IssueSev severity() {
        return severity;
    }

    public IssueLoc where() {
        return where;
    }

    public String message() {
        return message;
    }

    public String problem() {
        return problem;
    }

    public List<String> hints() {
        return hints;
    }

    public boolean isError() {
        return severity == IssueSev.ERROR;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(code()).append("] ").append(severity).append(": ").append(message);
        if (problem != null) {
            sb.append(" - ").append(problem);
        }
        if (where.range() != null) {
            sb.append(' ').append(where.range());
        }
        return sb.toString();
    }
}
