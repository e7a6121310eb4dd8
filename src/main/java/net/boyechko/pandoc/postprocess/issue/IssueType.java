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

/** Kind of problem found while postprocessing, with its stable diagnostic code. */
public enum IssueType {
    INVALID_LIST_TABLE("Q-2-35", "Invalid List-Table Structure"),
    ORPHAN_CAPTION("Q-0-99", "caption without a preceding table"),
    LEFTOVER_ATTR_MARKER("Q-0-99", "attribute block left unattached"),
    UNSUPPORTED_SHORTCODE_ARG("Q-0-99", "unsupported shortcode argument"),
    GENERIC("Q-0-99", "generic diagnostic");

    private final String code;
    private final String groupLabel;

    IssueType(String code, String groupLabel) {
        this.code = code;
        this.groupLabel = groupLabel;
    }

    public String code() {
        return code;
    }

    public String groupLabel() {
        return groupLabel;
    }
}
