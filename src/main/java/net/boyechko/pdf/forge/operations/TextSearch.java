/*
 * PDF-Forge - Batch PDF Document Operations
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
package net.boyechko.pdf.forge.operations;

import java.util.ArrayList;
import java.util.List;

/** Finds every occurrence of a term in a page's text, overlapping ones included. */
final class TextSearch {
    static final int CONTEXT = 50;

    /**
     * One occurrence.
     *
     * @param position character offset in the page text
     * @param line 1-based line of the occurrence
     * @param context the occurrence with up to {@link #CONTEXT} characters on either side
     */
    record Match(int position, int line, String context) {}

    private TextSearch() {}

    static List<Match> find(String text, String term, boolean matchCase) {
        List<Match> matches = new ArrayList<>();
        if (term.isEmpty()) {
            return matches;
        }
        int line = 1;
        int counted = 0;
        for (int pos = 0; pos + term.length() <= text.length(); pos++) {
            if (!text.regionMatches(!matchCase, pos, term, 0, term.length())) {
                continue;
            }
            for (; counted < pos; counted++) {
                if (text.charAt(counted) == '\n') {
                    line++;
                }
            }
            int from = Math.max(0, pos - CONTEXT);
            int to = Math.min(text.length(), pos + term.length() + CONTEXT);
            matches.add(new Match(pos, line, text.substring(from, to)));
        }
        return matches;
    }
}
