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
package net.boyechko.pdf.forge.operation;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;

/**
 * A set of pages written as comma-separated numbers and inclusive ranges ({@code 1,3,5-7}).
 * {@code all} or an empty string selects every page.
 */
public final class PageSelection {
    private static final PageSelection ALL = new PageSelection(null);

    private final List<PageRange> ranges;

    private PageSelection(List<PageRange> ranges) {
        this.ranges = ranges;
    }

    public static PageSelection all() {
        return ALL;
    }

    /**
     * Parses a selection.
     *
     * @throws PdfForgeException INVALID_PARAMETER for unparseable text, INVALID_RANGE for reversed
     *     ranges or page 0
     */
    public static PageSelection parse(String text) {
        if (text == null || text.isBlank() || text.trim().equalsIgnoreCase("all")) {
            return ALL;
        }
        return new PageSelection(parseRanges(text));
    }

    /** Parses comma-separated ranges, keeping their order and duplicates. */
    public static List<PageRange> parseRanges(String text) {
        List<PageRange> ranges = new ArrayList<>();
        for (String part : text.split(",")) {
            String item = part.trim();
            if (item.isEmpty()) {
                continue;
            }
            int dash = item.indexOf('-', 1);
            if (dash < 0) {
                ranges.add(PageRange.single(parsePage(item)));
            } else {
                ranges.add(
                        new PageRange(
                                parsePage(item.substring(0, dash)),
                                parsePage(item.substring(dash + 1))));
            }
        }
        if (ranges.isEmpty()) {
            throw new PdfForgeException(ErrorKind.INVALID_PARAMETER, "Empty page list: " + text);
        }
        return ranges;
    }

    private static int parsePage(String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_PARAMETER, "Not a page number: '" + text.trim() + "'");
        }
    }

    public boolean isAll() {
        return ranges == null;
    }

    /**
     * Returns the selected 0-based page indices in ascending order, without duplicates.
     *
     * @throws PdfForgeException INVALID_RANGE if a selected page does not exist
     */
    public List<Integer> indices(int pageCount) {
        TreeSet<Integer> selected = new TreeSet<>();
        if (ranges == null) {
            for (int i = 0; i < pageCount; i++) {
                selected.add(i);
            }
        } else {
            for (PageRange range : ranges) {
                range.checkWithin(pageCount);
                for (int page = range.first(); page <= range.last(); page++) {
                    selected.add(page - 1);
                }
            }
        }
        return new ArrayList<>(selected);
    }

    @Override
    public String toString() {
        if (ranges == null) {
            return "all";
        }
        List<String> parts = new ArrayList<>();
        for (PageRange range : ranges) {
            parts.add(range.toString());
        }
        return String.join(",", parts);
    }
}
