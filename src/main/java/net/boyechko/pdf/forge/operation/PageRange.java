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

import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;

/** An inclusive, 1-based range of page numbers. */
public record PageRange(int first, int last) {

    /**
     * @throws PdfForgeException INVALID_RANGE if the range is reversed or starts below 1
     */
    public PageRange {
        if (first < 1) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_RANGE, "Page numbers start at 1: " + first);
        }
        if (last < first) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_RANGE, "Reversed page range " + first + "-" + last);
        }
    }

    public static PageRange single(int page) {
        return new PageRange(page, page);
    }

    public int size() {
        return last - first + 1;
    }

    public boolean overlaps(PageRange other) {
        return first <= other.last && other.first <= last;
    }

    /** Fails with INVALID_RANGE if the range reaches past {@code pageCount}. */
    public void checkWithin(int pageCount) {
        if (last > pageCount) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_RANGE,
                    "Page range " + this + " exceeds the document's " + pageCount + " pages");
        }
    }

    @Override
    public String toString() {
        return first == last ? Integer.toString(first) : first + "-" + last;
    }
}
