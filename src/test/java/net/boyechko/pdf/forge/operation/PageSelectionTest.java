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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import org.junit.jupiter.api.Test;

class PageSelectionTest {

    @Test
    void allSelectsEveryPage() {
        assertEquals(List.of(0, 1, 2), PageSelection.parse("all").indices(3));
        assertEquals(List.of(0, 1), PageSelection.parse("  ").indices(2));
        assertTrue(PageSelection.parse("ALL").isAll());
    }

    @Test
    void numbersAndRangesAreSortedAndDeduplicated() {
        PageSelection selection = PageSelection.parse("5-6, 1,3,1");
        assertEquals(List.of(0, 2, 4, 5), selection.indices(6));
        assertEquals("5-6,1,3,1", selection.toString());
    }

    @Test
    void parseRangesKeepsOrder() {
        assertEquals(
                List.of(new PageRange(4, 5), PageRange.single(1)),
                PageSelection.parseRanges("4-5,1"));
    }

    @Test
    void pageBeyondDocumentIsInvalidRange() {
        PdfForgeException e =
                assertThrows(
                        PdfForgeException.class, () -> PageSelection.parse("2-4").indices(3));
        assertEquals(ErrorKind.INVALID_RANGE, e.kind());
    }

    @Test
    void reversedRangeAndPageZeroAreInvalidRange() {
        assertEquals(
                ErrorKind.INVALID_RANGE,
                assertThrows(PdfForgeException.class, () -> PageSelection.parse("3-1")).kind());
        assertEquals(
                ErrorKind.INVALID_RANGE,
                assertThrows(PdfForgeException.class, () -> PageSelection.parse("0")).kind());
    }

    @Test
    void textIsInvalidParameter() {
        assertEquals(
                ErrorKind.INVALID_PARAMETER,
                assertThrows(PdfForgeException.class, () -> PageSelection.parse("one")).kind());
        assertEquals(
                ErrorKind.INVALID_PARAMETER,
                assertThrows(PdfForgeException.class, () -> PageSelection.parse(",,")).kind());
    }

    @Test
    void rangesKnowWhetherTheyOverlap() {
        assertTrue(new PageRange(1, 3).overlaps(new PageRange(3, 5)));
        assertFalse(new PageRange(1, 2).overlaps(new PageRange(3, 5)));
        assertEquals(3, new PageRange(3, 5).size());
    }
}
