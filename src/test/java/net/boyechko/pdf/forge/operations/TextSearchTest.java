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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextSearchTest {

    @Test
    void overlappingOccurrencesAreAllFound() {
        List<TextSearch.Match> matches = TextSearch.find("aaaa", "aa", true);

        assertEquals(List.of(0, 1, 2), matches.stream().map(TextSearch.Match::position).toList());
    }

    @Test
    void caseIsIgnoredUnlessAsked() {
        assertEquals(2, TextSearch.find("Fatura fatura", "FATURA", false).size());
        assertEquals(1, TextSearch.find("Fatura fatura", "fatura", true).size());
        assertTrue(TextSearch.find("Fatura", "", false).isEmpty());
    }

    @Test
    void matchesCarryLineAndBoundedContext() {
        String text = "first line\n" + "x".repeat(60) + "needle" + "y".repeat(60) + "\nneedle";

        List<TextSearch.Match> matches = TextSearch.find(text, "needle", true);

        assertEquals(2, matches.size());
        TextSearch.Match middle = matches.get(0);
        assertEquals(2, middle.line());
        assertEquals("x".repeat(50) + "needle" + "y".repeat(50), middle.context());
        assertEquals(3, matches.get(1).line());
        assertTrue(matches.get(1).context().endsWith("\nneedle"));
    }
}
