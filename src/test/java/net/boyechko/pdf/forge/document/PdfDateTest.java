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
package net.boyechko.pdf.forge.document;

import static org.junit.jupiter.api.Assertions.*;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PdfDateTest {

    @Test
    void formatsOffsetWithApostrophes() {
        ZonedDateTime time = ZonedDateTime.of(2025, 3, 14, 9, 30, 0, 0, ZoneOffset.ofHours(3));
        assertEquals("D:20250314093000+03'00'", PdfDate.format(time));
    }

    @Test
    void formatsUtcAsZ() {
        ZonedDateTime time = ZonedDateTime.of(2024, 12, 1, 0, 0, 5, 0, ZoneOffset.UTC);
        assertEquals("D:20241201000005Z", PdfDate.format(time));
    }

    @Test
    void parsesNegativeOffset() {
        ZonedDateTime parsed = PdfDate.parse("D:20250101120000-05'30'").orElseThrow();
        assertEquals(ZoneOffset.ofHoursMinutes(-5, -30), parsed.getOffset());
        assertEquals(12, parsed.getHour());
    }

    @Test
    void missingFieldsTakeTheirDefaults() {
        ZonedDateTime parsed = PdfDate.parse("D:2023").orElseThrow();
        assertEquals(ZonedDateTime.of(2023, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC), parsed);
    }

    @Test
    void prefixIsOptional() {
        assertTrue(PdfDate.parse("20230615").isPresent());
    }

    @Test
    void rejectsGarbageAndImpossibleDates() {
        assertEquals(Optional.empty(), PdfDate.parse("yesterday"));
        assertEquals(Optional.empty(), PdfDate.parse("D:20231345"));
        assertEquals(Optional.empty(), PdfDate.parse(null));
    }
}
