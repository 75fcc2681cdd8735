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
package net.boyechko.pdf.forge.core;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class EngineSettingsTest {

    @Test
    void defaultsMatchDocumentedValues() {
        EngineSettings settings = EngineSettings.defaults();

        assertEquals(Path.of("output"), settings.outputDirectory());
        assertEquals(Quality.MEDIUM, settings.defaultQuality());
        assertEquals("tur", settings.ocrLanguage());
        assertEquals(300, settings.ocrDpi());
        assertEquals(1, settings.maxOcrWorkers());
        assertFalse(settings.overwrite());
    }

    @Test
    void effectiveWorkersNeverExceedsConfiguredCap() {
        EngineSettings settings = EngineSettings.builder().withMaxWorkers(1).build();
        assertEquals(1, settings.effectiveWorkers());

        int many = EngineSettings.builder().withMaxWorkers(512).build().effectiveWorkers();
        assertTrue(many >= 1 && many <= Runtime.getRuntime().availableProcessors());
    }

    @Test
    void toBuilderPreservesEveryField() {
        EngineSettings original =
                EngineSettings.builder()
                        .withOutputDirectory(Path.of("out"))
                        .withDefaultQuality(Quality.LOW)
                        .withOcrLanguage("eng")
                        .withOcrDpi(150)
                        .withOcrMinTextRuns(3)
                        .withMaxWorkers(2)
                        .withMaxOcrWorkers(2)
                        .withOverwrite(true)
                        .build();

        assertEquals(original, original.toBuilder().build());
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(
                IllegalArgumentException.class,
                () -> EngineSettings.builder().withOcrDpi(50).build());
        assertThrows(
                IllegalArgumentException.class,
                () -> EngineSettings.builder().withMaxWorkers(0).build());
        assertThrows(
                IllegalArgumentException.class,
                () -> EngineSettings.builder().withOcrLanguage(" ").build());
    }

    @Test
    void qualityLookupIsCaseInsensitive() {
        assertEquals(Quality.MINIMUM, Quality.fromId("Minimum"));
        assertEquals("high", Quality.HIGH.id());

        PdfForgeException e =
                assertThrows(PdfForgeException.class, () -> Quality.fromId("best"));
        assertEquals(ErrorKind.INVALID_PARAMETER, e.kind());
    }
}
