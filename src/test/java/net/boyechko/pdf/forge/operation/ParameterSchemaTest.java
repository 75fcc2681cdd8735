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

import java.nio.file.Path;
import java.util.Map;
import net.boyechko.pdf.forge.core.EngineSettings;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.core.Quality;
import org.junit.jupiter.api.Test;

class ParameterSchemaTest {
    private static final ParameterSchema SCHEMA =
            ParameterSchema.of(
                    ParameterSpec.text("text", null).asRequired(),
                    ParameterSpec.integer("count", 1),
                    ParameterSpec.decimal("opacity", 0.3),
                    ParameterSpec.bool("bookmarks", true),
                    ParameterSpec.choice("layer", "over", "over", "under"),
                    ParameterSpec.pages("pages"),
                    ParameterSpec.path("image"),
                    ParameterSpec.choice("quality", null, "high", "medium", "low", "minimum")
                            .withSettingsDefault(s -> s.defaultQuality().id()));

    private static Parameters validate(Map<String, String> raw) {
        return SCHEMA.validate(raw, EngineSettings.defaults());
    }

    private static ErrorKind failure(Map<String, String> raw) {
        return assertThrows(PdfForgeException.class, () -> validate(raw)).kind();
    }

    @Test
    void defaultsFillUnspecifiedParameters() {
        Parameters params = validate(Map.of("text", "hi"));

        assertEquals(1, params.integer("count"));
        assertEquals(0.3, params.decimal("opacity"), 1e-9);
        assertTrue(params.bool("bookmarks"));
        assertEquals("over", params.choice("layer"));
        assertTrue(params.pages("pages").isAll());
        assertFalse(params.has("image"));
        assertEquals("medium", params.choice("quality"));
    }

    @Test
    void valuesAreConverted() {
        Parameters params =
                validate(
                        Map.of(
                                "text", "hi",
                                "count", " 7 ",
                                "bookmarks", "no",
                                "layer", "UNDER",
                                "pages", "2-3",
                                "image", "logo.png"));

        assertEquals(7, params.integer("count"));
        assertFalse(params.bool("bookmarks"));
        assertEquals("under", params.choice("layer"));
        assertEquals("2-3", params.pages("pages").toString());
        assertEquals(Path.of("logo.png"), params.path("image"));
    }

    @Test
    void settingsSupplyDefaults() {
        EngineSettings low = EngineSettings.builder().withDefaultQuality(Quality.LOW).build();
        assertEquals("low", SCHEMA.validate(Map.of("text", "x"), low).choice("quality"));
    }

    @Test
    void badInputIsInvalidParameter() {
        assertEquals(ErrorKind.INVALID_PARAMETER, failure(Map.of()));
        assertEquals(ErrorKind.INVALID_PARAMETER, failure(Map.of("text", "x", "color", "red")));
        assertEquals(ErrorKind.INVALID_PARAMETER, failure(Map.of("text", "x", "count", "many")));
        assertEquals(ErrorKind.INVALID_PARAMETER, failure(Map.of("text", "x", "opacity", "½")));
        assertEquals(ErrorKind.INVALID_PARAMETER, failure(Map.of("text", "x", "bookmarks", "y")));
        assertEquals(ErrorKind.INVALID_PARAMETER, failure(Map.of("text", "x", "layer", "side")));
    }

    @Test
    void duplicateDeclarationIsAProgrammingError() {
        assertThrows(
                IllegalArgumentException.class,
                () ->
                        ParameterSchema.of(
                                ParameterSpec.text("a", null), ParameterSpec.bool("a", true)));
    }

    @Test
    void operationKindsAreLookedUpById() {
        assertEquals(OperationKind.ADD_TEXT, OperationKind.fromId("add-text"));
        assertEquals(
                ErrorKind.INVALID_PARAMETER,
                assertThrows(PdfForgeException.class, () -> OperationKind.fromId("shred")).kind());
    }
}
