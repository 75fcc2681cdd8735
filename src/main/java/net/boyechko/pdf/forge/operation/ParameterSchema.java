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

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import net.boyechko.pdf.forge.core.EngineSettings;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;

/** The named parameters an operation accepts, and their validation into {@link Parameters}. */
public final class ParameterSchema {
    private final Map<String, ParameterSpec> specs;

    private ParameterSchema(Map<String, ParameterSpec> specs) {
        this.specs = Collections.unmodifiableMap(specs);
    }

    public static ParameterSchema of(ParameterSpec... specs) {
        Map<String, ParameterSpec> map = new LinkedHashMap<>();
        for (ParameterSpec spec : specs) {
            if (map.put(spec.name(), spec) != null) {
                throw new IllegalArgumentException("Duplicate parameter " + spec.name());
            }
        }
        return new ParameterSchema(map);
    }

    public static ParameterSchema empty() {
        return new ParameterSchema(new LinkedHashMap<>());
    }

    public Collection<ParameterSpec> specs() {
        return specs.values();
    }

    public ParameterSpec spec(String name) {
        return specs.get(name);
    }

    /**
     * Checks {@code raw} against the schema and converts every value to its declared type. Defaults
     * fill in unspecified parameters.
     *
     * @throws PdfForgeException INVALID_PARAMETER for an unknown name, a malformed value, a value
     *     outside a choice list, or a missing required parameter
     */
    public Parameters validate(Map<String, String> raw, EngineSettings settings) {
        for (String name : raw.keySet()) {
            if (!specs.containsKey(name)) {
                throw new PdfForgeException(
                        ErrorKind.INVALID_PARAMETER,
                        "Unknown parameter '" + name + "'; expected one of " + specs.keySet());
            }
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (ParameterSpec spec : specs.values()) {
            String text = raw.containsKey(spec.name()) ? raw.get(spec.name()) : null;
            if (text == null) {
                if (spec.required()) {
                    throw new PdfForgeException(
                            ErrorKind.INVALID_PARAMETER,
                            "Missing required parameter '" + spec.name() + "'");
                }
                text = spec.defaultFor(settings);
            }
            if (text != null) {
                values.put(spec.name(), convert(spec, text));
            }
        }
        return new Parameters(values);
    }

    private static Object convert(ParameterSpec spec, String text) {
        String trimmed = text.trim();
        try {
            return switch (spec.type()) {
                case TEXT -> text;
                case INTEGER -> Integer.parseInt(trimmed);
                case DECIMAL -> Double.parseDouble(trimmed);
                case BOOLEAN -> parseBoolean(spec, trimmed);
                case CHOICE -> parseChoice(spec, trimmed);
                case PAGES -> PageSelection.parse(trimmed);
                case PATH -> Path.of(trimmed);
            };
        } catch (NumberFormatException | InvalidPathException e) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_PARAMETER,
                    "Invalid " + spec.type().name().toLowerCase(Locale.ROOT)
                            + " for '" + spec.name() + "': '" + text + "'");
        }
    }

    private static Boolean parseBoolean(ParameterSpec spec, String text) {
        switch (text.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on", "1":
                return Boolean.TRUE;
            case "false", "no", "off", "0":
                return Boolean.FALSE;
            default:
                throw new PdfForgeException(
                        ErrorKind.INVALID_PARAMETER,
                        "Invalid boolean for '" + spec.name() + "': '" + text + "'");
        }
    }

    private static String parseChoice(ParameterSpec spec, String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (!spec.choices().contains(lower)) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_PARAMETER,
                    "Invalid value '" + text + "' for '" + spec.name() + "'; expected one of "
                            + spec.choices());
        }
        return lower;
    }
}
