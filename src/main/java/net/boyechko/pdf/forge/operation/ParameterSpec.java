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

import java.util.List;
import java.util.function.Function;
import net.boyechko.pdf.forge.core.EngineSettings;

/**
 * Declaration of one named parameter.
 *
 * @param name parameter name as written on the command line ({@code font-size})
 * @param type value type
 * @param defaultValue default in textual form, or null if the parameter has none
 * @param settingsDefault default taken from the engine settings, or null; wins over
 *     {@code defaultValue}
 * @param choices allowed values for {@link ParameterType#CHOICE}
 * @param required whether the caller must supply a value
 */
public record ParameterSpec(
        String name,
        ParameterType type,
        String defaultValue,
        Function<EngineSettings, String> settingsDefault,
        List<String> choices,
        boolean required) {

    public ParameterSpec {
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    public static ParameterSpec text(String name, String defaultValue) {
        return new ParameterSpec(name, ParameterType.TEXT, defaultValue, null, null, false);
    }

    public static ParameterSpec integer(String name, Integer defaultValue) {
        return new ParameterSpec(
                name, ParameterType.INTEGER, stringOf(defaultValue), null, null, false);
    }

    public static ParameterSpec decimal(String name, Double defaultValue) {
        return new ParameterSpec(
                name, ParameterType.DECIMAL, stringOf(defaultValue), null, null, false);
    }

    public static ParameterSpec bool(String name, boolean defaultValue) {
        return new ParameterSpec(
                name, ParameterType.BOOLEAN, Boolean.toString(defaultValue), null, null, false);
    }

    public static ParameterSpec choice(String name, String defaultValue, String... choices) {
        return new ParameterSpec(
                name, ParameterType.CHOICE, defaultValue, null, List.of(choices), false);
    }

    public static ParameterSpec pages(String name) {
        return new ParameterSpec(name, ParameterType.PAGES, "all", null, null, false);
    }

    public static ParameterSpec path(String name) {
        return new ParameterSpec(name, ParameterType.PATH, null, null, null, false);
    }

    /** Returns a copy whose default comes from the engine settings. */
    public ParameterSpec withSettingsDefault(Function<EngineSettings, String> fallback) {
        return new ParameterSpec(name, type, defaultValue, fallback, choices, required);
    }

    public ParameterSpec asRequired() {
        return new ParameterSpec(name, type, null, settingsDefault, choices, true);
    }

    /** The effective default under {@code settings}, or null. */
    public String defaultFor(EngineSettings settings) {
        if (settingsDefault != null && settings != null) {
            return settingsDefault.apply(settings);
        }
        return defaultValue;
    }

    private static String stringOf(Object value) {
        return value == null ? null : value.toString();
    }
}
