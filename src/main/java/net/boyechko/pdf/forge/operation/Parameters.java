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

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;

/** Validated, typed parameter values. Produced by {@link ParameterSchema#validate}. */
public final class Parameters {
    private final Map<String, Object> values;

    Parameters(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public String text(String name) {
        return (String) values.get(name);
    }

    public String text(String name, String fallback) {
        String value = text(name);
        return value != null ? value : fallback;
    }

    public int integer(String name) {
        return (Integer) require(name);
    }

    public Integer optionalInteger(String name) {
        return (Integer) values.get(name);
    }

    public double decimal(String name) {
        return (Double) require(name);
    }

    public Double optionalDecimal(String name) {
        return (Double) values.get(name);
    }

    public boolean bool(String name) {
        return (Boolean) require(name);
    }

    public String choice(String name) {
        return (String) require(name);
    }

    public PageSelection pages(String name) {
        PageSelection selection = (PageSelection) values.get(name);
        return selection != null ? selection : PageSelection.all();
    }

    public Path path(String name) {
        return (Path) values.get(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private Object require(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_PARAMETER, "Parameter '" + name + "' has no value");
        }
        return value;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
