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
package net.boyechko.pdf.forge.cos;

/** A PDF name, stored without the leading slash and with {@code #xx} escapes resolved. */
public record CosName(String value) implements CosObject {
    public static final CosName TYPE = new CosName("Type");

    public CosName {
        if (value == null) {
            throw new IllegalArgumentException("Name value is required");
        }
    }

    public static CosName of(String value) {
        return new CosName(value);
    }

    @Override
    public String toString() {
        return "/" + value;
    }
}
