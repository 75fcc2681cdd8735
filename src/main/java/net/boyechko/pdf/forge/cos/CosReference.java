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

/** A link to an indirect object by number and generation. */
public record CosReference(int objectNumber, int generation) implements CosObject {
    public CosReference {
        if (objectNumber <= 0) {
            throw new IllegalArgumentException("Object number must be positive: " + objectNumber);
        }
        if (generation < 0) {
            throw new IllegalArgumentException("Generation must not be negative: " + generation);
        }
    }

    public static CosReference of(int objectNumber) {
        return new CosReference(objectNumber, 0);
    }

    @Override
    public String toString() {
        return objectNumber + " " + generation + " R";
    }
}
