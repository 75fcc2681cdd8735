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
package net.boyechko.pdf.forge.codec;

/**
 * Options for {@link PdfDecoder#decode(byte[], DecodeOptions)}.
 *
 * @param password the user or owner password, or null to try the empty user password and keep the
 *     document sealed if that fails
 * @param forceRepair skip the cross-reference table and rebuild the object table by scanning
 */
public record DecodeOptions(String password, boolean forceRepair) {

    public static DecodeOptions defaults() {
        return new DecodeOptions(null, false);
    }

    public static DecodeOptions withPassword(String password) {
        return new DecodeOptions(password, false);
    }
}
