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
package net.boyechko.pdf.forge.cos.filter;

import java.io.IOException;
import net.boyechko.pdf.forge.cos.CosDictionary;

/** A reversible stream filter operating on whole payloads. */
public interface StreamFilter {
    /** The filter name as it appears in a stream's {@code /Filter} entry. */
    String name();

    /**
     * Decodes {@code data}.
     *
     * @param parms the {@code /DecodeParms} dictionary for this filter, never null
     */
    byte[] decode(byte[] data, CosDictionary parms) throws IOException;

    /** Encodes {@code data}. Filters that are decode-only throw {@link IOException}. */
    default byte[] encode(byte[] data) throws IOException {
        throw new IOException(name() + " encoding is not supported");
    }
}
