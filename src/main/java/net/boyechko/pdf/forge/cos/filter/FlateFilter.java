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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;
import net.boyechko.pdf.forge.cos.CosDictionary;

/** zlib/deflate, with TIFF and PNG predictor support on decode. */
public class FlateFilter implements StreamFilter {
    private static final int BUFFER_SIZE = 8192;

    @Override
    public String name() {
        return "FlateDecode";
    }

    @Override
    public byte[] decode(byte[] data, CosDictionary parms) throws IOException {
        byte[] inflated = inflate(data);
        return Predictor.fromParms(parms).undo(inflated);
    }

    @Override
    public byte[] encode(byte[] data) {
        return deflate(data, Deflater.BEST_COMPRESSION);
    }

    /**
     * Inflates a zlib stream. Truncated input yields whatever was recovered before the break
     * rather than failing, since damaged files frequently end mid-stream.
     */
    static byte[] inflate(byte[] data) throws IOException {
        Inflater inflater = new Inflater();
        inflater.setInput(data);
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length * 2));
        byte[] buffer = new byte[BUFFER_SIZE];
        try {
            while (!inflater.finished()) {
                int count = inflater.inflate(buffer);
                if (count == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    break;
                }
                out.write(buffer, 0, count);
            }
        } catch (DataFormatException e) {
            if (out.size() == 0) {
                throw new IOException("FlateDecode error: " + e.getMessage(), e);
            }
        } finally {
            inflater.end();
        }
        return out.toByteArray();
    }

    public static byte[] deflate(byte[] data, int level) {
        Deflater deflater = new Deflater(level);
        deflater.setInput(data);
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 2));
        byte[] buffer = new byte[BUFFER_SIZE];
        try {
            while (!deflater.finished()) {
                int count = deflater.deflate(buffer);
                out.write(buffer, 0, count);
            }
        } finally {
            deflater.end();
        }
        return out.toByteArray();
    }
}
