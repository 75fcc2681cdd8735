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
import net.boyechko.pdf.forge.cos.CosDictionary;

/** Reverses the TIFF (2) and PNG (10-15) predictors of Flate and LZW streams. */
record Predictor(int predictor, int colors, int bitsPerComponent, int columns) {

    static Predictor fromParms(CosDictionary parms) {
        return new Predictor(
                parms.getInt("Predictor", 1),
                parms.getInt("Colors", 1),
                parms.getInt("BitsPerComponent", 8),
                parms.getInt("Columns", 1));
    }

    byte[] undo(byte[] data) {
        if (predictor == 2) {
            return undoTiff(data);
        }
        if (predictor >= 10) {
            return undoPng(data);
        }
        return data;
    }

    private int bytesPerPixel() {
        return Math.max(1, (colors * bitsPerComponent + 7) / 8);
    }

    private int rowBytes() {
        return (columns * colors * bitsPerComponent + 7) / 8;
    }

    private byte[] undoTiff(byte[] data) {
        int bpp = bytesPerPixel();
        int rowBytes = rowBytes();
        if (bitsPerComponent != 8 || rowBytes == 0) {
            return data;
        }
        byte[] out = data.clone();
        for (int rowStart = 0; rowStart + rowBytes <= out.length; rowStart += rowBytes) {
            for (int i = bpp; i < rowBytes; i++) {
                out[rowStart + i] = (byte) (out[rowStart + i] + out[rowStart + i - bpp]);
            }
        }
        return out;
    }

    private byte[] undoPng(byte[] data) {
        int bpp = bytesPerPixel();
        int rowBytes = rowBytes();
        if (rowBytes == 0) {
            return data;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length);
        byte[] previous = new byte[rowBytes];
        byte[] row = new byte[rowBytes];
        int pos = 0;
        while (pos + 1 + rowBytes <= data.length) {
            int filterType = data[pos++] & 0xFF;
            System.arraycopy(data, pos, row, 0, rowBytes);
            pos += rowBytes;
            for (int i = 0; i < rowBytes; i++) {
                int left = i >= bpp ? row[i - bpp] & 0xFF : 0;
                int up = previous[i] & 0xFF;
                int upLeft = i >= bpp ? previous[i - bpp] & 0xFF : 0;
                int delta =
                        switch (filterType) {
                            case 1 -> left;
                            case 2 -> up;
                            case 3 -> (left + up) / 2;
                            case 4 -> paeth(left, up, upLeft);
                            default -> 0;
                        };
                row[i] = (byte) (row[i] + delta);
            }
            out.write(row, 0, rowBytes);
            System.arraycopy(row, 0, previous, 0, rowBytes);
        }
        return out.toByteArray();
    }

    private static int paeth(int a, int b, int c) {
        int p = a + b - c;
        int pa = Math.abs(p - a);
        int pb = Math.abs(p - b);
        int pc = Math.abs(p - c);
        if (pa <= pb && pa <= pc) {
            return a;
        }
        return pb <= pc ? b : c;
    }
}
