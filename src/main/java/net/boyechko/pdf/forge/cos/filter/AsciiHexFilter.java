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
import net.boyechko.pdf.forge.cos.CosDictionary;

public class AsciiHexFilter implements StreamFilter {
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    @Override
    public String name() {
        return "ASCIIHexDecode";
    }

    @Override
    public byte[] decode(byte[] data, CosDictionary parms) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length / 2);
        int high = -1;
        for (byte b : data) {
            int c = b & 0xFF;
            if (c == '>') {
                break;
            }
            int digit = Character.digit(c, 16);
            if (digit < 0) {
                if (Character.isWhitespace(c) || c == 0) {
                    continue;
                }
                throw new IOException(
                        "ASCIIHexDecode: invalid character 0x" + Integer.toHexString(c));
            }
            if (high < 0) {
                high = digit;
            } else {
                out.write((high << 4) | digit);
                high = -1;
            }
        }
        if (high >= 0) {
            out.write(high << 4);
        }
        return out.toByteArray();
    }

    @Override
    public byte[] encode(byte[] data) {
        byte[] out = new byte[data.length * 2 + 1];
        for (int i = 0; i < data.length; i++) {
            out[2 * i] = (byte) HEX[(data[i] >> 4) & 0x0F];
            out[2 * i + 1] = (byte) HEX[data[i] & 0x0F];
        }
        out[out.length - 1] = '>';
        return out;
    }
}
