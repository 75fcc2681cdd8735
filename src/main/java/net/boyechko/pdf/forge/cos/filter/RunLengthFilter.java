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

public class RunLengthFilter implements StreamFilter {
    private static final int EOD = 128;

    @Override
    public String name() {
        return "RunLengthDecode";
    }

    @Override
    public byte[] decode(byte[] data, CosDictionary parms) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * 2);
        int pos = 0;
        while (pos < data.length) {
            int length = data[pos++] & 0xFF;
            if (length == EOD) {
                break;
            }
            if (length < EOD) {
                int count = Math.min(length + 1, data.length - pos);
                out.write(data, pos, count);
                pos += count;
            } else if (pos < data.length) {
                int repeat = 257 - length;
                byte value = data[pos++];
                for (int i = 0; i < repeat; i++) {
                    out.write(value);
                }
            }
        }
        return out.toByteArray();
    }
}
