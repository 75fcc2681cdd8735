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

public class Ascii85Filter implements StreamFilter {

    @Override
    public String name() {
        return "ASCII85Decode";
    }

    @Override
    public byte[] decode(byte[] data, CosDictionary parms) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length);
        int[] group = new int[5];
        int count = 0;
        int start = 0;
        if (data.length >= 2 && data[0] == '<' && data[1] == '~') {
            start = 2;
        }
        for (int i = start; i < data.length; i++) {
            int c = data[i] & 0xFF;
            if (c == '~') {
                break;
            }
            if (Character.isWhitespace(c) || c == 0) {
                continue;
            }
            if (c == 'z' && count == 0) {
                out.write(0);
                out.write(0);
                out.write(0);
                out.write(0);
                continue;
            }
            if (c < '!' || c > 'u') {
                throw new IOException(
                        "ASCII85Decode: invalid character 0x" + Integer.toHexString(c));
            }
            group[count++] = c - '!';
            if (count == 5) {
                writeGroup(out, group, 4);
                count = 0;
            }
        }
        if (count == 1) {
            throw new IOException("ASCII85Decode: dangling final character");
        }
        if (count > 1) {
            for (int i = count; i < 5; i++) {
                group[i] = 84;
            }
            writeGroup(out, group, count - 1);
        }
        return out.toByteArray();
    }

    private static void writeGroup(ByteArrayOutputStream out, int[] group, int bytes) {
        long value = 0;
        for (int digit : group) {
            value = value * 85 + digit;
        }
        for (int i = 0; i < bytes; i++) {
            out.write((int) (value >>> (24 - 8 * i)) & 0xFF);
        }
    }
}
