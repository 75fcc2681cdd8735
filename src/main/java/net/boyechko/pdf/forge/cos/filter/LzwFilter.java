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
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.forge.cos.CosDictionary;

public class LzwFilter implements StreamFilter {
    private static final int CLEAR_TABLE = 256;
    private static final int EOD = 257;
    private static final int INITIAL_CODE_LENGTH = 9;
    private static final int MAX_CODE_LENGTH = 12;

    @Override
    public String name() {
        return "LZWDecode";
    }

    @Override
    public byte[] decode(byte[] data, CosDictionary parms) throws IOException {
        boolean earlyChange = parms.getInt("EarlyChange", 1) != 0;
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * 3);
        List<byte[]> table = initialTable();
        int codeLength = INITIAL_CODE_LENGTH;
        byte[] previous = null;
        int bitBuffer = 0;
        int bitsInBuffer = 0;
        int pos = 0;

        while (true) {
            while (bitsInBuffer < codeLength && pos < data.length) {
                bitBuffer = (bitBuffer << 8) | (data[pos++] & 0xFF);
                bitsInBuffer += 8;
            }
            if (bitsInBuffer < codeLength) {
                break;
            }
            int code = (bitBuffer >> (bitsInBuffer - codeLength)) & ((1 << codeLength) - 1);
            bitsInBuffer -= codeLength;

            if (code == EOD) {
                break;
            }
            if (code == CLEAR_TABLE) {
                table = initialTable();
                codeLength = INITIAL_CODE_LENGTH;
                previous = null;
                continue;
            }

            byte[] sequence;
            if (code < table.size()) {
                sequence = table.get(code);
            } else if (code == table.size() && previous != null) {
                sequence = append(previous, previous[0]);
            } else {
                throw new IOException("LZWDecode: invalid code " + code);
            }
            out.write(sequence);

            if (previous != null && table.size() < 4096) {
                table.add(append(previous, sequence[0]));
                int threshold = earlyChange ? table.size() + 1 : table.size();
                if (threshold >= (1 << codeLength) && codeLength < MAX_CODE_LENGTH) {
                    codeLength++;
                }
            }
            previous = sequence;
        }
        return Predictor.fromParms(parms).undo(out.toByteArray());
    }

    private static List<byte[]> initialTable() {
        List<byte[]> table = new ArrayList<>(4096);
        for (int i = 0; i < 256; i++) {
            table.add(new byte[] {(byte) i});
        }
        table.add(null);
        table.add(null);
        return table;
    }

    private static byte[] append(byte[] prefix, byte last) {
        byte[] result = new byte[prefix.length + 1];
        System.arraycopy(prefix, 0, result, 0, prefix.length);
        result[prefix.length] = last;
        return result;
    }
}
