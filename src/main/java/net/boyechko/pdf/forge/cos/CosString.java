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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A PDF string: an arbitrary byte sequence. Text strings are either PDFDocEncoding (treated as
 * Latin-1) or UTF-16BE with a byte order mark.
 */
public record CosString(byte[] bytes, boolean hex) implements CosObject {
    public CosString {
        bytes = bytes.clone();
    }

    public static CosString of(byte[] bytes) {
        return new CosString(bytes, false);
    }

    public static CosString hex(byte[] bytes) {
        return new CosString(bytes, true);
    }

    /** Encodes text as Latin-1 when possible, otherwise as UTF-16BE with a byte order mark. */
    public static CosString ofText(String text) {
        boolean latin1 = text.chars().allMatch(c -> c < 0x80 || (c >= 0xA0 && c <= 0xFF));
        if (latin1) {
            return new CosString(text.getBytes(StandardCharsets.ISO_8859_1), false);
        }
        byte[] utf16 = text.getBytes(StandardCharsets.UTF_16BE);
        byte[] withBom = new byte[utf16.length + 2];
        withBom[0] = (byte) 0xFE;
        withBom[1] = (byte) 0xFF;
        System.arraycopy(utf16, 0, withBom, 2, utf16.length);
        return new CosString(withBom, false);
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    /** Decodes the string as a PDF text string. */
    public String text() {
        if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFE && (bytes[1] & 0xFF) == 0xFF) {
            return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16BE);
        }
        if (bytes.length >= 3
                && (bytes[0] & 0xFF) == 0xEF
                && (bytes[1] & 0xFF) == 0xBB
                && (bytes[2] & 0xFF) == 0xBF) {
            return new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8);
        }
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CosString other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return hex ? "<" + text() + ">" : "(" + text() + ")";
    }
}
