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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.function.IntFunction;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.cos.CosBoolean;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosName;
import net.boyechko.pdf.forge.cos.CosNull;
import net.boyechko.pdf.forge.cos.CosNumber;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosReference;
import net.boyechko.pdf.forge.cos.CosStream;
import net.boyechko.pdf.forge.cos.CosString;

/**
 * Recursive-descent parser for PDF object syntax over an in-memory byte array. Syntax errors are
 * reported as {@link PdfForgeException} with kind MALFORMED_DOCUMENT.
 */
final class CosParser {
    private static final byte[] ENDSTREAM = bytes("endstream");
    private static final byte[] ENDOBJ = bytes("endobj");
    private static final int MAX_NESTING = 512;

    private final byte[] data;
    private int pos;
    private int depth;

    /** An indirect object as read from the file. */
    record IndirectObject(int number, int generation, CosObject object, int endOffset) {}

    CosParser(byte[] data, int pos) {
        this.data = data;
        this.pos = pos;
    }

    int position() {
        return pos;
    }

    boolean atEnd() {
        return pos >= data.length;
    }

    // ── Indirect objects ────────────────────────────────────────────

    /**
     * Parses {@code N G obj ... endobj} at the current position.
     *
     * @param lengthLookup resolves an indirect {@code /Length} by object number; may return null
     */
    IndirectObject parseIndirectObject(IntFunction<Integer> lengthLookup) {
        skipWhitespace();
        int number = (int) readUnsignedInteger();
        skipWhitespace();
        int generation = (int) readUnsignedInteger();
        skipWhitespace();
        if (!skipKeyword("obj")) {
            throw syntax("Expected 'obj' after " + number + " " + generation);
        }
        CosObject object = parseObject();
        skipWhitespace();
        if (object instanceof CosDictionary dict && lookingAt("stream")) {
            object = parseStreamBody(dict, lengthLookup);
            skipWhitespace();
        }
        if (!skipKeyword("endobj")) {
            // Tolerate a missing endobj; the next object or xref keyword ends this one.
            int end = indexOf(ENDOBJ, pos, Math.min(data.length, pos + 64));
            if (end >= 0) {
                pos = end + ENDOBJ.length;
            }
        }
        return new IndirectObject(number, generation, object, pos);
    }

    private CosStream parseStreamBody(CosDictionary dict, IntFunction<Integer> lengthLookup) {
        pos += "stream".length();
        if (pos < data.length && data[pos] == '\r') {
            pos++;
        }
        if (pos < data.length && data[pos] == '\n') {
            pos++;
        }
        int start = pos;
        Integer declared = null;
        CosObject length = dict.get("Length");
        if (length instanceof CosNumber n) {
            declared = n.intValue();
        } else if (length instanceof CosReference ref && lengthLookup != null) {
            declared = lengthLookup.apply(ref.objectNumber());
        }
        int end;
        if (declared != null && declared >= 0 && endstreamFollows(start + declared)) {
            end = start + declared;
        } else {
            int marker = indexOf(ENDSTREAM, start, data.length);
            if (marker < 0) {
                throw syntax("Unterminated stream starting at " + start);
            }
            end = marker;
            if (end > start && data[end - 1] == '\n') {
                end--;
            }
            if (end > start && data[end - 1] == '\r') {
                end--;
            }
        }
        byte[] payload = Arrays.copyOfRange(data, start, end);
        pos = end;
        skipWhitespace();
        skipKeyword("endstream");
        return new CosStream(dict, payload);
    }

    private boolean endstreamFollows(int offset) {
        if (offset > data.length) {
            return false;
        }
        int p = offset;
        while (p < data.length && isWhitespace(data[p])) {
            p++;
        }
        return startsWith(ENDSTREAM, p);
    }

    // ── Direct objects ──────────────────────────────────────────────

    CosObject parseObject() {
        skipWhitespace();
        if (atEnd()) {
            throw syntax("Unexpected end of data");
        }
        int c = data[pos] & 0xFF;
        switch (c) {
            case '/':
                return parseName();
            case '(':
                return parseLiteralString();
            case '[':
                return parseArray();
            case '<':
                if (pos + 1 < data.length && data[pos + 1] == '<') {
                    return parseDictionary();
                }
                return parseHexString();
            case 't':
                expectKeyword("true");
                return CosBoolean.TRUE;
            case 'f':
                expectKeyword("false");
                return CosBoolean.FALSE;
            case 'n':
                expectKeyword("null");
                return CosNull.INSTANCE;
            default:
                if (isNumberStart(c)) {
                    return parseNumberOrReference();
                }
                throw syntax("Unexpected character '" + (char) c + "'");
        }
    }

    private CosName parseName() {
        pos++;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        while (pos < data.length && isRegular(data[pos])) {
            int c = data[pos] & 0xFF;
            if (c == '#' && pos + 2 < data.length) {
                int hi = Character.digit(data[pos + 1], 16);
                int lo = Character.digit(data[pos + 2], 16);
                if (hi >= 0 && lo >= 0) {
                    out.write((hi << 4) | lo);
                    pos += 3;
                    continue;
                }
            }
            out.write(c);
            pos++;
        }
        return CosName.of(out.toString(StandardCharsets.ISO_8859_1));
    }

    private CosString parseLiteralString() {
        pos++;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int nesting = 1;
        while (pos < data.length) {
            int c = data[pos++] & 0xFF;
            if (c == '(') {
                nesting++;
                out.write(c);
            } else if (c == ')') {
                if (--nesting == 0) {
                    return CosString.of(out.toByteArray());
                }
                out.write(c);
            } else if (c == '\\') {
                readEscape(out);
            } else if (c == '\r') {
                if (pos < data.length && data[pos] == '\n') {
                    pos++;
                }
                out.write('\n');
            } else {
                out.write(c);
            }
        }
        throw syntax("Unterminated literal string");
    }

    private void readEscape(ByteArrayOutputStream out) {
        if (pos >= data.length) {
            return;
        }
        int c = data[pos++] & 0xFF;
        switch (c) {
            case 'n' -> out.write('\n');
            case 'r' -> out.write('\r');
            case 't' -> out.write('\t');
            case 'b' -> out.write('\b');
            case 'f' -> out.write('\f');
            case '\r' -> {
                if (pos < data.length && data[pos] == '\n') {
                    pos++;
                }
            }
            case '\n' -> {
                // line continuation
            }
            default -> {
                if (c >= '0' && c <= '7') {
                    int value = c - '0';
                    for (int i = 0; i < 2 && pos < data.length; i++) {
                        int d = data[pos];
                        if (d < '0' || d > '7') {
                            break;
                        }
                        value = value * 8 + (d - '0');
                        pos++;
                    }
                    out.write(value & 0xFF);
                } else {
                    out.write(c);
                }
            }
        }
    }

    private CosString parseHexString() {
        pos++;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int high = -1;
        while (pos < data.length) {
            int c = data[pos++] & 0xFF;
            if (c == '>') {
                if (high >= 0) {
                    out.write(high << 4);
                }
                return CosString.hex(out.toByteArray());
            }
            int digit = Character.digit(c, 16);
            if (digit < 0) {
                if (isWhitespace((byte) c)) {
                    continue;
                }
                throw syntax("Invalid hex string character '" + (char) c + "'");
            }
            if (high < 0) {
                high = digit;
            } else {
                out.write((high << 4) | digit);
                high = -1;
            }
        }
        throw syntax("Unterminated hex string");
    }

    private CosArray parseArray() {
        pos++;
        enter();
        CosArray array = new CosArray();
        while (true) {
            skipWhitespace();
            if (atEnd()) {
                throw syntax("Unterminated array");
            }
            if (data[pos] == ']') {
                pos++;
                depth--;
                return array;
            }
            array.add(parseObject());
        }
    }

    private CosDictionary parseDictionary() {
        pos += 2;
        enter();
        CosDictionary dict = new CosDictionary();
        while (true) {
            skipWhitespace();
            if (atEnd()) {
                throw syntax("Unterminated dictionary");
            }
            if (data[pos] == '>' && pos + 1 < data.length && data[pos + 1] == '>') {
                pos += 2;
                depth--;
                return dict;
            }
            if (data[pos] != '/') {
                throw syntax("Dictionary key must be a name");
            }
            String key = parseName().value();
            skipWhitespace();
            if (!atEnd() && data[pos] == '>') {
                // key without value right before the closing delimiter
                continue;
            }
            CosObject value = parseObject();
            if (value != CosNull.INSTANCE) {
                dict.put(key, value);
            }
        }
    }

    private CosObject parseNumberOrReference() {
        CosNumber first = readNumber();
        if (!first.integer() || first.value() <= 0) {
            return first;
        }
        int afterFirst = pos;
        skipWhitespace();
        if (!atEnd() && data[pos] >= '0' && data[pos] <= '9') {
            long generation = readUnsignedInteger();
            skipWhitespace();
            if (!atEnd()
                    && data[pos] == 'R'
                    && (pos + 1 >= data.length || !isRegular(data[pos + 1]))
                    && generation <= 65535) {
                pos++;
                return new CosReference(first.intValue(), (int) generation);
            }
        }
        pos = afterFirst;
        return first;
    }

    private CosNumber readNumber() {
        int start = pos;
        boolean real = false;
        if (pos < data.length && (data[pos] == '+' || data[pos] == '-')) {
            pos++;
        }
        while (pos < data.length) {
            int c = data[pos];
            if (c == '.') {
                real = true;
            } else if (c < '0' || c > '9') {
                break;
            }
            pos++;
        }
        String text = new String(data, start, pos - start, StandardCharsets.US_ASCII);
        if (text.equals("-") || text.equals("+") || text.equals(".") || text.equals("-.")) {
            return CosNumber.of(0);
        }
        try {
            return real
                    ? new CosNumber(Double.parseDouble(text), false)
                    : CosNumber.of(Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw syntax("Invalid number '" + text + "'");
        }
    }

    // ── Lexical helpers ─────────────────────────────────────────────

    long readUnsignedInteger() {
        int start = pos;
        long value = 0;
        while (pos < data.length && data[pos] >= '0' && data[pos] <= '9') {
            value = value * 10 + (data[pos] - '0');
            pos++;
        }
        if (pos == start) {
            throw syntax("Expected integer");
        }
        return value;
    }

    /** Reads a run of regular characters, as for keywords like {@code xref} or {@code trailer}. */
    String readKeyword() {
        skipWhitespace();
        int start = pos;
        while (pos < data.length && isRegular(data[pos])) {
            pos++;
        }
        return new String(data, start, pos - start, StandardCharsets.US_ASCII);
    }

    void skipWhitespace() {
        while (pos < data.length) {
            byte b = data[pos];
            if (isWhitespace(b)) {
                pos++;
            } else if (b == '%') {
                while (pos < data.length && data[pos] != '\n' && data[pos] != '\r') {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    boolean lookingAt(String keyword) {
        byte[] k = bytes(keyword);
        if (!startsWith(k, pos)) {
            return false;
        }
        int after = pos + k.length;
        return after >= data.length || !isRegular(data[after]);
    }

    boolean skipKeyword(String keyword) {
        if (lookingAt(keyword)) {
            pos += keyword.length();
            return true;
        }
        return false;
    }

    private void expectKeyword(String keyword) {
        if (!skipKeyword(keyword)) {
            throw syntax("Expected '" + keyword + "'");
        }
    }

    private void enter() {
        if (++depth > MAX_NESTING) {
            throw syntax("Objects nested too deeply");
        }
    }

    private boolean startsWith(byte[] needle, int offset) {
        if (offset < 0 || offset + needle.length > data.length) {
            return false;
        }
        for (int i = 0; i < needle.length; i++) {
            if (data[offset + i] != needle[i]) {
                return false;
            }
        }
        return true;
    }

    private int indexOf(byte[] needle, int from, int to) {
        for (int i = Math.max(0, from); i + needle.length <= to; i++) {
            if (startsWith(needle, i)) {
                return i;
            }
        }
        return -1;
    }

    private PdfForgeException syntax(String message) {
        return PdfForgeException.malformed(message + " (offset " + pos + ")");
    }

    static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\n' || b == '\r' || b == '\t' || b == '\f' || b == 0;
    }

    static boolean isDelimiter(byte b) {
        return switch (b) {
            case '(', ')', '<', '>', '[', ']', '{', '}', '/', '%' -> true;
            default -> false;
        };
    }

    static boolean isRegular(byte b) {
        return !isWhitespace(b) && !isDelimiter(b);
    }

    private static boolean isNumberStart(int c) {
        return (c >= '0' && c <= '9') || c == '+' || c == '-' || c == '.';
    }

    static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }
}
