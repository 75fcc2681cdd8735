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

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the cross-reference chain of a file: classic {@code xref} tables and cross-reference
 * streams, following {@code /Prev} and hybrid {@code /XRefStm} links. Any structural problem is
 * reported as MALFORMED_DOCUMENT so the caller can fall back to a full scan.
 */
final class XrefReader {
    private static final Logger logger = LoggerFactory.getLogger(XrefReader.class);

    private static final int STARTXREF_SEARCH_WINDOW = 1024;
    private static final byte[] STARTXREF = CosParser.bytes("startxref");
    private static final List<String> TRAILER_KEYS =
            List.of("Size", "Root", "Info", "ID", "Encrypt", "Prev", "XRefStm");

    private final byte[] data;

    XrefReader(byte[] data) {
        this.data = data;
    }

    XrefTable read() {
        XrefTable table = new XrefTable();
        Set<Integer> visited = new HashSet<>();
        Integer offset = findStartxref();
        while (offset != null) {
            if (!visited.add(offset)) {
                logger.warn("Cross-reference /Prev loop at offset {}", offset);
                break;
            }
            CosDictionary sectionTrailer = readSection(offset, table);
            int xrefStm = sectionTrailer.getInt("XRefStm", -1);
            if (xrefStm > 0 && visited.add(xrefStm)) {
                readSection(xrefStm, table);
            }
            table.mergeTrailer(sectionTrailer);
            int prev = sectionTrailer.getInt("Prev", -1);
            offset = prev >= 0 ? prev : null;
        }
        if (table.trailer().get("Root") == null) {
            throw PdfForgeException.malformed("Trailer has no /Root");
        }
        logger.debug("Read {} cross-reference entries", table.size());
        return table;
    }

    /** True if an in-use entry's offset points at the matching {@code N G obj} header. */
    boolean pointsAtObject(int offset, int number) {
        if (offset <= 0 || offset >= data.length) {
            return false;
        }
        try {
            CosParser parser = new CosParser(data, offset);
            parser.skipWhitespace();
            if (parser.readUnsignedInteger() != number) {
                return false;
            }
            parser.skipWhitespace();
            parser.readUnsignedInteger();
            parser.skipWhitespace();
            return parser.lookingAt("obj");
        } catch (PdfForgeException e) {
            return false;
        }
    }

    private int findStartxref() {
        int from = Math.max(0, data.length - STARTXREF_SEARCH_WINDOW);
        for (int i = data.length - STARTXREF.length; i >= from; i--) {
            if (matches(STARTXREF, i)) {
                CosParser parser = new CosParser(data, i + STARTXREF.length);
                parser.skipWhitespace();
                long offset = parser.readUnsignedInteger();
                if (offset >= data.length) {
                    throw PdfForgeException.malformed("startxref points past end of file");
                }
                return (int) offset;
            }
        }
        throw PdfForgeException.malformed("No startxref found");
    }

    private CosDictionary readSection(int offset, XrefTable table) {
        if (offset < 0 || offset >= data.length) {
            throw PdfForgeException.malformed("Cross-reference offset out of range: " + offset);
        }
        CosParser parser = new CosParser(data, offset);
        parser.skipWhitespace();
        if (parser.skipKeyword("xref")) {
            return readClassicSection(parser, table);
        }
        return readXrefStream(parser, table);
    }

    private CosDictionary readClassicSection(CosParser parser, XrefTable table) {
        while (true) {
            parser.skipWhitespace();
            if (parser.atEnd()) {
                throw PdfForgeException.malformed("Cross-reference table has no trailer");
            }
            if (parser.skipKeyword("trailer")) {
                break;
            }
            int start = (int) parser.readUnsignedInteger();
            parser.skipWhitespace();
            int count = (int) parser.readUnsignedInteger();
            for (int i = 0; i < count; i++) {
                parser.skipWhitespace();
                int entryOffset = (int) parser.readUnsignedInteger();
                parser.skipWhitespace();
                int generation = (int) parser.readUnsignedInteger();
                String kind = parser.readKeyword();
                int number = start + i;
                if (kind.equals("n")) {
                    if (entryOffset > 0) {
                        table.putIfAbsent(number, new XrefTable.InUse(entryOffset, generation));
                    }
                } else if (kind.equals("f")) {
                    table.putIfAbsent(number, new XrefTable.Free(generation));
                } else {
                    throw PdfForgeException.malformed("Bad cross-reference entry type: " + kind);
                }
            }
        }
        CosObject trailer = parser.parseObject();
        if (!(trailer instanceof CosDictionary dict)) {
            throw PdfForgeException.malformed("Trailer is not a dictionary");
        }
        return dict;
    }

    private CosDictionary readXrefStream(CosParser parser, XrefTable table) {
        CosObject object = parser.parseIndirectObject(null).object();
        if (!(object instanceof CosStream stream) || !stream.dictionary().isType("XRef")) {
            throw PdfForgeException.malformed("startxref does not point at a cross-reference");
        }
        CosDictionary dict = stream.dictionary();
        CosArray widths = dict.get("W") instanceof CosArray array ? array : null;
        if (widths == null || widths.size() < 3) {
            throw PdfForgeException.malformed("Cross-reference stream has no valid /W");
        }
        int[] w = {
            (int) widths.getNumber(0, 1), (int) widths.getNumber(1, 0), (int) widths.getNumber(2, 0)
        };
        int size = dict.getInt("Size", 0);
        CosArray index =
                dict.get("Index") instanceof CosArray array ? array : CosArray.ofNumbers(0, size);
        byte[] rows = stream.decodedData();
        int rowLength = w[0] + w[1] + w[2];
        if (rowLength == 0) {
            throw PdfForgeException.malformed("Cross-reference stream has zero-width rows");
        }
        int pos = 0;
        for (int s = 0; s + 1 < index.size(); s += 2) {
            int first = (int) index.getNumber(s, 0);
            int count = (int) index.getNumber(s + 1, 0);
            for (int i = 0; i < count && pos + rowLength <= rows.length; i++) {
                int type = w[0] == 0 ? 1 : (int) readField(rows, pos, w[0]);
                long f2 = readField(rows, pos + w[0], w[1]);
                long f3 = readField(rows, pos + w[0] + w[1], w[2]);
                pos += rowLength;
                int number = first + i;
                switch (type) {
                    case 0 -> table.putIfAbsent(number, new XrefTable.Free((int) f3));
                    case 1 -> table.putIfAbsent(number, new XrefTable.InUse((int) f2, (int) f3));
                    case 2 ->
                            table.putIfAbsent(
                                    number, new XrefTable.Compressed((int) f2, (int) f3));
                    default -> logger.debug("Ignoring cross-reference entry of type {}", type);
                }
            }
        }
        CosDictionary trailer = new CosDictionary();
        for (String key : TRAILER_KEYS) {
            trailer.put(key, dict.get(key));
        }
        return trailer;
    }

    private static long readField(byte[] rows, int offset, int width) {
        long value = 0;
        for (int i = 0; i < width; i++) {
            value = (value << 8) | (rows[offset + i] & 0xFF);
        }
        return value;
    }

    private boolean matches(byte[] needle, int offset) {
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
}
