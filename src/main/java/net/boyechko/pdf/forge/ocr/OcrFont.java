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
package net.boyechko.pdf.forge.ocr;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosNumber;
import net.boyechko.pdf.forge.cos.CosReference;

/**
 * A simple font for invisible text with its own single-byte code assignment. Codes 1 to 255 are
 * handed out to code points as they are first shown, and a {@code /ToUnicode} CMap maps them
 * back, so extraction works for any script. All glyphs are {@value #GLYPH_WIDTH} units wide.
 */
final class OcrFont {
    static final int GLYPH_WIDTH = 500;
    static final int CAPACITY = 255;

    private final Map<Integer, Integer> codes = new LinkedHashMap<>();

    /** True if every code point of {@code text} already has or can still get a code. */
    boolean canEncode(String text) {
        long missing = text.codePoints().distinct().filter(cp -> !codes.containsKey(cp)).count();
        return codes.size() + missing <= CAPACITY;
    }

    /** Encodes {@code text}, assigning codes as needed. Check {@link #canEncode} first. */
    byte[] encode(String text) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        text.codePoints()
                .forEach(
                        cp -> {
                            Integer code = codes.get(cp);
                            if (code == null) {
                                code = codes.size() + 1;
                                codes.put(cp, code);
                            }
                            out.write(code);
                        });
        return out.toByteArray();
    }

    /** Width of {@code glyphs} glyphs at {@code size}, in text space units. */
    static double width(int glyphs, double size) {
        return glyphs * GLYPH_WIDTH * size / 1000.0;
    }

    /** Fills {@code font} as a Type 1 Helvetica with this code assignment. */
    void describeInto(CosDictionary font, CosReference toUnicode) {
        font.putName("Type", "Font");
        font.putName("Subtype", "Type1");
        font.putName("BaseFont", "Helvetica");
        font.putNumber("FirstChar", 1);
        font.putNumber("LastChar", Math.max(1, codes.size()));
        CosArray widths = new CosArray();
        for (int i = 0; i < Math.max(1, codes.size()); i++) {
            widths.add(CosNumber.of(GLYPH_WIDTH));
        }
        font.put("Widths", widths);
        font.put("ToUnicode", toUnicode);
    }

    /** The {@code /ToUnicode} CMap for the codes assigned so far. */
    byte[] toUnicodeCMap() {
        StringBuilder cmap = new StringBuilder();
        cmap.append("/CIDInit /ProcSet findresource begin\n")
                .append("12 dict begin\n")
                .append("begincmap\n")
                .append("/CIDSystemInfo\n")
                .append("<< /Registry (Adobe) /Ordering (UCS) /Supplement 0 >> def\n")
                .append("/CMapName /Adobe-Identity-UCS def\n")
                .append("/CMapType 2 def\n")
                .append("1 begincodespacerange\n<00> <FF>\nendcodespacerange\n");
        List<Map.Entry<Integer, Integer>> entries = new ArrayList<>(codes.entrySet());
        for (int start = 0; start < entries.size(); start += 100) {
            List<Map.Entry<Integer, Integer>> block =
                    entries.subList(start, Math.min(entries.size(), start + 100));
            cmap.append(block.size()).append(" beginbfchar\n");
            for (Map.Entry<Integer, Integer> entry : block) {
                cmap.append(String.format("<%02X> <", entry.getValue()));
                for (char c : Character.toChars(entry.getKey())) {
                    cmap.append(String.format("%04X", (int) c));
                }
                cmap.append(">\n");
            }
            cmap.append("endbfchar\n");
        }
        cmap.append("endcmap\n")
                .append("CMapName currentdict /CMap defineresource pop\n")
                .append("end\nend\n");
        return cmap.toString().getBytes(StandardCharsets.US_ASCII);
    }
}
