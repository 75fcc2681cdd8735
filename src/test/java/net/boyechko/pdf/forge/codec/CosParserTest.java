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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import net.boyechko.pdf.forge.core.ErrorKind;
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
import org.junit.jupiter.api.Test;

class CosParserTest {

    private static CosObject parse(String text) {
        return new CosParser(text.getBytes(StandardCharsets.ISO_8859_1), 0).parseObject();
    }

    // ── Direct objects ──────────────────────────────────────────────

    @Test
    void parsesScalars() {
        assertEquals(CosBoolean.TRUE, parse("true"));
        assertEquals(CosNull.INSTANCE, parse("null"));
        assertEquals(42, ((CosNumber) parse("42")).intValue());
        assertEquals(-0.5, ((CosNumber) parse("-.5")).value(), 1e-9);
        assertEquals(CosName.of("Type"), parse("/Type"));
    }

    @Test
    void decodesNameHexEscapes() {
        assertEquals(CosName.of("A B"), parse("/A#20B"));
    }

    @Test
    void decodesLiteralStringEscapesAndBalancedParentheses() {
        CosString string = (CosString) parse("(a\\(b\\) (c) \\101\\n)");
        assertEquals("a(b) (c) A\n", new String(string.bytes(), StandardCharsets.ISO_8859_1));
    }

    @Test
    void decodesHexStringWithOddDigitCount() {
        CosString string = (CosString) parse("<48 65 6C 6C 6F 2>");
        assertArrayEquals(
                new byte[] {0x48, 0x65, 0x6C, 0x6C, 0x6F, 0x20}, string.bytes());
        assertTrue(string.hex());
    }

    @Test
    void distinguishesReferencesFromNumberPairs() {
        CosArray array = (CosArray) parse("[1 0 R 2 3 4 0 R]");
        assertEquals(4, array.size());
        assertEquals(CosReference.of(1), array.get(0));
        assertEquals(2, ((CosNumber) array.get(1)).intValue());
        assertEquals(3, ((CosNumber) array.get(2)).intValue());
        assertEquals(CosReference.of(4), array.get(3));
    }

    @Test
    void parsesNestedDictionaries() {
        CosDictionary dict =
                (CosDictionary) parse("<< /Type /Page /Box [0 0 10 20] /Sub << /N 5 >> >>");
        assertTrue(dict.isType("Page"));
        assertEquals(4, ((CosArray) dict.get("Box")).size());
        assertEquals(5, ((CosDictionary) dict.get("Sub")).getInt("N", 0));
    }

    @Test
    void rejectsUnexpectedCharacters() {
        PdfForgeException e = assertThrows(PdfForgeException.class, () -> parse("}"));
        assertEquals(ErrorKind.MALFORMED_DOCUMENT, e.kind());
    }

    // ── Indirect objects ────────────────────────────────────────────

    @Test
    void readsStreamByDeclaredLength() {
        String text = "7 0 obj\n<< /Length 5 >>\nstream\nhello\nendstream\nendobj\n";
        CosParser parser = new CosParser(text.getBytes(StandardCharsets.ISO_8859_1), 0);
        CosParser.IndirectObject object = parser.parseIndirectObject(n -> null);

        assertEquals(7, object.number());
        CosStream stream = (CosStream) object.object();
        assertEquals("hello", new String(stream.decodedData(), StandardCharsets.ISO_8859_1));
    }

    @Test
    void recoversStreamWithWrongLength() {
        String text = "7 0 obj\n<< /Length 99 >>\nstream\nhello\nendstream\nendobj\n";
        CosParser parser = new CosParser(text.getBytes(StandardCharsets.ISO_8859_1), 0);
        CosStream stream = (CosStream) parser.parseIndirectObject(n -> null).object();

        assertEquals("hello", new String(stream.decodedData(), StandardCharsets.ISO_8859_1));
    }
}
