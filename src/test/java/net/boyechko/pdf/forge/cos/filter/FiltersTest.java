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

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.Deflater;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosName;
import net.boyechko.pdf.forge.cos.CosNull;
import org.junit.jupiter.api.Test;

class FiltersTest {

    private static byte[] ascii(String text) {
        return text.getBytes(StandardCharsets.US_ASCII);
    }

    private static CosDictionary filters(String... names) {
        CosArray array = new CosArray();
        for (String name : names) {
            array.add(CosName.of(name));
        }
        CosDictionary dict = new CosDictionary();
        dict.put("Filter", array);
        return dict;
    }

    @Test
    void ascii85DecodesWithAndWithoutDelimiters() throws IOException {
        Ascii85Filter filter = new Ascii85Filter();
        CosDictionary none = new CosDictionary();

        assertEquals("Hello World", new String(filter.decode(ascii("87cURD]i,\"Ebo7~>"), none)));
        assertEquals(
                "Hello World", new String(filter.decode(ascii("<~87cURD]i,\"Ebo7~>"), none)));
        assertArrayEquals(new byte[4], filter.decode(ascii("z~>"), none));
        assertThrows(IOException.class, () -> filter.decode(ascii("87cU{~>"), none));
    }

    @Test
    void asciiHexIgnoresWhitespaceAndPadsOddDigit() throws IOException {
        AsciiHexFilter filter = new AsciiHexFilter();
        assertArrayEquals(
                new byte[] {0x48, 0x69, 0x70},
                filter.decode(ascii("48 69\n7>"), new CosDictionary()));
    }

    @Test
    void runLengthExpandsLiteralAndRepeatedRuns() {
        byte[] encoded = {2, 'a', 'b', 'c', (byte) 254, 'z', (byte) 128, 'x'};
        assertEquals(
                "abczzz", new String(new RunLengthFilter().decode(encoded, new CosDictionary())));
    }

    @Test
    void lzwDecodesReferenceExample() throws IOException {
        byte[] encoded = {
            (byte) 0x80, 0x0B, 0x60, 0x50, 0x22, 0x0C, 0x0C, (byte) 0x85, 0x01
        };
        byte[] decoded = new LzwFilter().decode(encoded, new CosDictionary());
        assertEquals("-----A---B", new String(decoded));
    }

    @Test
    void flateUndoesPngUpPredictor() throws IOException {
        // two rows of three bytes, each tagged with filter type 2 (Up)
        byte[] predicted = {2, 10, 20, 30, 2, 1, 1, 1};
        CosDictionary parms = new CosDictionary();
        parms.putNumber("Predictor", 12);
        parms.putNumber("Columns", 3);

        byte[] deflated = FlateFilter.deflate(predicted, Deflater.DEFAULT_COMPRESSION);
        byte[] decoded = new FlateFilter().decode(deflated, parms);

        assertArrayEquals(new byte[] {10, 20, 30, 11, 21, 31}, decoded);
    }

    @Test
    void chainPairsFiltersWithTheirParameters() throws IOException {
        CosDictionary stream = filters("ASCIIHexDecode", "FlateDecode");
        CosDictionary flateParms = new CosDictionary();
        flateParms.putNumber("Predictor", 12);
        flateParms.putNumber("Columns", 1);
        CosArray parms = new CosArray();
        parms.add(CosNull.INSTANCE);
        parms.add(flateParms);
        stream.put("DecodeParms", parms);

        List<Filters.FilterStep> steps = Filters.chain(stream);
        assertEquals(2, steps.size());
        assertTrue(steps.get(0).parms().isEmpty());
        assertEquals(12, steps.get(1).parms().getInt("Predictor", 0));

        byte[] flate = FlateFilter.deflate(new byte[] {0, 42}, Deflater.BEST_COMPRESSION);
        byte[] hex = new AsciiHexFilter().encode(flate);
        Filters.Decoded decoded = Filters.decode(hex, steps);
        assertTrue(decoded.fullyDecoded());
        assertArrayEquals(new byte[] {42}, decoded.data());
    }

    @Test
    void decodingStopsAtImageCodec() throws IOException {
        byte[] jpegish = {(byte) 0xFF, (byte) 0xD8, 1, 2, 3};
        byte[] flate = FlateFilter.deflate(jpegish, Deflater.DEFAULT_COMPRESSION);

        Filters.Decoded decoded =
                Filters.decode(flate, Filters.chain(filters("FlateDecode", "DCTDecode")));

        assertEquals("DCTDecode", decoded.remainingCodec());
        assertArrayEquals(jpegish, decoded.data());
    }

    @Test
    void unknownFilterIsAnError() {
        assertFalse(Filters.isSupported("Crypt2"));
        assertThrows(
                IOException.class,
                () -> Filters.decode(new byte[0], Filters.chain(filters("Crypt2"))));
    }
}
