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
package net.boyechko.pdf.forge.document;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import net.boyechko.pdf.forge.codec.PdfDecoder;
import net.boyechko.pdf.forge.codec.PdfEncoder;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ObjectTransplanterTest {
    private Document source;
    private CosReference font;

    /** Two pages drawing text with one shared font object. */
    @BeforeEach
    void buildSource() {
        source = Document.blank();
        CosDictionary helvetica = CosDictionary.ofType("Font");
        helvetica.putName("Subtype", "Type1");
        helvetica.putName("BaseFont", "Helvetica");
        font = source.add(helvetica);
        for (String text : List.of("left", "right")) {
            Page page = source.createPage(PageBox.A4);
            String name = page.addResource("Font", "F", font);
            String content = "BT /" + name + " 12 Tf 72 720 Td (" + text + ") Tj ET";
            page.appendContent(content.getBytes(StandardCharsets.US_ASCII));
            source.addPage(page);
        }
        source.syncPageTree();
    }

    private static CosReference fontOf(Page page) {
        CosDictionary fonts = page.document().resolveDictionary(page.resources().get("Font"));
        return (CosReference) fonts.get("F1");
    }

    @Test
    void sharedResourcesAreCopiedOnce() {
        Document target = Document.blank();
        ObjectTransplanter transplanter = new ObjectTransplanter(source, target);

        Page first = transplanter.transplant(source.page(0));
        Page second = transplanter.transplant(source.page(1));

        assertEquals(fontOf(first), fontOf(second));
        // page, content stream, font; then page and content stream
        assertEquals(5, transplanter.copiedCount());
        assertEquals(
                "Helvetica",
                target.resolveDictionary(fontOf(first)).getName("BaseFont").orElseThrow());
    }

    @Test
    void parentIsNotFollowed() {
        Document target = Document.blank();
        int before = target.objectCount();

        Page copy = new ObjectTransplanter(source, target).transplant(source.page(1));

        assertEquals(before + 3, target.objectCount());
        assertNull(copy.dictionary().get("Parent"));
        target.addPage(copy);
        Document reread = PdfDecoder.decode(PdfEncoder.encode(target));
        assertEquals(1, reread.pageCount());
        assertTrue(new String(reread.page(0).contentBytes(), StandardCharsets.US_ASCII)
                .contains("(right)"));
    }

    @Test
    void copyIsIndependentOfSource() {
        Document target = Document.blank();
        Page copy = new ObjectTransplanter(source, target).transplant(source.page(0));

        copy.setRotation(90);

        assertEquals(0, source.page(0).rotation());
        assertEquals(90, copy.rotation());
    }

    @Test
    void danglingReferenceIsReported() {
        source.page(0).dictionary().put("Thumb", CosReference.of(999));
        Document target = Document.blank();

        PdfForgeException e =
                assertThrows(
                        PdfForgeException.class,
                        () -> new ObjectTransplanter(source, target).transplant(source.page(0)));
        assertEquals(ErrorKind.BROKEN_REFERENCE, e.kind());
    }

    @Test
    void sourceAndTargetMustDiffer() {
        assertThrows(IllegalArgumentException.class, () -> new ObjectTransplanter(source, source));
    }
}
