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
package net.boyechko.pdf.forge.operations;

import com.itextpdf.io.font.FontProgram;
import com.itextpdf.io.font.FontProgramFactory;
import com.itextpdf.io.font.PdfEncodings;
import com.itextpdf.io.font.constants.StandardFonts;
import com.itextpdf.io.font.otf.Glyph;
import java.io.IOException;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosDictionary;

/** A standard Type 1 font with WinAnsi encoding, measured with iText's built-in AFM metrics. */
final class StandardFont {
    static final StandardFont HELVETICA = load(StandardFonts.HELVETICA);

    private final String baseFont;
    private final FontProgram program;

    private StandardFont(String baseFont, FontProgram program) {
        this.baseFont = baseFont;
        this.program = program;
    }

    private static StandardFont load(String name) {
        try {
            return new StandardFont(name, FontProgramFactory.createFont(name));
        } catch (IOException e) {
            throw new PdfForgeException(ErrorKind.INTERNAL, "Cannot load metrics for " + name, e);
        }
    }

    /** Text encoded as WinAnsi bytes; characters outside the encoding are dropped. */
    byte[] encode(String text) {
        return PdfEncodings.convertToBytes(text, PdfEncodings.WINANSI);
    }

    /** Advance width of {@code text} at {@code size} points. */
    double width(String text, double size) {
        double units = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            Glyph glyph = program.getGlyph(codePoint);
            units += glyph != null ? glyph.getWidth() : program.getAvgWidth();
            i += Character.charCount(codePoint);
        }
        return units * size / 1000.0;
    }

    /** Cap height in text space units per point of font size. */
    double capHeight() {
        return program.getFontMetrics().getCapHeight() / 1000.0;
    }

    CosDictionary fontDictionary() {
        CosDictionary font = CosDictionary.ofType("Font");
        font.putName("Subtype", "Type1");
        font.putName("BaseFont", baseFont);
        font.putName("Encoding", "WinAnsiEncoding");
        return font;
    }
}
