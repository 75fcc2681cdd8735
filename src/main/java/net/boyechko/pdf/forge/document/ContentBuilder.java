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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import net.boyechko.pdf.forge.cos.CosNumber;

/** Writes content stream operators. Numbers are formatted the way the serializer writes them. */
public final class ContentBuilder {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    /** {@code a b c d e f cm} */
    public ContentBuilder transform(double a, double b, double c, double d, double e, double f) {
        return numbers(a, b, c, d, e, f).op("cm");
    }

    public ContentBuilder graphicsState(String name) {
        return name(name).op("gs");
    }

    public ContentBuilder fillGray(double gray) {
        return numbers(gray).op("g");
    }

    public ContentBuilder drawXObject(String name) {
        return name(name).op("Do");
    }

    public ContentBuilder beginText() {
        return op("BT");
    }

    public ContentBuilder endText() {
        return op("ET");
    }

    public ContentBuilder font(String name, double size) {
        return name(name).numbers(size).op("Tf");
    }

    /** Text rendering mode; 3 draws nothing but keeps the text extractable. */
    public ContentBuilder renderingMode(int mode) {
        return numbers(mode).op("Tr");
    }

    /** Horizontal scaling in percent. */
    public ContentBuilder horizontalScaling(double percent) {
        return numbers(percent).op("Tz");
    }

    public ContentBuilder textMatrix(double a, double b, double c, double d, double e, double f) {
        return numbers(a, b, c, d, e, f).op("Tm");
    }

    public ContentBuilder moveText(double tx, double ty) {
        return numbers(tx, ty).op("Td");
    }

    /** Shows already-encoded string bytes. */
    public ContentBuilder showText(byte[] encoded) {
        out.write('(');
        for (byte b : encoded) {
            if (b == '(' || b == ')' || b == '\\') {
                out.write('\\');
                out.write(b);
            } else if (b == '\r') {
                ascii("\\r");
            } else if (b == '\n') {
                ascii("\\n");
            } else {
                out.write(b);
            }
        }
        out.write(')');
        return op("Tj");
    }

    public byte[] toBytes() {
        return out.toByteArray();
    }

    private ContentBuilder numbers(double... values) {
        for (double value : values) {
            ascii(CosNumber.of(value).toPdf());
            out.write(' ');
        }
        return this;
    }

    private ContentBuilder name(String name) {
        ascii("/" + name + " ");
        return this;
    }

    private ContentBuilder op(String operator) {
        ascii(operator);
        out.write('\n');
        return this;
    }

    private void ascii(String text) {
        out.writeBytes(text.getBytes(StandardCharsets.US_ASCII));
    }
}
