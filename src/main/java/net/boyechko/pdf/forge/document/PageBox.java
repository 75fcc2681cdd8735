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

import net.boyechko.pdf.forge.cos.CosArray;

/** A page rectangle in default user space units (1/72 inch). */
public record PageBox(double llx, double lly, double urx, double ury) {
    public static final PageBox A4 = new PageBox(0, 0, 595, 842);
    public static final PageBox LETTER = new PageBox(0, 0, 612, 792);

    /** Normalizes corners so that {@code llx <= urx} and {@code lly <= ury}. */
    public static PageBox fromArray(CosArray array) {
        double x1 = array.getNumber(0, 0);
        double y1 = array.getNumber(1, 0);
        double x2 = array.getNumber(2, LETTER.urx);
        double y2 = array.getNumber(3, LETTER.ury);
        return new PageBox(Math.min(x1, x2), Math.min(y1, y2), Math.max(x1, x2), Math.max(y1, y2));
    }

    public double width() {
        return urx - llx;
    }

    public double height() {
        return ury - lly;
    }

    public CosArray toArray() {
        return CosArray.ofNumbers(llx, lly, urx, ury);
    }

    /** Width and height as seen by a viewer once the page rotation is applied. */
    public double displayWidth(int rotation) {
        return rotation % 180 == 0 ? width() : height();
    }

    public double displayHeight(int rotation) {
        return rotation % 180 == 0 ? height() : width();
    }

    @Override
    public String toString() {
        return String.format("[%.1f %.1f %.1f %.1f]", llx, lly, urx, ury);
    }
}
