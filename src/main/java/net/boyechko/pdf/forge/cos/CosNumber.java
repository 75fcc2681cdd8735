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

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A PDF integer or real number.
 *
 * @param value the numeric value
 * @param integer whether the value was written (or should be written) without a fraction
 */
public record CosNumber(double value, boolean integer) implements CosObject {
    private static final int REAL_PRECISION = 5;

    public static CosNumber of(long value) {
        return new CosNumber(value, true);
    }

    public static CosNumber of(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return new CosNumber(value, true);
        }
        return new CosNumber(value, false);
    }

    public int intValue() {
        return (int) Math.round(value);
    }

    /** Formats the number in PDF syntax: no exponent, at most five fractional digits. */
    public String toPdf() {
        if (integer) {
            return Long.toString(Math.round(value));
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "0";
        }
        BigDecimal decimal =
                BigDecimal.valueOf(value).setScale(REAL_PRECISION, RoundingMode.HALF_UP);
        String text = decimal.stripTrailingZeros().toPlainString();
        return text.equals("-0") ? "0" : text;
    }

    @Override
    public String toString() {
        return toPdf();
    }
}
