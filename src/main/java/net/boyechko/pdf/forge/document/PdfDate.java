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

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Formats and parses PDF date strings such as {@code D:20250314093000+01'00'}. */
public final class PdfDate {
    private static final Pattern DATE =
            Pattern.compile(
                    "(?:D:)?(\\d{4})(\\d{2})?(\\d{2})?(\\d{2})?(\\d{2})?(\\d{2})?"
                            + "(?:([Zz+\\-])(?:(\\d{2})'?(\\d{2})?'?)?)?");

    private PdfDate() {}

    public static String format(ZonedDateTime time) {
        ZoneOffset offset = time.getOffset();
        String base =
                String.format(
                        "D:%04d%02d%02d%02d%02d%02d",
                        time.getYear(),
                        time.getMonthValue(),
                        time.getDayOfMonth(),
                        time.getHour(),
                        time.getMinute(),
                        time.getSecond());
        int totalMinutes = offset.getTotalSeconds() / 60;
        if (totalMinutes == 0) {
            return base + "Z";
        }
        char sign = totalMinutes < 0 ? '-' : '+';
        int abs = Math.abs(totalMinutes);
        return base + String.format("%c%02d'%02d'", sign, abs / 60, abs % 60);
    }

    public static Optional<ZonedDateTime> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = DATE.matcher(text.trim());
        if (!m.lookingAt()) {
            return Optional.empty();
        }
        try {
            LocalDateTime local =
                    LocalDateTime.of(
                            Integer.parseInt(m.group(1)),
                            group(m, 2, 1),
                            group(m, 3, 1),
                            group(m, 4, 0),
                            group(m, 5, 0),
                            group(m, 6, 0));
            ZoneOffset offset = ZoneOffset.UTC;
            String sign = m.group(7);
            if (sign != null && (sign.equals("+") || sign.equals("-"))) {
                int hours = group(m, 8, 0);
                int minutes = group(m, 9, 0);
                int seconds = (hours * 3600 + minutes * 60) * (sign.equals("-") ? -1 : 1);
                offset = ZoneOffset.ofTotalSeconds(seconds);
            }
            return Optional.of(ZonedDateTime.of(local, offset));
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }

    private static int group(Matcher m, int index, int fallback) {
        String value = m.group(index);
        return value == null ? fallback : Integer.parseInt(value);
    }
}
