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
package net.boyechko.pdf.forge.core;

import java.util.Locale;

/**
 * Compression quality levels. The factor is used both as the image downscale ratio and as the
 * JPEG quality.
 */
public enum Quality {
    HIGH(0.9f),
    MEDIUM(0.7f),
    LOW(0.5f),
    MINIMUM(0.3f);

    private final float factor;

    Quality(float factor) {
        this.factor = factor;
    }

    public float factor() {
        return factor;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Quality fromId(String id) {
        for (Quality q : values()) {
            if (q.id().equalsIgnoreCase(id)) {
                return q;
            }
        }
        throw PdfForgeException.invalidParameter("Unknown quality: " + id);
    }
}
