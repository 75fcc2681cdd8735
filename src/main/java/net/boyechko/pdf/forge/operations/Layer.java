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

import java.util.Locale;
import net.boyechko.pdf.forge.document.Page;

/** Where added content goes relative to the existing page content. */
enum Layer {
    UNDER,
    OVER;

    static final String[] CHOICES = {"under", "over"};

    static Layer fromId(String id) {
        return valueOf(id.toUpperCase(Locale.ROOT));
    }

    /**
     * Adds {@code content} to {@code page}, bracketed with {@code q}/{@code Q}. Content drawn over
     * the page first isolates the existing streams so it starts from the default graphics state.
     * Existing streams are never rewritten.
     */
    void stamp(Page page, byte[] content) {
        byte[] wrapped = new byte[content.length + 4];
        wrapped[0] = 'q';
        wrapped[1] = '\n';
        System.arraycopy(content, 0, wrapped, 2, content.length);
        wrapped[wrapped.length - 2] = 'Q';
        wrapped[wrapped.length - 1] = '\n';
        if (this == UNDER) {
            page.prependContent(wrapped);
        } else {
            page.isolateExistingContent();
            page.appendContent(wrapped);
        }
    }
}
