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

import java.util.List;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosReference;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.ObjectTransplanter;

/** Helpers shared by the page-level operations. */
public final class DocumentSupport {
    private DocumentSupport() {}

    /** Builds a new document holding copies of the given 0-based pages of {@code source}. */
    public static Document extractPages(Document source, List<Integer> indices) {
        Document target = Document.blank();
        ObjectTransplanter transplanter = new ObjectTransplanter(source, target);
        for (int index : indices) {
            target.addPage(transplanter.transplant(source.page(index)));
        }
        copyInfo(source, target, transplanter);
        return target;
    }

    /** Copies the document information dictionary, if any, into {@code target}. */
    public static void copyInfo(Document source, Document target, ObjectTransplanter transplanter) {
        if (!source.hasInfo()) {
            return;
        }
        CosObject copy = transplanter.transplant(source.infoReference());
        if (copy instanceof CosReference ref && target.resolve(ref) instanceof CosDictionary) {
            target.setInfoReference(ref);
        }
    }
}
