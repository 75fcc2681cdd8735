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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosStream;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.Page;

/** Finds the image XObjects used by pages, including those inside form XObjects. */
final class ImageResources {

    /**
     * An image found on a page.
     *
     * @param pageIndex 0-based index of the first page using the image
     * @param name resource name under which it was found
     */
    record ImageRef(int pageIndex, String name, CosStream stream) {}

    private ImageResources() {}

    /** Every distinct image stream, in page order, listed once at its first use. */
    static List<ImageRef> collect(Document document) {
        List<ImageRef> images = new ArrayList<>();
        Set<CosStream> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Page> pages = document.pages();
        for (int i = 0; i < pages.size(); i++) {
            walk(document, i, pages.get(i).resources(), seen, images);
        }
        return images;
    }

    private static void walk(
            Document document,
            int pageIndex,
            CosDictionary resources,
            Set<CosStream> seen,
            List<ImageRef> images) {
        CosDictionary xobjects = document.resolveDictionary(resources.get("XObject"));
        if (xobjects == null) {
            return;
        }
        for (Map.Entry<String, CosObject> entry : xobjects.entrySet()) {
            CosStream stream = document.resolveStream(entry.getValue());
            if (stream == null || !seen.add(stream)) {
                continue;
            }
            CosDictionary dict = stream.dictionary();
            String subtype = dict.getName("Subtype").orElse("");
            if (subtype.equals("Image")) {
                images.add(new ImageRef(pageIndex, entry.getKey(), stream));
            } else if (subtype.equals("Form")) {
                CosDictionary formResources = document.resolveDictionary(dict.get("Resources"));
                if (formResources != null) {
                    walk(document, pageIndex, formResources, seen, images);
                }
            }
        }
    }
}
