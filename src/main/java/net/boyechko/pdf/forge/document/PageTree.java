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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flattens a document's page tree into its page list. Inheritable attributes are copied onto each
 * page so that pages can be moved between documents independently of their ancestors.
 */
public final class PageTree {
    private static final Logger logger = LoggerFactory.getLogger(PageTree.class);

    static final List<String> INHERITABLE = List.of("Resources", "MediaBox", "CropBox", "Rotate");

    private PageTree() {}

    /**
     * Replaces the document's page list with the leaves of its page tree, in document order.
     * Cycles, non-dictionary kids and kids that do not resolve are skipped with a warning.
     */
    public static void load(Document document) {
        CosDictionary catalog = document.catalog();
        CosObject root = catalog.get("Pages");
        List<Page> pages = new ArrayList<>();
        if (root instanceof CosReference rootRef) {
            walk(document, rootRef, new CosDictionary(), new HashSet<>(), pages);
        } else {
            logger.warn("Catalog /Pages is not an indirect reference; no pages loaded");
        }
        document.setPages(pages);
        logger.debug("Loaded {} pages", pages.size());
    }

    private static void walk(
            Document document,
            CosReference nodeRef,
            CosDictionary inherited,
            Set<Integer> visited,
            List<Page> pages) {
        if (!visited.add(nodeRef.objectNumber())) {
            logger.warn("Page tree cycle at {}; skipping", nodeRef);
            return;
        }
        CosDictionary node;
        try {
            node = document.resolveDictionary(nodeRef);
        } catch (RuntimeException e) {
            logger.warn("Page tree node {} does not resolve: {}", nodeRef, e.getMessage());
            return;
        }
        if (node == null) {
            logger.warn("Page tree node {} is not a dictionary; skipping", nodeRef);
            return;
        }
        CosArray kids = document.resolveArray(node.get("Kids"));
        boolean isLeaf = node.isType("Page") || (kids == null && !node.isType("Pages"));
        if (isLeaf) {
            for (String key : INHERITABLE) {
                if (!node.containsKey(key) && inherited.containsKey(key)) {
                    node.put(key, inherited.get(key));
                }
            }
            pages.add(new Page(document, nodeRef, node));
            return;
        }
        CosDictionary childInherited = inherited.shallowCopy();
        for (String key : INHERITABLE) {
            if (node.containsKey(key)) {
                childInherited.put(key, node.get(key));
            }
        }
        if (kids == null) {
            return;
        }
        for (CosObject kid : kids) {
            if (kid instanceof CosReference kidRef) {
                walk(document, kidRef, childInherited, visited, pages);
            } else {
                logger.warn("Direct object in page tree /Kids of {}; skipping", nodeRef);
            }
        }
    }
}
