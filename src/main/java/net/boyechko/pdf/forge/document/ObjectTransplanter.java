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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosNull;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosReference;
import net.boyechko.pdf.forge.cos.CosStream;

/**
 * Deep-copies object subgraphs from one document into another under fresh object numbers.
 *
 * <p>Copying runs in two passes. The first walks everything reachable from the root and assigns
 * each source object a new number in the target; the second copies the objects and rewrites every
 * reference through that mapping. The {@code /Parent} entry of page tree nodes is not followed, so
 * copying one page does not drag its siblings along.
 *
 * <p>One transplanter keeps its mapping across calls: objects shared by several transplanted
 * pages (fonts, images) are copied once.
 */
public final class ObjectTransplanter {
    private static final Set<String> PAGE_TREE_TYPES = Set.of("Page", "Pages");

    private final Document source;
    private final Document target;
    private final Map<Integer, Integer> numberMap = new HashMap<>();

    public ObjectTransplanter(Document source, Document target) {
        if (source == target) {
            throw new IllegalArgumentException("Source and target must differ");
        }
        this.source = source;
        this.target = target;
    }

    /** Copies {@code page} and its dependencies. The returned page is not yet in the page list. */
    public Page transplant(Page page) {
        CosReference copied = (CosReference) transplant(page.reference());
        return target.pageAt(copied);
    }

    /**
     * Copies {@code root} and everything it reaches.
     *
     * @return the copy of {@code root}, valid in the target document
     * @throws PdfForgeException BROKEN_REFERENCE if the subgraph holds a dangling reference
     */
    public CosObject transplant(CosObject root) {
        List<Integer> newlyMapped = assignNumbers(root);
        for (int oldNumber : newlyMapped) {
            target.set(numberMap.get(oldNumber), rewrite(source.get(oldNumber)));
        }
        return rewrite(root);
    }

    /** Number of source objects copied so far. */
    public int copiedCount() {
        return numberMap.size();
    }

    private List<Integer> assignNumbers(CosObject root) {
        List<Integer> newlyMapped = new ArrayList<>();
        Deque<CosObject> work = new ArrayDeque<>();
        work.push(root);
        while (!work.isEmpty()) {
            CosObject current = work.pop();
            if (current instanceof CosReference ref) {
                int number = ref.objectNumber();
                if (numberMap.containsKey(number) || source.isFree(number)) {
                    continue;
                }
                CosObject object = source.get(number);
                if (object == null) {
                    throw new PdfForgeException(
                            ErrorKind.BROKEN_REFERENCE,
                            "Reference " + ref + " does not resolve in source document");
                }
                numberMap.put(number, target.reserveNumber());
                newlyMapped.add(number);
                work.push(object);
            } else if (current instanceof CosArray array) {
                array.forEach(work::push);
            } else if (current instanceof CosDictionary dict) {
                pushEntries(dict, work);
            } else if (current instanceof CosStream stream) {
                pushEntries(stream.dictionary(), work);
            }
        }
        return newlyMapped;
    }

    private static void pushEntries(CosDictionary dict, Deque<CosObject> work) {
        boolean pageTreeNode = dict.type().map(PAGE_TREE_TYPES::contains).orElse(false);
        for (Map.Entry<String, CosObject> entry : dict.entrySet()) {
            if (pageTreeNode && entry.getKey().equals("Parent")) {
                continue;
            }
            work.push(entry.getValue());
        }
    }

    private CosObject rewrite(CosObject object) {
        if (object instanceof CosReference ref) {
            Integer mapped = numberMap.get(ref.objectNumber());
            return mapped == null ? CosNull.INSTANCE : CosReference.of(mapped);
        }
        if (object instanceof CosArray array) {
            CosArray copy = new CosArray();
            for (CosObject item : array) {
                copy.add(rewrite(item));
            }
            return copy;
        }
        if (object instanceof CosDictionary dict) {
            return rewriteDictionary(dict);
        }
        if (object instanceof CosStream stream) {
            return new CosStream(rewriteDictionary(stream.dictionary()), stream.encodedData());
        }
        return object;
    }

    private CosDictionary rewriteDictionary(CosDictionary dict) {
        boolean pageTreeNode = dict.type().map(PAGE_TREE_TYPES::contains).orElse(false);
        CosDictionary copy = new CosDictionary();
        for (Map.Entry<String, CosObject> entry : dict.entrySet()) {
            if (pageTreeNode && entry.getKey().equals("Parent")) {
                continue;
            }
            copy.put(entry.getKey(), rewrite(entry.getValue()));
        }
        return copy;
    }
}
