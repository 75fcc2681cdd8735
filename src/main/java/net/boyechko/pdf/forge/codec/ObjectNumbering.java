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
package net.boyechko.pdf.forge.codec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosReference;
import net.boyechko.pdf.forge.cos.CosStream;
import net.boyechko.pdf.forge.document.Document;

/**
 * Assigns output object numbers 1..N in breadth-first order from the trailer roots. Objects that
 * nothing reaches are dropped. Streams held directly inside another object are given their own
 * number, since a stream can only be written as an indirect object.
 */
final class ObjectNumbering {
    private final Document document;
    private final Map<Integer, Integer> byOldNumber = new HashMap<>();
    private final Map<CosStream, Integer> hoisted = new IdentityHashMap<>();
    private final List<CosObject> ordered = new ArrayList<>();
    private final Deque<CosObject> queue = new ArrayDeque<>();

    private ObjectNumbering(Document document) {
        this.document = document;
    }

    /**
     * Numbers everything reachable from {@code roots}.
     *
     * @throws PdfForgeException BROKEN_REFERENCE if a reachable reference is neither present nor
     *     free
     */
    static ObjectNumbering of(Document document, List<CosReference> roots) {
        ObjectNumbering numbering = new ObjectNumbering(document);
        for (CosReference root : roots) {
            numbering.enqueue(root);
        }
        while (!numbering.queue.isEmpty()) {
            CosObject next = numbering.queue.poll();
            if (next instanceof CosStream stream) {
                numbering.scan(stream.dictionary());
            } else {
                numbering.scan(next);
            }
        }
        return numbering;
    }

    /** Objects in output order; the object at index i gets number i + 1. */
    List<CosObject> objects() {
        return Collections.unmodifiableList(ordered);
    }

    int size() {
        return ordered.size();
    }

    /** The output number for {@code ref}, or 0 if it points at a free entry. */
    int numberOf(CosReference ref) {
        Integer number = byOldNumber.get(ref.objectNumber());
        return number == null ? 0 : number;
    }

    int numberOf(CosStream directStream) {
        Integer number = hoisted.get(directStream);
        if (number == null) {
            throw new PdfForgeException(ErrorKind.INTERNAL, "Stream was not numbered");
        }
        return number;
    }

    private void enqueue(CosReference ref) {
        int old = ref.objectNumber();
        if (byOldNumber.containsKey(old)) {
            return;
        }
        CosObject target = document.get(old);
        if (target == null) {
            if (document.isFree(old)) {
                return;
            }
            throw new PdfForgeException(
                    ErrorKind.BROKEN_REFERENCE, "Reference " + ref + " does not resolve");
        }
        ordered.add(target);
        byOldNumber.put(old, ordered.size());
        queue.add(target);
    }

    private void scan(CosObject container) {
        if (container instanceof CosArray array) {
            for (CosObject item : array) {
                visit(item);
            }
        } else if (container instanceof CosDictionary dict) {
            for (Map.Entry<String, CosObject> entry : dict.entrySet()) {
                visit(entry.getValue());
            }
        }
    }

    private void visit(CosObject child) {
        if (child instanceof CosReference ref) {
            enqueue(ref);
        } else if (child instanceof CosStream stream) {
            if (!hoisted.containsKey(stream)) {
                ordered.add(stream);
                hoisted.put(stream, ordered.size());
                queue.add(stream);
            }
        } else {
            scan(child);
        }
    }
}
