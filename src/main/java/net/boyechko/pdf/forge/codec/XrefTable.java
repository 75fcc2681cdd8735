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

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosObject;

/** Cross-reference entries merged across all sections, plus the merged trailer dictionary. */
final class XrefTable {

    /** One cross-reference entry. */
    sealed interface Entry permits Free, InUse, Compressed {}

    record Free(int generation) implements Entry {}

    record InUse(int offset, int generation) implements Entry {}

    record Compressed(int streamNumber, int index) implements Entry {}

    private final Map<Integer, Entry> entries = new TreeMap<>();
    private final CosDictionary trailer = new CosDictionary();

    /**
     * Records an entry unless one was already recorded for the number. Sections are read newest
     * first, so the first entry seen for a number wins.
     */
    void putIfAbsent(int number, Entry entry) {
        entries.putIfAbsent(number, entry);
    }

    Entry get(int number) {
        return entries.get(number);
    }

    Map<Integer, Entry> entries() {
        return Collections.unmodifiableMap(entries);
    }

    /** Merges trailer keys from an older section without overriding newer values. */
    void mergeTrailer(CosDictionary sectionTrailer) {
        for (Map.Entry<String, CosObject> e : sectionTrailer.entrySet()) {
            if (!trailer.containsKey(e.getKey())) {
                trailer.put(e.getKey(), e.getValue());
            }
        }
    }

    CosDictionary trailer() {
        return trailer;
    }

    int size() {
        return entries.size();
    }
}
