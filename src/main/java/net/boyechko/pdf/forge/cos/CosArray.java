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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/** An ordered, mutable PDF array. */
public final class CosArray implements CosObject, Iterable<CosObject> {
    private final List<CosObject> items;

    public CosArray() {
        this.items = new ArrayList<>();
    }

    public CosArray(List<? extends CosObject> items) {
        this.items = new ArrayList<>(items);
    }

    public static CosArray of(CosObject... items) {
        return new CosArray(List.of(items));
    }

    public static CosArray ofNumbers(double... values) {
        CosArray array = new CosArray();
        for (double v : values) {
            array.add(CosNumber.of(v));
        }
        return array;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public CosObject get(int index) {
        return items.get(index);
    }

    public void add(CosObject item) {
        items.add(item);
    }

    public void add(int index, CosObject item) {
        items.add(index, item);
    }

    public void set(int index, CosObject item) {
        items.set(index, item);
    }

    public CosObject remove(int index) {
        return items.remove(index);
    }

    /** Returns the number at {@code index}, or {@code fallback} if the item is not a number. */
    public double getNumber(int index, double fallback) {
        if (index < items.size() && items.get(index) instanceof CosNumber n) {
            return n.value();
        }
        return fallback;
    }

    public List<CosObject> items() {
        return List.copyOf(items);
    }

    @Override
    public Iterator<CosObject> iterator() {
        return items().iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CosArray other && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
