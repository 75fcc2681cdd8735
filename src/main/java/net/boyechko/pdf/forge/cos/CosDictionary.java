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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A mutable PDF dictionary. Keys are name values without the leading slash. Iteration follows
 * insertion order so that serialization is deterministic.
 */
public final class CosDictionary implements CosObject {
    private final Map<String, CosObject> entries;

    public CosDictionary() {
        this.entries = new LinkedHashMap<>();
    }

    public CosDictionary(Map<String, ? extends CosObject> entries) {
        this.entries = new LinkedHashMap<>(entries);
    }

    /** Creates a dictionary with {@code /Type} set to the given name. */
    public static CosDictionary ofType(String type) {
        CosDictionary dict = new CosDictionary();
        dict.put("Type", CosName.of(type));
        return dict;
    }

    public CosObject get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public CosDictionary put(String key, CosObject value) {
        if (value == null) {
            entries.remove(key);
        } else {
            entries.put(key, value);
        }
        return this;
    }

    public CosDictionary putName(String key, String name) {
        return put(key, CosName.of(name));
    }

    public CosDictionary putNumber(String key, double value) {
        return put(key, CosNumber.of(value));
    }

    public CosDictionary putText(String key, String text) {
        return put(key, CosString.ofText(text));
    }

    public CosObject remove(String key) {
        return entries.remove(key);
    }

    public Set<String> keySet() {
        return entries.keySet();
    }

    public Set<Map.Entry<String, CosObject>> entrySet() {
        return entries.entrySet();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** The {@code /Type} name, if present. */
    public Optional<String> type() {
        return getName("Type");
    }

    public boolean isType(String type) {
        return type().map(type::equals).orElse(false);
    }

    public Optional<String> getName(String key) {
        return entries.get(key) instanceof CosName name
                ? Optional.of(name.value())
                : Optional.empty();
    }

    public Optional<String> getText(String key) {
        return entries.get(key) instanceof CosString s ? Optional.of(s.text()) : Optional.empty();
    }

    public int getInt(String key, int fallback) {
        return entries.get(key) instanceof CosNumber n ? n.intValue() : fallback;
    }

    public double getNumber(String key, double fallback) {
        return entries.get(key) instanceof CosNumber n ? n.value() : fallback;
    }

    public boolean getBoolean(String key, boolean fallback) {
        return entries.get(key) instanceof CosBoolean b ? b.value() : fallback;
    }

    /** Returns a new dictionary holding the same entries. Values are shared, not copied. */
    public CosDictionary shallowCopy() {
        return new CosDictionary(entries);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CosDictionary other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "<<" + entries + ">>";
    }
}
