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

import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosString;

/** Typed view over a document's {@code /Info} dictionary. */
public final class DocumentInfo {
    public static final String TITLE = "Title";
    public static final String AUTHOR = "Author";
    public static final String SUBJECT = "Subject";
    public static final String KEYWORDS = "Keywords";
    public static final String CREATOR = "Creator";
    public static final String PRODUCER = "Producer";
    public static final String CREATION_DATE = "CreationDate";
    public static final String MOD_DATE = "ModDate";

    public static final List<String> TEXT_KEYS =
            List.of(TITLE, AUTHOR, SUBJECT, KEYWORDS, CREATOR, PRODUCER);

    private final CosDictionary dictionary;

    DocumentInfo(CosDictionary dictionary) {
        this.dictionary = dictionary;
    }

    public Optional<String> get(String key) {
        return dictionary.getText(key).filter(s -> !s.isEmpty());
    }

    /** Sets a text entry; a null or empty value removes it. */
    public void set(String key, String value) {
        if (value == null || value.isEmpty()) {
            dictionary.remove(key);
        } else {
            dictionary.put(key, CosString.ofText(value));
        }
    }

    public Optional<String> title() {
        return get(TITLE);
    }

    public Optional<String> author() {
        return get(AUTHOR);
    }

    public Optional<ZonedDateTime> modificationDate() {
        return get(MOD_DATE).flatMap(PdfDate::parse);
    }

    public void setDate(String key, ZonedDateTime time) {
        dictionary.put(key, CosString.ofText(PdfDate.format(time)));
    }

    /** Removes every entry. */
    public void clear() {
        for (String key : List.copyOf(dictionary.keySet())) {
            dictionary.remove(key);
        }
    }

    /** All text-valued entries in insertion order. */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (String key : dictionary.keySet()) {
            dictionary.getText(key).ifPresent(v -> map.put(key, v));
        }
        return map;
    }
}
