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

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosReference;
import net.boyechko.pdf.forge.cos.CosStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds the object table of a damaged file by scanning it front to back for {@code N G obj}
 * headers. Later definitions of an object number replace earlier ones, as an incremental update
 * would.
 */
final class XrefRecovery {
    private static final Logger logger = LoggerFactory.getLogger(XrefRecovery.class);

    private static final Pattern OBJECT_HEADER =
            Pattern.compile("(?<![0-9])(\\d{1,10})\\s+(\\d{1,5})\\s+obj(?![A-Za-z0-9])");
    private static final Pattern TRAILER = Pattern.compile("trailer\\s*<<");

    /** Objects found by the scan, with the trailer that best describes them. */
    record Result(Map<Integer, CosParser.IndirectObject> objects, CosDictionary trailer) {}

    private final byte[] data;
    private final String text;

    XrefRecovery(byte[] data) {
        this.data = data;
        this.text = new String(data, StandardCharsets.ISO_8859_1);
    }

    Result scan() {
        Map<Integer, CosParser.IndirectObject> found = new TreeMap<>();
        Map<Integer, CosObject> objects = new TreeMap<>();
        Matcher matcher = OBJECT_HEADER.matcher(text);
        int from = 0;
        int skipped = 0;
        while (from < text.length() && matcher.find(from)) {
            int start = matcher.start();
            try {
                CosParser parser = new CosParser(data, start);
                CosParser.IndirectObject parsed = parser.parseIndirectObject(null);
                if (parsed.number() > 0) {
                    found.put(parsed.number(), parsed);
                    objects.put(parsed.number(), parsed.object());
                }
                from = Math.max(parsed.endOffset(), matcher.end());
            } catch (PdfForgeException e) {
                skipped++;
                logger.debug("Skipping unparseable object at offset {}: {}", start, e.getMessage());
                from = matcher.end();
            }
        }
        if (objects.isEmpty()) {
            throw PdfForgeException.malformed("No objects found while scanning the file");
        }
        CosDictionary trailer = findTrailer(objects);
        logger.warn(
                "Recovered {} objects by scanning the file ({} unparseable)",
                objects.size(),
                skipped);
        return new Result(found, trailer);
    }

    private CosDictionary findTrailer(Map<Integer, CosObject> objects) {
        CosDictionary best = null;
        Matcher matcher = TRAILER.matcher(text);
        while (matcher.find()) {
            try {
                CosParser parser = new CosParser(data, matcher.start() + "trailer".length());
                if (parser.parseObject() instanceof CosDictionary dict
                        && hasValidRoot(dict, objects)) {
                    best = dict;
                }
            } catch (PdfForgeException e) {
                logger.debug("Ignoring unparseable trailer at offset {}", matcher.start());
            }
        }
        if (best != null) {
            return best;
        }
        for (CosObject object : objects.values()) {
            if (object instanceof CosStream stream
                    && stream.dictionary().isType("XRef")
                    && hasValidRoot(stream.dictionary(), objects)) {
                best = stream.dictionary();
            }
        }
        if (best != null) {
            return best;
        }
        CosDictionary synthesized = new CosDictionary();
        for (Map.Entry<Integer, CosObject> entry : objects.entrySet()) {
            if (entry.getValue() instanceof CosDictionary dict && dict.isType("Catalog")) {
                synthesized.put("Root", CosReference.of(entry.getKey()));
            }
        }
        if (synthesized.get("Root") == null) {
            logger.warn("No document catalog found while scanning; pages will be collected loose");
        }
        return synthesized;
    }

    /** A root is valid if it names a catalog, or an object that may sit in an object stream. */
    private static boolean hasValidRoot(CosDictionary dict, Map<Integer, CosObject> objects) {
        if (!(dict.get("Root") instanceof CosReference root)) {
            return false;
        }
        CosObject target = objects.get(root.objectNumber());
        if (target == null) {
            return objects.values().stream()
                    .anyMatch(o -> o instanceof CosStream s && s.dictionary().isType("ObjStm"));
        }
        return target instanceof CosDictionary catalog
                && (catalog.isType("Catalog") || catalog.containsKey("Pages"));
    }
}
