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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.IntFunction;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosNumber;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosReference;
import net.boyechko.pdf.forge.cos.CosStream;
import net.boyechko.pdf.forge.cos.CosString;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.EncryptionState;
import net.boyechko.pdf.forge.document.PageTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns PDF bytes into a {@link Document}.
 *
 * <p>The cross-reference chain is used when it is consistent with the file; otherwise every object
 * is recovered by a linear scan. Object streams are expanded on both paths, and an encrypted
 * document is decrypted eagerly once a password authenticates.
 */
public final class PdfDecoder {
    private static final Logger logger = LoggerFactory.getLogger(PdfDecoder.class);

    private static final int HEADER_SEARCH_WINDOW = 1024;
    private static final String HEADER = "%PDF-";
    private static final String DEFAULT_VERSION = "1.7";

    private PdfDecoder() {}

    public static Document decode(byte[] bytes) {
        return decode(bytes, DecodeOptions.defaults());
    }

    /**
     * Decodes {@code bytes}.
     *
     * @throws PdfForgeException MALFORMED_DOCUMENT if no object can be located, WRONG_PASSWORD if
     *     a supplied password does not open the document
     */
    public static Document decode(byte[] bytes, DecodeOptions options) {
        if (bytes == null || bytes.length == 0) {
            throw PdfForgeException.malformed("Input is empty");
        }
        String version = readHeader(bytes, options.forceRepair());

        Loaded loaded = null;
        if (!options.forceRepair()) {
            try {
                loaded = readThroughXref(bytes);
            } catch (PdfForgeException e) {
                logger.warn(
                        "Cross-reference unusable ({}); scanning the whole file", e.getMessage());
            }
        }
        if (loaded == null) {
            loaded = readByScan(bytes);
        }

        Document document = new Document();
        document.setVersion(version);
        document.setRecovered(loaded.recovered());
        CosDictionary trailer = loaded.trailer();
        byte[][] fileId = readFileId(trailer.get("ID"));
        document.setFileId(fileId);

        Map<Integer, CosParser.IndirectObject> objects = loaded.objects();
        EncryptionState encryption = null;
        int encryptNumber = -1;
        CosObject encryptEntry = trailer.get("Encrypt");
        if (encryptEntry != null) {
            CosDictionary encryptDict = null;
            if (encryptEntry instanceof CosReference ref) {
                encryptNumber = ref.objectNumber();
                CosParser.IndirectObject holder = objects.get(encryptNumber);
                if (holder != null && holder.object() instanceof CosDictionary d) {
                    encryptDict = d;
                }
            } else if (encryptEntry instanceof CosDictionary d) {
                encryptDict = d;
            }
            if (encryptDict == null) {
                throw PdfForgeException.malformed("Encryption dictionary is missing");
            }
            encryption = unlock(encryptDict, fileId, options.password());
            if (encryption.isAuthenticated()) {
                decryptObjects(objects, encryption, encryptNumber);
            }
        }
        document.setEncryption(encryption);
        boolean sealed = encryption != null && !encryption.isAuthenticated();

        Map<Integer, CosObject> table = new TreeMap<>();
        for (Map.Entry<Integer, CosParser.IndirectObject> entry : objects.entrySet()) {
            if (entry.getKey() != encryptNumber) {
                table.put(entry.getKey(), entry.getValue().object());
            }
        }
        if (!sealed) {
            expandObjectStreams(table, loaded.compressed());
        }
        dropCrossReferenceStreams(table);
        if (table.isEmpty()) {
            throw PdfForgeException.malformed("File contains no objects");
        }

        for (Map.Entry<Integer, CosObject> entry : table.entrySet()) {
            document.set(entry.getKey(), entry.getValue());
        }
        for (int number : loaded.free()) {
            if (!table.containsKey(number)) {
                document.markFree(number);
            }
        }
        if (encryptNumber > 0) {
            document.markFree(encryptNumber);
        }
        freeDanglingReferences(document, table);
        inlineStreamParameters(document, table);

        if (trailer.get("Root") instanceof CosReference root) {
            document.setRootReference(root);
        }
        if (trailer.get("Info") instanceof CosReference info
                && document.get(info.objectNumber()) instanceof CosDictionary) {
            document.setInfoReference(info);
        }

        if (document.rootReference() == null && !sealed) {
            if (!loaded.recovered()) {
                throw PdfForgeException.malformed("Trailer has no /Root");
            }
            document.setRootReference(rebuildCatalog(document));
        }
        try {
            PageTree.load(document);
        } catch (PdfForgeException e) {
            if (!sealed) {
                throw e;
            }
            logger.debug("Page tree of sealed document not readable: {}", e.getMessage());
        }
        if (loaded.recovered() && !sealed && document.pageCount() == 0) {
            document.setRootReference(rebuildCatalog(document));
            PageTree.load(document);
        }
        logger.debug(
                "Decoded {} objects, {} pages{}",
                document.objectCount(),
                document.pageCount(),
                loaded.recovered() ? " (recovered)" : "");
        return document;
    }

    /**
     * Builds a fresh catalog whose flat page tree holds every page dictionary found, in object
     * number order. Used when a scanned file has no usable catalog.
     */
    private static CosReference rebuildCatalog(Document document) {
        List<CosReference> pages = new ArrayList<>();
        for (int number : document.objectNumbers()) {
            if (document.get(number) instanceof CosDictionary dict && dict.isType("Page")) {
                pages.add(CosReference.of(number));
            }
        }
        if (pages.isEmpty()) {
            throw PdfForgeException.malformed("No document catalog or page objects found");
        }
        CosDictionary pagesNode = CosDictionary.ofType("Pages");
        CosReference pagesRef = document.add(pagesNode);
        CosArray kids = new CosArray();
        for (CosReference page : pages) {
            document.resolveDictionary(page).put("Parent", pagesRef);
            kids.add(page);
        }
        pagesNode.put("Kids", kids);
        pagesNode.putNumber("Count", pages.size());
        CosDictionary catalog = CosDictionary.ofType("Catalog");
        catalog.put("Pages", pagesRef);
        logger.warn("Rebuilt document catalog around {} loose pages", pages.size());
        return document.add(catalog);
    }

    // ── Header and trailer ──────────────────────────────────────────

    private static String readHeader(byte[] bytes, boolean repairing) {
        int window = Math.min(bytes.length, HEADER_SEARCH_WINDOW);
        String head = new String(bytes, 0, window, StandardCharsets.ISO_8859_1);
        int at = head.indexOf(HEADER);
        if (at < 0) {
            if (repairing) {
                logger.warn("No %PDF- header found; assuming version {}", DEFAULT_VERSION);
                return DEFAULT_VERSION;
            }
            throw PdfForgeException.malformed("No %PDF- header in the first " + window + " bytes");
        }
        int start = at + HEADER.length();
        int end = start;
        while (end < head.length()
                && (Character.isDigit(head.charAt(end)) || head.charAt(end) == '.')) {
            end++;
        }
        return end > start ? head.substring(start, end) : DEFAULT_VERSION;
    }

    private static byte[][] readFileId(CosObject value) {
        if (value instanceof CosArray array
                && array.size() >= 2
                && array.get(0) instanceof CosString first
                && array.get(1) instanceof CosString second) {
            return new byte[][] {first.bytes(), second.bytes()};
        }
        return null;
    }

    // ── Object table ────────────────────────────────────────────────

    private record Loaded(
            Map<Integer, CosParser.IndirectObject> objects,
            Set<Integer> free,
            Map<Integer, XrefTable.Compressed> compressed,
            CosDictionary trailer,
            boolean recovered) {}

    private static Loaded readThroughXref(byte[] bytes) {
        XrefReader reader = new XrefReader(bytes);
        XrefTable xref = reader.read();
        IntFunction<Integer> lengthLookup = number -> lookupLength(bytes, xref, number);
        Map<Integer, CosParser.IndirectObject> objects = new TreeMap<>();
        Set<Integer> free = new HashSet<>();
        Map<Integer, XrefTable.Compressed> compressed = new TreeMap<>();
        for (Map.Entry<Integer, XrefTable.Entry> entry : xref.entries().entrySet()) {
            int number = entry.getKey();
            if (number <= 0) {
                continue;
            }
            XrefTable.Entry value = entry.getValue();
            if (value instanceof XrefTable.InUse inUse) {
                if (!reader.pointsAtObject(inUse.offset(), number)) {
                    throw PdfForgeException.malformed(
                            "Entry for object " + number + " does not point at its header");
                }
                CosParser parser = new CosParser(bytes, inUse.offset());
                objects.put(number, parser.parseIndirectObject(lengthLookup));
            } else if (value instanceof XrefTable.Compressed inStream) {
                compressed.put(number, inStream);
            } else {
                free.add(number);
            }
        }
        if (objects.isEmpty()) {
            throw PdfForgeException.malformed("Cross-reference lists no objects");
        }
        CosDictionary trailer = xref.trailer();
        if (!(trailer.get("Root") instanceof CosReference root)
                || !(objects.containsKey(root.objectNumber())
                        || compressed.containsKey(root.objectNumber()))) {
            throw PdfForgeException.malformed("Trailer /Root is not in the cross-reference");
        }
        return new Loaded(objects, free, compressed, trailer, false);
    }

    private static Integer lookupLength(byte[] bytes, XrefTable xref, int number) {
        if (xref.get(number) instanceof XrefTable.InUse inUse) {
            try {
                CosObject value =
                        new CosParser(bytes, inUse.offset()).parseIndirectObject(null).object();
                return value instanceof CosNumber n ? n.intValue() : null;
            } catch (PdfForgeException e) {
                return null;
            }
        }
        return null;
    }

    private static Loaded readByScan(byte[] bytes) {
        XrefRecovery.Result result = new XrefRecovery(bytes).scan();
        return new Loaded(result.objects(), Set.of(), Map.of(), result.trailer(), true);
    }

    /**
     * Unpacks {@code /Type /ObjStm} streams. With a cross-reference, only the objects it assigns to
     * a stream are taken from it; after a scan, objects defined at top level take precedence.
     */
    private static void expandObjectStreams(
            Map<Integer, CosObject> table, Map<Integer, XrefTable.Compressed> compressed) {
        List<Integer> streamNumbers = new ArrayList<>();
        for (Map.Entry<Integer, CosObject> entry : table.entrySet()) {
            if (entry.getValue() instanceof CosStream stream
                    && stream.dictionary().isType("ObjStm")) {
                streamNumbers.add(entry.getKey());
            }
        }
        Map<Integer, CosObject> unpacked = new HashMap<>();
        for (int streamNumber : streamNumbers) {
            CosStream stream = (CosStream) table.remove(streamNumber);
            try {
                unpackObjectStream(streamNumber, stream, compressed, unpacked);
            } catch (PdfForgeException e) {
                logger.warn(
                        "Skipping unreadable object stream {}: {}", streamNumber, e.getMessage());
            }
        }
        for (Map.Entry<Integer, CosObject> entry : unpacked.entrySet()) {
            table.putIfAbsent(entry.getKey(), entry.getValue());
        }
    }

    private static void unpackObjectStream(
            int streamNumber,
            CosStream stream,
            Map<Integer, XrefTable.Compressed> compressed,
            Map<Integer, CosObject> unpacked) {
        byte[] data = stream.decodedData();
        int count = stream.dictionary().getInt("N", 0);
        int first = stream.dictionary().getInt("First", 0);
        CosParser header = new CosParser(data, 0);
        for (int i = 0; i < count; i++) {
            header.skipWhitespace();
            int number = (int) header.readUnsignedInteger();
            header.skipWhitespace();
            int offset = (int) header.readUnsignedInteger();
            XrefTable.Compressed expected = compressed.get(number);
            if (!compressed.isEmpty()
                    && (expected == null || expected.streamNumber() != streamNumber)) {
                continue;
            }
            CosObject object = new CosParser(data, first + offset).parseObject();
            unpacked.put(number, object);
        }
        logger.debug("Expanded object stream {} holding {} objects", streamNumber, count);
    }

    private static void dropCrossReferenceStreams(Map<Integer, CosObject> table) {
        table.values()
                .removeIf(o -> o instanceof CosStream s && s.dictionary().isType("XRef"));
    }

    /** Undefined objects are null objects; record them as free so references stay resolvable. */
    private static void freeDanglingReferences(Document document, Map<Integer, CosObject> table) {
        Set<Integer> dangling = new HashSet<>();
        for (CosObject object : table.values()) {
            collectDangling(document, object, dangling);
        }
        for (int number : dangling) {
            document.markFree(number);
        }
        if (!dangling.isEmpty()) {
            logger.warn(
                    "{} references point at undefined objects; treating them as null",
                    dangling.size());
        }
    }

    private static void collectDangling(Document document, CosObject object, Set<Integer> out) {
        if (object instanceof CosReference ref) {
            int number = ref.objectNumber();
            if (!document.contains(number) && !document.isFree(number)) {
                out.add(number);
            }
        } else if (object instanceof CosArray array) {
            for (CosObject item : array) {
                collectDangling(document, item, out);
            }
        } else if (object instanceof CosDictionary dict) {
            for (Map.Entry<String, CosObject> entry : dict.entrySet()) {
                collectDangling(document, entry.getValue(), out);
            }
        } else if (object instanceof CosStream stream) {
            collectDangling(document, stream.dictionary(), out);
        }
    }

    /** Filter chains are read without a document, so indirect filter entries are made direct. */
    private static void inlineStreamParameters(Document document, Map<Integer, CosObject> table) {
        for (CosObject object : table.values()) {
            if (object instanceof CosStream stream) {
                CosDictionary dict = stream.dictionary();
                for (String key : List.of("Filter", "DecodeParms")) {
                    if (dict.get(key) instanceof CosReference ref) {
                        dict.put(key, document.resolve(ref));
                    }
                }
            }
        }
    }

    // ── Encryption ──────────────────────────────────────────────────

    private static EncryptionState unlock(
            CosDictionary encryptDict, byte[][] fileId, String password) {
        byte[] firstId = fileId != null ? fileId[0] : new byte[0];
        EncryptionState state = StandardSecurityHandler.fromDictionary(encryptDict, firstId);
        String attempt = password != null ? password : "";
        EncryptionState authenticated = StandardSecurityHandler.authenticate(state, attempt);
        if (authenticated != null) {
            logger.debug("Opened {} document", state.algorithm());
            return authenticated;
        }
        if (password != null) {
            throw new PdfForgeException(
                    ErrorKind.WRONG_PASSWORD, "Password does not open the document");
        }
        logger.info("Document is encrypted and needs a password; keeping it sealed");
        return state;
    }

    private static void decryptObjects(
            Map<Integer, CosParser.IndirectObject> objects,
            EncryptionState state,
            int encryptNumber) {
        for (Map.Entry<Integer, CosParser.IndirectObject> entry : objects.entrySet()) {
            int number = entry.getKey();
            if (number == encryptNumber) {
                continue;
            }
            CosParser.IndirectObject holder = entry.getValue();
            CosObject object = holder.object();
            CosObject decrypted = decryptValue(state, number, holder.generation(), object);
            if (decrypted != object) {
                entry.setValue(
                        new CosParser.IndirectObject(
                                holder.number(),
                                holder.generation(),
                                decrypted,
                                holder.endOffset()));
            }
        }
    }

    /** Decrypts strings and stream payloads, replacing container entries in place. */
    private static CosObject decryptValue(
            EncryptionState state, int number, int generation, CosObject object) {
        if (object instanceof CosString string) {
            try {
                byte[] plain =
                        StandardSecurityHandler.decrypt(state, number, generation, string.bytes());
                return new CosString(plain, string.hex());
            } catch (PdfForgeException e) {
                logger.debug("Leaving undecryptable string in object {}", number);
                return object;
            }
        }
        if (object instanceof CosArray array) {
            for (int i = 0; i < array.size(); i++) {
                array.set(i, decryptValue(state, number, generation, array.get(i)));
            }
        } else if (object instanceof CosDictionary dict) {
            boolean signature = isSignatureDictionary(dict);
            for (String key : new ArrayList<>(dict.keySet())) {
                if (signature && key.equals("Contents")) {
                    continue;
                }
                dict.put(key, decryptValue(state, number, generation, dict.get(key)));
            }
        } else if (object instanceof CosStream stream) {
            decryptValue(state, number, generation, stream.dictionary());
            if (!StandardSecurityHandler.isExemptStream(state, stream.dictionary())) {
                stream.replaceEncodedData(
                        StandardSecurityHandler.decrypt(
                                state, number, generation, stream.encodedData()));
            }
        }
        return object;
    }

    /** True for a signature or document timestamp dictionary with a signed byte range. */
    public static boolean isSignatureDictionary(CosDictionary dict) {
        return dict.containsKey("ByteRange")
                && (dict.isType("Sig")
                        || dict.isType("DocTimeStamp")
                        || dict.containsKey("Filter"));
    }
}
