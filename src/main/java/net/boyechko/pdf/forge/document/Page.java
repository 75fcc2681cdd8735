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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosNumber;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosReference;
import net.boyechko.pdf.forge.cos.CosStream;

/** Dictionary-backed view of one page. Inherited attributes are already materialized. */
public final class Page {
    private final Document document;
    private final CosReference reference;
    private final CosDictionary dictionary;

    Page(Document document, CosReference reference, CosDictionary dictionary) {
        this.document = document;
        this.reference = reference;
        this.dictionary = dictionary;
    }

    public Document document() {
        return document;
    }

    public CosReference reference() {
        return reference;
    }

    public CosDictionary dictionary() {
        return dictionary;
    }

    // ── Geometry ────────────────────────────────────────────────────

    /** The media box; US Letter if the entry is missing or unreadable. */
    public PageBox mediaBox() {
        CosArray array = document.resolveArray(dictionary.get("MediaBox"));
        return array != null && array.size() >= 4 ? PageBox.fromArray(array) : PageBox.LETTER;
    }

    /** The crop box, defaulting to the media box. */
    public PageBox cropBox() {
        CosArray array = document.resolveArray(dictionary.get("CropBox"));
        return array != null && array.size() >= 4 ? PageBox.fromArray(array) : mediaBox();
    }

    /** Clockwise display rotation in degrees, normalized to 0, 90, 180 or 270. */
    public int rotation() {
        CosObject value = dictionary.get("Rotate");
        if (value != null && document.resolve(value) instanceof CosNumber n) {
            int raw = n.intValue();
            return raw % 90 == 0 ? normalizeRotation(raw) : 0;
        }
        return 0;
    }

    /**
     * Sets the display rotation.
     *
     * @throws PdfForgeException INVALID_ANGLE if {@code degrees} is not a multiple of 90
     */
    public void setRotation(int degrees) {
        int normalized = normalizeRotation(degrees);
        if (normalized == 0) {
            dictionary.remove("Rotate");
        } else {
            dictionary.put("Rotate", CosNumber.of(normalized));
        }
    }

    public static int normalizeRotation(int degrees) {
        if (degrees % 90 != 0) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_ANGLE, "Rotation must be a multiple of 90: " + degrees);
        }
        return ((degrees % 360) + 360) % 360;
    }

    // ── Resources ───────────────────────────────────────────────────

    /** The resource dictionary, or an empty detached dictionary if the page has none. */
    public CosDictionary resources() {
        CosDictionary resources = document.resolveDictionary(dictionary.get("Resources"));
        return resources != null ? resources : new CosDictionary();
    }

    /**
     * Registers {@code value} under a fresh name in the given resource category (Font, XObject,
     * ExtGState, ...) and returns the name. The page's resource dictionary is copied first, so
     * pages sharing one resource dictionary are not affected.
     */
    public String addResource(String category, String prefix, CosObject value) {
        CosDictionary resources = ownResources();
        CosDictionary categoryDict = document.resolveDictionary(resources.get(category));
        categoryDict = categoryDict == null ? new CosDictionary() : categoryDict.shallowCopy();
        resources.put(category, categoryDict);
        int suffix = 1;
        String name = prefix + suffix;
        while (categoryDict.containsKey(name)) {
            name = prefix + (++suffix);
        }
        categoryDict.put(name, value);
        return name;
    }

    private CosDictionary ownResources() {
        CosDictionary current = document.resolveDictionary(dictionary.get("Resources"));
        CosDictionary own = current == null ? new CosDictionary() : current.shallowCopy();
        dictionary.put("Resources", own);
        return own;
    }

    // ── Content ─────────────────────────────────────────────────────

    /** The page's content streams in drawing order. */
    public List<CosStream> contentStreams() {
        List<CosStream> streams = new ArrayList<>();
        for (CosObject entry : contentEntries()) {
            CosStream stream = document.resolveStream(entry);
            if (stream != null) {
                streams.add(stream);
            }
        }
        return streams;
    }

    /** Concatenation of all decoded content streams, separated by newlines. */
    public byte[] contentBytes() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (CosStream stream : contentStreams()) {
            byte[] data = stream.decodedData();
            out.write(data, 0, data.length);
            out.write('\n');
        }
        return out.toByteArray();
    }

    /** Appends a content stream drawn after the existing content. */
    public void appendContent(byte[] data) {
        CosArray contents = normalizedContents();
        contents.add(document.add(CosStream.ofData(new CosDictionary(), data)));
    }

    /** Prepends a content stream drawn before the existing content. */
    public void prependContent(byte[] data) {
        CosArray contents = normalizedContents();
        contents.add(0, document.add(CosStream.ofData(new CosDictionary(), data)));
    }

    /**
     * Brackets the existing content with {@code q}/{@code Q} so that later appended content starts
     * from the default graphics state. Existing streams are not modified.
     */
    public void isolateExistingContent() {
        if (contentEntries().isEmpty()) {
            return;
        }
        prependContent("q\n".getBytes(StandardCharsets.US_ASCII));
        appendContent("Q\n".getBytes(StandardCharsets.US_ASCII));
    }

    private List<CosObject> contentEntries() {
        CosObject contents = dictionary.get("Contents");
        if (contents == null) {
            return List.of();
        }
        CosObject resolved = document.resolve(contents);
        if (resolved instanceof CosArray array) {
            return array.items();
        }
        return List.of(contents);
    }

    /** Rewrites {@code /Contents} as a direct array of references to indirect streams. */
    private CosArray normalizedContents() {
        CosArray normalized = new CosArray();
        for (CosObject entry : contentEntries()) {
            if (entry instanceof CosReference) {
                normalized.add(entry);
            } else if (entry instanceof CosStream stream) {
                normalized.add(document.add(stream));
            }
        }
        dictionary.put("Contents", normalized);
        return normalized;
    }

    @Override
    public String toString() {
        return "Page[" + reference + "]";
    }
}
