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
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosNull;
import net.boyechko.pdf.forge.cos.CosNumber;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosReference;
import net.boyechko.pdf.forge.cos.CosStream;

/**
 * In-memory PDF document: a flat table of indirect objects keyed by object number, the ordered
 * page list, and the trailer entries.
 *
 * <p>Objects link to each other only through {@link CosReference}. Every reference is expected to
 * resolve to an object in the table or to an entry marked free; anything else is a broken
 * reference. A document is not thread-safe and is owned by exactly one job at a time.
 */
public final class Document {
    private static final int MAX_REFERENCE_CHAIN = 32;

    private final Map<Integer, CosObject> objects = new HashMap<>();
    private final Set<Integer> freeNumbers = new HashSet<>();
    private final List<Page> pages = new ArrayList<>();
    private int nextNumber = 1;

    private String version = "1.7";
    private CosReference rootReference;
    private CosReference infoReference;
    private byte[][] fileId;
    private EncryptionState encryption;
    private PendingSignature pendingSignature;
    private boolean recovered;

    /** Creates a new document with a catalog, an empty page tree and no pages. */
    public static Document blank() {
        Document doc = new Document();
        CosDictionary pagesNode = CosDictionary.ofType("Pages");
        pagesNode.put("Kids", new CosArray());
        pagesNode.put("Count", CosNumber.of(0));
        CosReference pagesRef = doc.add(pagesNode);
        CosDictionary catalog = CosDictionary.ofType("Catalog");
        catalog.put("Pages", pagesRef);
        doc.setRootReference(doc.add(catalog));
        return doc;
    }

    // ── Object table ────────────────────────────────────────────────

    /** Adds {@code object} under a fresh object number and returns its reference. */
    public CosReference add(CosObject object) {
        int number = reserveNumber();
        objects.put(number, object);
        return CosReference.of(number);
    }

    /** Reserves a fresh object number without storing anything under it yet. */
    public int reserveNumber() {
        return nextNumber++;
    }

    public void set(int number, CosObject object) {
        if (number <= 0) {
            throw new IllegalArgumentException("Object number must be positive: " + number);
        }
        objects.put(number, object);
        freeNumbers.remove(number);
        nextNumber = Math.max(nextNumber, number + 1);
    }

    /** Returns the object stored under {@code number}, or null if there is none. */
    public CosObject get(int number) {
        return objects.get(number);
    }

    public boolean contains(int number) {
        return objects.containsKey(number);
    }

    /** Marks an object number as free; references to it resolve to {@link CosNull}. */
    public void markFree(int number) {
        objects.remove(number);
        freeNumbers.add(number);
        nextNumber = Math.max(nextNumber, number + 1);
    }

    public boolean isFree(int number) {
        return freeNumbers.contains(number);
    }

    /** Object numbers currently in use, in ascending order. */
    public Set<Integer> objectNumbers() {
        return Collections.unmodifiableSet(new TreeSet<>(objects.keySet()));
    }

    public int objectCount() {
        return objects.size();
    }

    /**
     * Follows references until a direct object is reached.
     *
     * @throws PdfForgeException BROKEN_REFERENCE if a reference is neither present nor free
     */
    public CosObject resolve(CosObject object) {
        CosObject current = object;
        for (int i = 0; i < MAX_REFERENCE_CHAIN; i++) {
            if (!(current instanceof CosReference ref)) {
                return current;
            }
            CosObject target = objects.get(ref.objectNumber());
            if (target == null) {
                if (freeNumbers.contains(ref.objectNumber())) {
                    return CosNull.INSTANCE;
                }
                throw new PdfForgeException(
                        ErrorKind.BROKEN_REFERENCE, "Reference " + ref + " does not resolve");
            }
            current = target;
        }
        throw new PdfForgeException(
                ErrorKind.BROKEN_REFERENCE, "Reference chain too long starting at " + object);
    }

    /** Resolves {@code object} and returns it if it is a dictionary, else null. */
    public CosDictionary resolveDictionary(CosObject object) {
        if (object == null) {
            return null;
        }
        CosObject resolved = resolve(object);
        if (resolved instanceof CosDictionary dict) {
            return dict;
        }
        if (resolved instanceof CosStream stream) {
            return stream.dictionary();
        }
        return null;
    }

    public CosArray resolveArray(CosObject object) {
        return object != null && resolve(object) instanceof CosArray array ? array : null;
    }

    public CosStream resolveStream(CosObject object) {
        return object != null && resolve(object) instanceof CosStream stream ? stream : null;
    }

    // ── Trailer ─────────────────────────────────────────────────────

    public CosReference rootReference() {
        return rootReference;
    }

    public void setRootReference(CosReference rootReference) {
        this.rootReference = rootReference;
    }

    public CosReference infoReference() {
        return infoReference;
    }

    public void setInfoReference(CosReference infoReference) {
        this.infoReference = infoReference;
    }

    /** The two file identifiers of the trailer {@code /ID}, or null if not assigned. */
    public byte[][] fileId() {
        return fileId;
    }

    public void setFileId(byte[][] fileId) {
        this.fileId = fileId;
    }

    public String version() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    /**
     * Returns the document catalog.
     *
     * @throws PdfForgeException MALFORMED_DOCUMENT if there is no catalog
     */
    public CosDictionary catalog() {
        CosDictionary catalog = rootReference == null ? null : resolveDictionary(rootReference);
        if (catalog == null) {
            throw PdfForgeException.malformed("Document has no catalog");
        }
        return catalog;
    }

    /** Returns a view of the {@code /Info} dictionary, creating it if absent. */
    public DocumentInfo info() {
        CosDictionary dict = infoReference == null ? null : resolveDictionary(infoReference);
        if (dict == null) {
            dict = new CosDictionary();
            infoReference = add(dict);
        }
        return new DocumentInfo(dict);
    }

    /** True if the document has a non-empty {@code /Info} dictionary. */
    public boolean hasInfo() {
        CosDictionary dict = infoReference == null ? null : resolveDictionary(infoReference);
        return dict != null && !dict.isEmpty();
    }

    // ── Pages ───────────────────────────────────────────────────────

    public int pageCount() {
        return pages.size();
    }

    /** Returns the page at zero-based {@code index}. */
    public Page page(int index) {
        checkPageIndex(index, pages.size() - 1);
        return pages.get(index);
    }

    public List<Page> pages() {
        return List.copyOf(pages);
    }

    public void addPage(Page page) {
        insertPage(pages.size(), page);
    }

    public void insertPage(int index, Page page) {
        checkPageIndex(index, pages.size());
        checkOwnership(page);
        pages.add(index, page);
    }

    public void setPage(int index, Page page) {
        checkPageIndex(index, pages.size() - 1);
        checkOwnership(page);
        pages.set(index, page);
    }

    public Page removePage(int index) {
        checkPageIndex(index, pages.size() - 1);
        return pages.remove(index);
    }

    /** Replaces the page order wholesale. Every page must belong to this document. */
    public void setPages(List<Page> newPages) {
        newPages.forEach(this::checkOwnership);
        pages.clear();
        pages.addAll(newPages);
    }

    /** Creates an empty page dictionary in this document. The page is not yet in the page list. */
    public Page createPage(PageBox mediaBox) {
        CosDictionary dict = CosDictionary.ofType("Page");
        dict.put("MediaBox", mediaBox.toArray());
        dict.put("Resources", new CosDictionary());
        CosReference ref = add(dict);
        return new Page(this, ref, dict);
    }

    /** Wraps an existing page dictionary of this document. Used when loading the page tree. */
    public Page pageAt(CosReference reference) {
        CosDictionary dict = resolveDictionary(reference);
        if (dict == null) {
            throw new PdfForgeException(
                    ErrorKind.BROKEN_REFERENCE, "Page reference " + reference + " is not a dict");
        }
        return new Page(this, reference, dict);
    }

    /**
     * Rewrites the page tree as a single {@code /Pages} node listing the current page order, and
     * points every page's {@code /Parent} at it. Intermediate nodes become unreachable.
     */
    public void syncPageTree() {
        CosDictionary catalog = catalog();
        CosObject pagesEntry = catalog.get("Pages");
        CosDictionary node = CosDictionary.ofType("Pages");
        CosReference pagesRef;
        if (pagesEntry instanceof CosReference ref && contains(ref.objectNumber())) {
            pagesRef = ref;
            set(ref.objectNumber(), node);
        } else {
            pagesRef = add(node);
            catalog.put("Pages", pagesRef);
        }
        CosArray kids = new CosArray();
        for (Page page : pages) {
            kids.add(page.reference());
            page.dictionary().put("Parent", pagesRef);
        }
        node.put("Kids", kids);
        node.put("Count", CosNumber.of(pages.size()));
    }

    private void checkOwnership(Page page) {
        if (page.document() != this) {
            throw new IllegalArgumentException("Page belongs to another document");
        }
    }

    private static void checkPageIndex(int index, int max) {
        if (index < 0 || index > max) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_RANGE, "Page index " + index + " outside 0.." + max);
        }
    }

    // ── Security and signing ────────────────────────────────────────

    public EncryptionState encryption() {
        return encryption;
    }

    public boolean isEncrypted() {
        return encryption != null;
    }

    /** True if the document is encrypted and its key could not be derived. */
    public boolean isSealed() {
        return encryption != null && !encryption.isAuthenticated();
    }

    public void setEncryption(EncryptionState encryption) {
        this.encryption = encryption;
    }

    public PendingSignature pendingSignature() {
        return pendingSignature;
    }

    public void setPendingSignature(PendingSignature pendingSignature) {
        this.pendingSignature = pendingSignature;
    }

    /** True if the document was loaded through the full-scan repair path. */
    public boolean isRecovered() {
        return recovered;
    }

    public void setRecovered(boolean recovered) {
        this.recovered = recovered;
    }
}
