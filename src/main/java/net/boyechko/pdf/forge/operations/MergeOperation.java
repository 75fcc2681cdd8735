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
package net.boyechko.pdf.forge.operations;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosName;
import net.boyechko.pdf.forge.cos.CosNumber;
import net.boyechko.pdf.forge.cos.CosReference;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.ObjectTransplanter;
import net.boyechko.pdf.forge.document.Page;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationContext.LoadedDocument;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/**
 * Concatenates the pages of all inputs into a new document. Each input's objects are copied with
 * fresh numbers, and an outline entry can point at the first page of each input.
 */
public class MergeOperation extends AbstractOperation {

    public MergeOperation() {
        super(
                OperationKind.MERGE,
                ParameterSchema.of(
                        ParameterSpec.choice("sort", "input", "input", "name", "date", "size"),
                        ParameterSpec.bool("bookmarks", true)));
    }

    private record Section(String title, CosReference firstPage) {}

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        List<LoadedDocument> inputs = new ArrayList<>(ctx.inputs());
        sort(inputs, params.choice("sort"));

        OperationResult.Builder result = OperationResult.builder();
        Document target = Document.blank();
        List<Section> sections = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
            LoadedDocument input = inputs.get(i);
            Document source = input.document();
            if (source.pageCount() == 0) {
                result.withWarning(input.name() + " has no pages");
                continue;
            }
            ObjectTransplanter transplanter = new ObjectTransplanter(source, target);
            Page first = null;
            for (Page page : source.pages()) {
                Page copy = transplanter.transplant(page);
                target.addPage(copy);
                if (first == null) {
                    first = copy;
                }
            }
            if (i == 0) {
                DocumentSupport.copyInfo(source, target, transplanter);
            }
            sections.add(new Section(input.stem(), first.reference()));
            logger.debug(
                    "Merged {} pages ({} objects) from {}",
                    source.pageCount(),
                    transplanter.copiedCount(),
                    input.name());
        }
        if (params.bool("bookmarks") && !sections.isEmpty()) {
            addOutline(target, sections);
        }
        return result.withDocument(target).build();
    }

    private static void sort(List<LoadedDocument> inputs, String order) {
        switch (order) {
            case "name" -> inputs.sort(
                    Comparator.comparing(LoadedDocument::name, String.CASE_INSENSITIVE_ORDER));
            case "date" -> inputs.sort(Comparator.comparing(MergeOperation::modified));
            case "size" -> inputs.sort(
                    Comparator.comparingInt(d -> d.bytes() == null ? 0 : d.bytes().length));
            default -> {}
        }
    }

    private static FileTime modified(LoadedDocument input) {
        if (input.path() == null) {
            return FileTime.fromMillis(0);
        }
        try {
            return Files.getLastModifiedTime(input.path());
        } catch (IOException e) {
            throw new PdfForgeException(
                    ErrorKind.IO_FAILURE, "Cannot read modification time of " + input.path(), e);
        }
    }

    private static void addOutline(Document target, List<Section> sections) {
        CosDictionary outlines = CosDictionary.ofType("Outlines");
        CosReference outlinesRef = target.add(outlines);
        List<CosReference> items = new ArrayList<>();
        List<CosDictionary> dicts = new ArrayList<>();
        for (Section section : sections) {
            CosDictionary item = new CosDictionary();
            item.putText("Title", section.title());
            item.put("Parent", outlinesRef);
            item.put("Dest", CosArray.of(section.firstPage(), CosName.of("Fit")));
            dicts.add(item);
            items.add(target.add(item));
        }
        for (int i = 0; i < dicts.size(); i++) {
            if (i > 0) {
                dicts.get(i).put("Prev", items.get(i - 1));
            }
            if (i + 1 < dicts.size()) {
                dicts.get(i).put("Next", items.get(i + 1));
            }
        }
        outlines.put("First", items.get(0));
        outlines.put("Last", items.get(items.size() - 1));
        outlines.put("Count", CosNumber.of(items.size()));
        CosDictionary catalog = target.catalog();
        catalog.put("Outlines", outlinesRef);
        catalog.putName("PageMode", "UseOutlines");
    }
}
