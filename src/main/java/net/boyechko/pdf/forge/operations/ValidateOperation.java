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

import com.itextpdf.kernel.exceptions.BadPasswordException;
import com.itextpdf.kernel.exceptions.PdfException;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.ReaderProperties;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.forge.codec.PdfEncoder;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.Page;
import net.boyechko.pdf.forge.document.PageBox;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationContext.LoadedDocument;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/**
 * Checks the document's structure and reports problems as YAML. Errors make a document invalid;
 * warnings do not. The file is also opened with iText as an independent reader and any
 * disagreement is reported.
 */
public class ValidateOperation extends AbstractOperation {

    public ValidateOperation() {
        super(OperationKind.VALIDATE, ParameterSchema.of(ParameterSpec.text("password", null)));
    }

    /** Findings of one validation run. */
    record Findings(List<String> errors, List<String> warnings) {
        Findings() {
            this(new ArrayList<>(), new ArrayList<>());
        }

        boolean valid() {
            return errors.isEmpty();
        }
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        LoadedDocument input = ctx.single();
        String password = params.text("password", input.password());
        Findings findings = check(input.document());
        crossCheck(input, password, findings);

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("file", input.name());
        report.put("valid", findings.valid());
        report.put("errors", findings.errors());
        report.put("warnings", findings.warnings());

        OperationResult.Builder result = OperationResult.builder();
        if (!findings.valid()) {
            result.withWarning(input.name() + " has " + findings.errors().size() + " errors");
        }
        return result.withArtifact(null, YamlReport.EXTENSION, YamlReport.render(report)).build();
    }

    static Findings check(Document document) {
        Findings findings = new Findings();
        if (document.isRecovered()) {
            findings.warnings().add("cross-reference table was damaged and rebuilt by scanning");
        }
        if (document.isSealed()) {
            findings.warnings().add("encrypted; content was not checked without the password");
            return findings;
        }
        try {
            if (!document.catalog().isType("Catalog")) {
                findings.warnings().add("document catalog lacks /Type /Catalog");
            }
        } catch (PdfForgeException e) {
            findings.errors().add(e.getMessage());
            return findings;
        }
        if (document.pageCount() == 0) {
            findings.errors().add("document has no pages");
        }
        for (int i = 0; i < document.pageCount(); i++) {
            checkPage(document.page(i), i + 1, findings);
        }
        return findings;
    }

    private static void checkPage(Page page, int number, Findings findings) {
        String where = "page " + number + ": ";
        CosArray mediaBox = page.document().resolveArray(page.dictionary().get("MediaBox"));
        if (mediaBox == null || mediaBox.size() != 4) {
            findings.errors().add(where + "missing or malformed MediaBox");
        } else {
            PageBox box = PageBox.fromArray(mediaBox);
            if (box.width() <= 0 || box.height() <= 0) {
                findings.errors().add(where + "MediaBox has zero area");
            }
        }
        if (page.document().resolveDictionary(page.dictionary().get("Resources")) == null) {
            findings.warnings().add(where + "no resource dictionary");
        }
        try {
            page.contentBytes();
        } catch (PdfForgeException e) {
            findings.errors().add(where + "content cannot be decoded (" + e.getMessage() + ")");
        }
    }

    /** Opens the file with iText and records where it disagrees with our reading. */
    private void crossCheck(LoadedDocument input, String password, Findings findings) {
        Document document = input.document();
        byte[] bytes = input.bytes();
        if (bytes == null) {
            if (document.isSealed()) {
                return;
            }
            bytes = PdfEncoder.encodeUnprotected(document);
        }
        ReaderProperties properties = new ReaderProperties();
        if (password != null) {
            properties.setPassword(password.getBytes(StandardCharsets.UTF_8));
        }
        try (PdfReader reader = new PdfReader(new ByteArrayInputStream(bytes), properties)) {
            reader.setUnethicalReading(true);
            try (PdfDocument pdf = new PdfDocument(reader)) {
                if (reader.hasRebuiltXref()) {
                    findings.warnings().add("independent reader had to rebuild the xref table");
                }
                if (!document.isSealed() && pdf.getNumberOfPages() != document.pageCount()) {
                    findings.warnings()
                            .add(
                                    "independent reader sees "
                                            + pdf.getNumberOfPages()
                                            + " pages, expected "
                                            + document.pageCount());
                }
            }
        } catch (BadPasswordException e) {
            findings.warnings().add("independent reader needs a password to open the file");
        } catch (PdfException | IOException e) {
            logger.debug("iText rejected {}: {}", input.name(), e.getMessage());
            findings.warnings().add("independent reader failed: " + e.getMessage());
        }
    }
}
