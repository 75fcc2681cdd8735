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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.PageRange;
import net.boyechko.pdf.forge.operation.PageSelection;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/**
 * Splits a document into one document per page range: explicit ranges, fixed-size chunks, or one
 * document per page.
 */
public class SplitOperation extends AbstractOperation {

    public SplitOperation() {
        super(
                OperationKind.SPLIT,
                ParameterSchema.of(
                        ParameterSpec.text("ranges", null), ParameterSpec.integer("every", null)));
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        Document source = ctx.document();
        List<PageRange> ranges = ranges(params, source.pageCount());
        OperationResult.Builder result = OperationResult.builder();
        for (PageRange range : ranges) {
            List<Integer> indices = new ArrayList<>();
            for (int page = range.first(); page <= range.last(); page++) {
                indices.add(page - 1);
            }
            Document part = DocumentSupport.extractPages(source, indices);
            result.withDocument("pages_" + range.first() + "-" + range.last(), part);
        }
        logger.debug("Split {} pages into {} documents", source.pageCount(), ranges.size());
        return result.build();
    }

    /** Resolves the requested ranges and checks they exist and do not overlap. */
    static List<PageRange> ranges(Parameters params, int pageCount) {
        if (pageCount == 0) {
            throw new PdfForgeException(ErrorKind.INVALID_RANGE, "Document has no pages to split");
        }
        String text = params.text("ranges");
        Integer every = params.optionalInteger("every");
        if (text != null && every != null) {
            throw new PdfForgeException(
                    ErrorKind.INVALID_PARAMETER, "Give either 'ranges' or 'every', not both");
        }
        List<PageRange> ranges = new ArrayList<>();
        if (text != null) {
            ranges.addAll(PageSelection.parseRanges(text));
            for (int i = 0; i < ranges.size(); i++) {
                ranges.get(i).checkWithin(pageCount);
                for (int j = 0; j < i; j++) {
                    if (ranges.get(i).overlaps(ranges.get(j))) {
                        throw new PdfForgeException(
                                ErrorKind.INVALID_RANGE,
                                "Ranges " + ranges.get(j) + " and " + ranges.get(i) + " overlap");
                    }
                }
            }
        } else {
            int size = every != null ? every : 1;
            if (size < 1) {
                throw new PdfForgeException(
                        ErrorKind.INVALID_PARAMETER, "'every' must be positive: " + size);
            }
            for (int first = 1; first <= pageCount; first += size) {
                ranges.add(new PageRange(first, Math.min(pageCount, first + size - 1)));
            }
        }
        return ranges;
    }
}
