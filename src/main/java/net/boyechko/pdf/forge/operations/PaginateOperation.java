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

import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosReference;
import net.boyechko.pdf.forge.document.ContentBuilder;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.document.Page;
import net.boyechko.pdf.forge.document.PageBox;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/**
 * Stamps page numbers. The label comes from a format where {@code {page}} is the page's number
 * and {@code {total}} the number of the last page.
 */
public class PaginateOperation extends AbstractOperation {
    static final double MARGIN = 36;

    public PaginateOperation() {
        super(
                OperationKind.PAGINATE,
                ParameterSchema.of(
                        ParameterSpec.choice(
                                "position",
                                "bottom-right",
                                "top-left",
                                "top-center",
                                "top-right",
                                "bottom-left",
                                "bottom-center",
                                "bottom-right"),
                        ParameterSpec.integer("start", 1),
                        ParameterSpec.text("format", "{page}"),
                        ParameterSpec.decimal("font-size", 10.0),
                        ParameterSpec.pages("pages")));
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        Document document = ctx.document();
        double size = params.decimal("font-size");
        if (size <= 0) {
            throw PdfForgeException.invalidParameter("Font size must be positive: " + size);
        }
        int start = params.integer("start");
        String format = params.text("format");
        String position = params.choice("position");
        String total = String.valueOf(start + document.pageCount() - 1);

        StandardFont font = StandardFont.HELVETICA;
        CosReference fontRef = document.add(font.fontDictionary());
        for (int index : params.pages("pages").indices(document.pageCount())) {
            Page page = document.page(index);
            String label =
                    format.replace("{page}", String.valueOf(start + index))
                            .replace("{total}", total);
            double width = font.width(label, size);
            PageBox box = page.cropBox();
            double x =
                    position.endsWith("left")
                            ? box.llx() + MARGIN
                            : position.endsWith("right")
                                    ? box.urx() - MARGIN - width
                                    : (box.llx() + box.urx() - width) / 2;
            double y = position.startsWith("top") ? box.ury() - MARGIN - size : box.lly() + MARGIN;
            String fontName = page.addResource("Font", "F", fontRef);
            byte[] content =
                    new ContentBuilder()
                            .fillGray(0)
                            .beginText()
                            .font(fontName, size)
                            .textMatrix(1, 0, 0, 1, x, y)
                            .showText(font.encode(label))
                            .endText()
                            .toBytes();
            Layer.OVER.stamp(page, content);
        }
        return OperationResult.of(document);
    }
}
