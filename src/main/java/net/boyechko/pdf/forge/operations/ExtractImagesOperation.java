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

import java.util.List;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosStream;
import net.boyechko.pdf.forge.cos.filter.Filters;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.Parameters;

/**
 * Saves each distinct image once. JPEG data is written as-is; raw 8-bit gray and RGB samples are
 * converted to PNG. Other encodings are skipped with a warning.
 */
public class ExtractImagesOperation extends AbstractOperation {

    public ExtractImagesOperation() {
        super(OperationKind.EXTRACT_IMAGES, ParameterSchema.empty());
    }

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        Document document = ctx.document();
        List<ImageResources.ImageRef> images = ImageResources.collect(document);
        OperationResult.Builder result = OperationResult.builder();
        int saved = 0;
        for (ImageResources.ImageRef image : images) {
            String label = "page_" + (image.pageIndex() + 1) + "_img_" + image.name();
            try {
                CosStream stream = image.stream();
                if (RasterImages.isJpeg(RasterImages.codec(stream))) {
                    Filters.Decoded decoded = stream.decodeGeneralFilters();
                    result.withArtifact(label, "jpg", decoded.data());
                } else {
                    byte[] png = RasterImages.png(RasterImages.read(document, stream));
                    result.withArtifact(label, "png", png);
                }
                saved++;
            } catch (PdfForgeException e) {
                if (e.kind() != ErrorKind.UNSUPPORTED_IMAGE_FORMAT
                        && e.kind() != ErrorKind.MALFORMED_DOCUMENT) {
                    throw e;
                }
                result.withWarning(label + " skipped: " + e.getMessage());
            }
        }
        if (images.isEmpty()) {
            result.withWarning(ctx.single().name() + " contains no images");
        }
        logger.debug("Extracted {} of {} images", saved, images.size());
        return result.build();
    }
}
