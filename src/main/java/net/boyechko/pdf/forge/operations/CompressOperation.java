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

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.zip.Deflater;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.core.Quality;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosName;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosStream;
import net.boyechko.pdf.forge.cos.filter.FlateFilter;
import net.boyechko.pdf.forge.document.Document;
import net.boyechko.pdf.forge.operation.AbstractOperation;
import net.boyechko.pdf.forge.operation.OperationContext;
import net.boyechko.pdf.forge.operation.OperationKind;
import net.boyechko.pdf.forge.operation.OperationResult;
import net.boyechko.pdf.forge.operation.ParameterSchema;
import net.boyechko.pdf.forge.operation.ParameterSpec;
import net.boyechko.pdf.forge.operation.Parameters;

/**
 * Shrinks a document by downsampling and re-encoding its images as JPEG at the chosen quality,
 * and by recompressing other streams at the best Flate level. A stream is only replaced when the
 * new encoding is smaller.
 */
public class CompressOperation extends AbstractOperation {

    public CompressOperation() {
        super(
                OperationKind.COMPRESS,
                ParameterSchema.of(
                        ParameterSpec.choice("quality", null, "high", "medium", "low", "minimum")
                                .withSettingsDefault(s -> s.defaultQuality().id())));
    }

    private record Recompressed(CosStream stream, byte[] jpeg, int width, int height) {}

    @Override
    protected OperationResult perform(OperationContext ctx, Parameters params) {
        Document document = ctx.document();
        Quality quality = Quality.fromId(params.choice("quality"));
        OperationResult.Builder result = OperationResult.builder();

        List<ImageResources.ImageRef> images = ImageResources.collect(document);
        int replacedImages = 0;
        for (Recompressed r : recompressImages(document, images, quality, ctx, result)) {
            CosDictionary dict = r.stream().dictionary();
            r.stream().setEncodedData(r.jpeg(), CosName.of("DCTDecode"), null);
            dict.putNumber("Width", r.width());
            dict.putNumber("Height", r.height());
            dict.putNumber("BitsPerComponent", 8);
            dict.remove("Decode");
            replacedImages++;
        }
        int deflated = recompressStreams(document);
        logger.debug(
                "Compressed at {}: {} of {} images re-encoded, {} streams re-deflated",
                quality.id(),
                replacedImages,
                images.size(),
                deflated);
        return result.withDocument(document).build();
    }

    /** Re-encodes images in parallel; results are applied to the document by the caller. */
    private List<Recompressed> recompressImages(
            Document document,
            List<ImageResources.ImageRef> images,
            Quality quality,
            OperationContext ctx,
            OperationResult.Builder result) {
        List<Recompressed> done = new ArrayList<>();
        if (images.isEmpty()) {
            return done;
        }
        int workers = Math.min(images.size(), ctx.settings().effectiveWorkers());
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<Recompressed>> futures = new ArrayList<>();
            for (ImageResources.ImageRef image : images) {
                futures.add(pool.submit(() -> recompress(document, image.stream(), quality)));
            }
            for (int i = 0; i < futures.size(); i++) {
                ImageResources.ImageRef image = images.get(i);
                try {
                    Recompressed r = futures.get(i).get();
                    if (r != null) {
                        done.add(r);
                    }
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof PdfForgeException pfe
                            && pfe.kind() == ErrorKind.UNSUPPORTED_IMAGE_FORMAT) {
                        result.withWarning(
                                "Image "
                                        + image.name()
                                        + " on page "
                                        + (image.pageIndex() + 1)
                                        + " kept as is: "
                                        + pfe.getMessage());
                    } else if (e.getCause() instanceof RuntimeException re) {
                        throw re;
                    } else {
                        throw new PdfForgeException(
                                ErrorKind.INTERNAL, "Image recompression failed", e.getCause());
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PdfForgeException(ErrorKind.INTERNAL, "Interrupted while compressing", e);
        } finally {
            pool.shutdownNow();
        }
        return done;
    }

    private static Recompressed recompress(Document document, CosStream stream, Quality quality) {
        CosDictionary dict = stream.dictionary();
        if (dict.containsKey("SMask") || dict.containsKey("Mask")) {
            throw RasterImages.unsupported("masked image");
        }
        BufferedImage image = RasterImages.read(document, stream);
        BufferedImage scaled = RasterImages.scale(image, quality.factor());
        byte[] jpeg = RasterImages.jpeg(scaled, quality.factor());
        if (jpeg.length >= stream.encodedLength()) {
            return null;
        }
        return new Recompressed(stream, jpeg, scaled.getWidth(), scaled.getHeight());
    }

    private int recompressStreams(Document document) {
        int count = 0;
        for (int number : document.objectNumbers()) {
            CosObject object = document.get(number);
            if (!(object instanceof CosStream stream) || !isPlainStream(stream)) {
                continue;
            }
            byte[] data;
            try {
                data = stream.decodedData();
            } catch (PdfForgeException e) {
                logger.debug("Leaving object {} alone: {}", number, e.getMessage());
                continue;
            }
            byte[] deflated = FlateFilter.deflate(data, Deflater.BEST_COMPRESSION);
            if (deflated.length < stream.encodedLength()) {
                stream.setEncodedData(deflated, CosName.of("FlateDecode"), null);
                stream.dictionary().remove("DL");
                count++;
            }
        }
        return count;
    }

    private static boolean isPlainStream(CosStream stream) {
        CosDictionary dict = stream.dictionary();
        if (dict.isType("Metadata") || dict.isType("XRef") || stream.hasImageCodec()) {
            return false;
        }
        return !dict.getName("Subtype").orElse("").equals("Image");
    }
}
