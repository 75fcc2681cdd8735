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
package net.boyechko.pdf.forge.ocr;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Word-level recognition through Tess4J. Language data is looked up in {@code TESSDATA_PREFIX}, or
 * in {@code ./tessdata}. A missing data file or native library is reported as OCR_UNAVAILABLE.
 */
public class TesseractRecognizer implements TextRecognizer {
    private static final Logger logger = LoggerFactory.getLogger(TesseractRecognizer.class);

    private final Path dataPath;

    public TesseractRecognizer() {
        this(defaultDataPath());
    }

    public TesseractRecognizer(Path dataPath) {
        this.dataPath = dataPath;
    }

    static Path defaultDataPath() {
        String prefix = System.getenv("TESSDATA_PREFIX");
        return prefix != null && !prefix.isBlank() ? Path.of(prefix) : Path.of("tessdata");
    }

    @Override
    public List<RecognizedSpan> recognize(BufferedImage image, String language, int dpi) {
        checkLanguageData(language);
        List<Word> words;
        try {
            // Tesseract instances are not thread-safe; one per call.
            Tesseract tesseract = new Tesseract();
            tesseract.setDatapath(dataPath.toString());
            tesseract.setLanguage(language);
            tesseract.setVariable("user_defined_dpi", String.valueOf(dpi));
            words = tesseract.getWords(image, ITessAPI.TessPageIteratorLevel.RIL_WORD);
        } catch (LinkageError e) {
            throw new PdfForgeException(
                    ErrorKind.OCR_UNAVAILABLE, "Tesseract native library not available", e);
        }
        List<RecognizedSpan> spans = new ArrayList<>(words.size());
        for (Word word : words) {
            String text = word.getText() == null ? "" : word.getText().strip();
            if (text.isEmpty() || word.getBoundingBox() == null) {
                continue;
            }
            spans.add(
                    new RecognizedSpan(
                            text,
                            word.getBoundingBox().x,
                            word.getBoundingBox().y,
                            word.getBoundingBox().width,
                            word.getBoundingBox().height,
                            word.getConfidence()));
        }
        logger.debug("Tesseract ({}) found {} words", language, spans.size());
        return spans;
    }

    private void checkLanguageData(String language) {
        for (String code : language.split("\\+")) {
            Path data = dataPath.resolve(code + ".traineddata");
            if (!Files.isRegularFile(data)) {
                throw new PdfForgeException(
                        ErrorKind.OCR_UNAVAILABLE, "No Tesseract language data at " + data);
            }
        }
    }
}
