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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.Map;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.cos.CosArray;
import net.boyechko.pdf.forge.cos.CosBoolean;
import net.boyechko.pdf.forge.cos.CosDictionary;
import net.boyechko.pdf.forge.cos.CosName;
import net.boyechko.pdf.forge.cos.CosNull;
import net.boyechko.pdf.forge.cos.CosNumber;
import net.boyechko.pdf.forge.cos.CosObject;
import net.boyechko.pdf.forge.cos.CosReference;
import net.boyechko.pdf.forge.cos.CosStream;
import net.boyechko.pdf.forge.cos.CosString;
import net.boyechko.pdf.forge.document.EncryptionState;

/**
 * Writes objects in PDF syntax, applying the renumbering chosen by {@link PdfEncoder} and, when
 * the document is encrypted, the per-object string and stream ciphers.
 */
final class CosSerializer {
    static final String BYTE_RANGE_PLACEHOLDER = "[0 0000000000 0000000000 0000000000]";

    private static final HexFormat HEX = HexFormat.of();
    private static final String NAME_DELIMITERS = "()<>[]{}/%#";

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ObjectNumbering numbering;
    private final EncryptionState encryption;
    private final CosDictionary signatureDictionary;
    private final int contentsCapacity;

    private int byteRangeOffset = -1;
    private int contentsOffset = -1;

    /**
     * @param encryption authenticated encryption state, or null to write plaintext
     * @param signatureDictionary dictionary whose signature fields get placeholders, or null
     */
    CosSerializer(
            ObjectNumbering numbering,
            EncryptionState encryption,
            CosDictionary signatureDictionary,
            int contentsCapacity) {
        this.numbering = numbering;
        this.encryption = encryption;
        this.signatureDictionary = signatureDictionary;
        this.contentsCapacity = contentsCapacity;
    }

    int position() {
        return out.size();
    }

    byte[] toByteArray() {
        return out.toByteArray();
    }

    /** Offset of the {@code [} opening the signature's byte range, or -1 if none was written. */
    int byteRangeOffset() {
        return byteRangeOffset;
    }

    /** Offset of the {@code <} opening the signature's contents, or -1 if none was written. */
    int contentsOffset() {
        return contentsOffset;
    }

    void writeAscii(String text) {
        out.writeBytes(text.getBytes(StandardCharsets.US_ASCII));
    }

    void writeBytes(byte[] bytes) {
        out.writeBytes(bytes);
    }

    /** Writes {@code number 0 obj ... endobj}; {@code encrypt} is false for the encryption dict. */
    void writeIndirect(int number, CosObject object, boolean encrypt) {
        int cipherNumber = encrypt && encryption != null ? number : 0;
        writeAscii(number + " 0 obj\n");
        if (object instanceof CosStream stream) {
            writeStream(cipherNumber, stream);
        } else {
            writeDirect(cipherNumber, object);
        }
        writeAscii("\nendobj\n");
    }

    private void writeStream(int cipherNumber, CosStream stream) {
        byte[] payload = stream.encodedData();
        CosDictionary dict = stream.dictionary().shallowCopy();
        if (cipherNumber > 0 && !StandardSecurityHandler.isExemptStream(encryption, dict)) {
            payload = StandardSecurityHandler.encrypt(encryption, cipherNumber, 0, payload);
        }
        dict.putNumber("Length", payload.length);
        writeDirect(cipherNumber, dict);
        writeAscii("\nstream\n");
        out.writeBytes(payload);
        writeAscii("\nendstream");
    }

    /** Writes a direct object. A {@code cipherNumber} of 0 disables encryption. */
    void writeDirect(int cipherNumber, CosObject object) {
        if (object == null || object instanceof CosNull) {
            writeAscii("null");
        } else if (object instanceof CosBoolean bool) {
            writeAscii(bool.value() ? "true" : "false");
        } else if (object instanceof CosNumber number) {
            writeAscii(number.toPdf());
        } else if (object instanceof CosName name) {
            writeName(name.value());
        } else if (object instanceof CosString string) {
            byte[] bytes = string.bytes();
            if (cipherNumber > 0) {
                bytes = StandardSecurityHandler.encrypt(encryption, cipherNumber, 0, bytes);
            }
            writeString(bytes, string.hex());
        } else if (object instanceof CosReference ref) {
            int target = numbering.numberOf(ref);
            writeAscii(target > 0 ? target + " 0 R" : "null");
        } else if (object instanceof CosArray array) {
            writeAscii("[");
            boolean first = true;
            for (CosObject item : array) {
                if (!first) {
                    writeAscii(" ");
                }
                writeDirect(cipherNumber, item);
                first = false;
            }
            writeAscii("]");
        } else if (object instanceof CosDictionary dict) {
            writeDictionary(cipherNumber, dict);
        } else if (object instanceof CosStream stream) {
            writeAscii(numbering.numberOf(stream) + " 0 R");
        } else {
            throw new PdfForgeException(ErrorKind.INTERNAL, "Cannot serialize " + object);
        }
    }

    private void writeDictionary(int cipherNumber, CosDictionary dict) {
        boolean pending = dict == signatureDictionary;
        boolean signature = pending || PdfDecoder.isSignatureDictionary(dict);
        writeAscii("<<");
        for (Map.Entry<String, CosObject> entry : dict.entrySet()) {
            String key = entry.getKey();
            if (pending && (key.equals("ByteRange") || key.equals("Contents"))) {
                continue;
            }
            writeAscii(" ");
            writeName(key);
            writeAscii(" ");
            boolean plain = signature && key.equals("Contents");
            writeDirect(plain ? 0 : cipherNumber, entry.getValue());
        }
        if (pending) {
            writeAscii(" /ByteRange ");
            byteRangeOffset = out.size();
            writeAscii(BYTE_RANGE_PLACEHOLDER);
            writeAscii(" /Contents ");
            contentsOffset = out.size();
            writeAscii("<" + "0".repeat(contentsCapacity * 2) + ">");
        }
        writeAscii(" >>");
    }

    private void writeName(String value) {
        StringBuilder sb = new StringBuilder("/");
        for (byte b : nameBytes(value)) {
            int c = b & 0xFF;
            if (c < 0x21 || c > 0x7E || NAME_DELIMITERS.indexOf(c) >= 0) {
                sb.append('#').append(HEX.toHexDigits((byte) c));
            } else {
                sb.append((char) c);
            }
        }
        writeAscii(sb.toString());
    }

    private static byte[] nameBytes(String value) {
        boolean latin1 = value.chars().allMatch(c -> c <= 0xFF);
        return value.getBytes(latin1 ? StandardCharsets.ISO_8859_1 : StandardCharsets.UTF_8);
    }

    private void writeString(byte[] bytes, boolean hex) {
        if (hex) {
            writeAscii("<" + HEX.formatHex(bytes) + ">");
            return;
        }
        out.write('(');
        for (byte b : bytes) {
            switch (b) {
                case '(', ')', '\\' -> {
                    out.write('\\');
                    out.write(b);
                }
                case '\r' -> writeAscii("\\r");
                case '\n' -> writeAscii("\\n");
                default -> out.write(b);
            }
        }
        out.write(')');
    }
}
