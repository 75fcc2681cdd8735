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

import net.boyechko.pdf.forge.cos.CosDictionary;

/**
 * A signature to be embedded when the document is next serialized. The signature dictionary is
 * already part of the object graph; its {@code /ByteRange} and {@code /Contents} are laid out as
 * fixed-width placeholders and filled in place once the final bytes are known.
 *
 * @param signatureDictionary the {@code /Type /Sig} dictionary (identity matters)
 * @param signer produces the signature container over the signed byte ranges
 * @param contentsCapacity maximum size in bytes of the signature container
 */
public record PendingSignature(
        CosDictionary signatureDictionary, ContentSigner signer, int contentsCapacity) {

    public static final int DEFAULT_CAPACITY = 16 * 1024;

    /** Produces a detached signature container over the concatenated signed byte ranges. */
    @FunctionalInterface
    public interface ContentSigner {
        byte[] sign(byte[] signedContent) throws Exception;
    }
}
