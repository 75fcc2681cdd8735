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
package net.boyechko.pdf.forge.operation;

import java.time.ZonedDateTime;

/** Outcome of checking a document's signatures. */
public sealed interface VerificationResult {

    /**
     * Every signature checked out.
     *
     * @param signer subject of the signing certificate
     * @param signingTime claimed signing time, or null if the signature carries none
     * @param signatureCount number of signatures checked
     */
    record Valid(String signer, ZonedDateTime signingTime, int signatureCount)
            implements VerificationResult {}

    record Invalid(String reason) implements VerificationResult {}

    record NoSignature() implements VerificationResult {}

    static VerificationResult valid(String signer, ZonedDateTime signingTime, int count) {
        return new Valid(signer, signingTime, count);
    }

    static VerificationResult invalid(String reason) {
        return new Invalid(reason);
    }

    static VerificationResult noSignature() {
        return new NoSignature();
    }

    default boolean isValid() {
        return this instanceof Valid;
    }

    /** One-line description for reports. */
    default String describe() {
        if (this instanceof Valid valid) {
            return "valid, signed by " + valid.signer()
                    + (valid.signingTime() != null ? " at " + valid.signingTime() : "");
        }
        if (this instanceof Invalid invalid) {
            return "invalid: " + invalid.reason();
        }
        return "no signature";
    }
}
