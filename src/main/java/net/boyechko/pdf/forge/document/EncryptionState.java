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

/**
 * Standard security handler parameters of an encrypted document.
 *
 * @param algorithm the stream and string cipher
 * @param revision the security handler revision (R)
 * @param ownerHash the /O entry
 * @param userHash the /U entry
 * @param permissions the /P bitmask
 * @param fileId the first element of the trailer /ID, used for key derivation
 * @param encryptMetadata whether metadata streams are encrypted
 * @param ownerKey the /OE entry (AES-256 only, else null)
 * @param userKey the /UE entry (AES-256 only, else null)
 * @param encryptedPermissions the /Perms entry (AES-256 only, else null)
 * @param fileKey the derived file key, or null while the document is sealed
 */
public record EncryptionState(
        Algorithm algorithm,
        int revision,
        byte[] ownerHash,
        byte[] userHash,
        int permissions,
        byte[] fileId,
        boolean encryptMetadata,
        byte[] ownerKey,
        byte[] userKey,
        byte[] encryptedPermissions,
        byte[] fileKey) {

    /** Bits 7-8 and 13-32 of /P must be set; bits 1-2 must be clear. */
    public static final int RESERVED_PERMISSION_BITS = 0xFFFFF0C0;

    public static final int ALLOW_PRINT = 1 << 2;
    public static final int ALLOW_MODIFY = 1 << 3;
    public static final int ALLOW_COPY = 1 << 4;
    public static final int ALLOW_ANNOTATE = 1 << 5;
    public static final int ALLOW_FILL_FORMS = 1 << 8;
    public static final int ALLOW_ACCESSIBILITY = 1 << 9;
    public static final int ALLOW_ASSEMBLE = 1 << 10;
    public static final int ALLOW_PRINT_HIGH = 1 << 11;

    public enum Algorithm {
        RC4_40(1, 5),
        RC4_128(2, 16),
        AES_128(4, 16),
        AES_256(5, 32);

        private final int version;
        private final int keyLength;

        Algorithm(int version, int keyLength) {
            this.version = version;
            this.keyLength = keyLength;
        }

        /** The /V entry of the encryption dictionary. */
        public int version() {
            return version;
        }

        /** File key length in bytes. */
        public int keyLength() {
            return keyLength;
        }

        public boolean isAes() {
            return this == AES_128 || this == AES_256;
        }
    }

    public boolean isAuthenticated() {
        return fileKey != null;
    }

    public boolean allows(int permission) {
        return (permissions & permission) != 0;
    }

    public EncryptionState withFileKey(byte[] key) {
        return new EncryptionState(
                algorithm,
                revision,
                ownerHash,
                userHash,
                permissions,
                fileId,
                encryptMetadata,
                ownerKey,
                userKey,
                encryptedPermissions,
                key);
    }

    /** Builds a /P value from individual grants. */
    public static int permissionsOf(boolean print, boolean modify, boolean copy, boolean annotate) {
        int p = RESERVED_PERMISSION_BITS | ALLOW_ACCESSIBILITY;
        if (print) {
            p |= ALLOW_PRINT | ALLOW_PRINT_HIGH;
        }
        if (modify) {
            p |= ALLOW_MODIFY | ALLOW_ASSEMBLE;
        }
        if (copy) {
            p |= ALLOW_COPY;
        }
        if (annotate) {
            p |= ALLOW_ANNOTATE | ALLOW_FILL_FORMS;
        }
        return p;
    }
}
