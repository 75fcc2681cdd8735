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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;
import net.boyechko.pdf.forge.core.ErrorKind;
import net.boyechko.pdf.forge.core.PdfForgeException;
import net.boyechko.pdf.forge.operation.VerificationResult;
import org.bouncycastle.asn1.ASN1InputStream;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.cms.Attribute;
import org.bouncycastle.asn1.cms.AttributeTable;
import org.bouncycastle.asn1.cms.CMSAttributes;
import org.bouncycastle.asn1.cms.Time;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaCertStore;
import org.bouncycastle.cms.CMSException;
import org.bouncycastle.cms.CMSProcessableByteArray;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.cms.CMSSignedDataGenerator;
import org.bouncycastle.cms.SignerInformation;
import org.bouncycastle.cms.jcajce.JcaSignerInfoGeneratorBuilder;
import org.bouncycastle.cms.jcajce.JcaSimpleSignerInfoVerifierBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.operator.jcajce.JcaDigestCalculatorProviderBuilder;
import org.bouncycastle.util.Store;

/** Detached CMS (PKCS#7) signatures through Bouncy Castle. */
final class CmsSignatures {
    private CmsSignatures() {}

    /** Signs {@code content} and returns the DER-encoded detached SignedData. */
    static byte[] sign(byte[] content, SigningKey key) {
        try {
            ContentSigner contentSigner =
                    new JcaContentSignerBuilder(signatureAlgorithm(key)).build(key.privateKey());
            CMSSignedDataGenerator generator = new CMSSignedDataGenerator();
            generator.addSignerInfoGenerator(
                    new JcaSignerInfoGeneratorBuilder(
                                    new JcaDigestCalculatorProviderBuilder().build())
                            .build(contentSigner, key.certificate()));
            generator.addCertificates(new JcaCertStore(key.chain()));
            CMSSignedData signed = generator.generate(new CMSProcessableByteArray(content), false);
            return signed.getEncoded();
        } catch (OperatorCreationException
                | CertificateEncodingException
                | CMSException
                | IOException e) {
            throw new PdfForgeException(
                    ErrorKind.SIGNATURE_FAILURE, "Cannot create signature: " + e.getMessage(), e);
        }
    }

    private static String signatureAlgorithm(SigningKey key) {
        String algorithm = key.privateKey().getAlgorithm();
        return switch (algorithm) {
            case "RSA" -> "SHA256withRSA";
            case "EC", "ECDSA" -> "SHA256withECDSA";
            default -> throw new PdfForgeException(
                    ErrorKind.SIGNATURE_FAILURE, "Unsupported key algorithm: " + algorithm);
        };
    }

    /**
     * Checks a detached SignedData over {@code content}. Zero padding after the DER structure, as
     * left in a signature dictionary's /Contents, is ignored.
     */
    static VerificationResult verify(byte[] container, byte[] content, int signatureCount) {
        CMSSignedData signed;
        try {
            signed = new CMSSignedData(new CMSProcessableByteArray(content), trimDer(container));
        } catch (CMSException | IOException | IllegalArgumentException e) {
            return VerificationResult.invalid("unreadable signature container");
        }
        Store<X509CertificateHolder> certificates = signed.getCertificates();
        String signer = null;
        ZonedDateTime signingTime = null;
        for (SignerInformation info : signed.getSignerInfos().getSigners()) {
            @SuppressWarnings("unchecked")
            Collection<X509CertificateHolder> matches = certificates.getMatches(info.getSID());
            if (matches.isEmpty()) {
                return VerificationResult.invalid("signer certificate is missing");
            }
            X509CertificateHolder certificate = matches.iterator().next();
            try {
                if (!info.verify(new JcaSimpleSignerInfoVerifierBuilder().build(certificate))) {
                    return VerificationResult.invalid("signature does not match the content");
                }
            } catch (CMSException e) {
                return VerificationResult.invalid("signature does not match the content");
            } catch (OperatorCreationException | CertificateException e) {
                return VerificationResult.invalid("cannot check signature: " + e.getMessage());
            }
            signer = commonName(certificate.getSubject());
            signingTime = signingTime(info);
        }
        if (signer == null) {
            return VerificationResult.invalid("signature container has no signers");
        }
        return VerificationResult.valid(signer, signingTime, signatureCount);
    }

    private static byte[] trimDer(byte[] container) throws IOException {
        try (ASN1InputStream in = new ASN1InputStream(new ByteArrayInputStream(container))) {
            ASN1Primitive primitive = in.readObject();
            if (primitive == null) {
                throw new IOException("empty signature container");
            }
            return primitive.getEncoded();
        }
    }

    static String commonName(X509Certificate certificate) {
        return commonName(X500Name.getInstance(certificate.getSubjectX500Principal().getEncoded()));
    }

    static String commonName(X500Name name) {
        RDN[] rdns = name.getRDNs(BCStyle.CN);
        if (rdns.length == 0) {
            return name.toString();
        }
        return IETFUtils.valueToString(rdns[0].getFirst().getValue());
    }

    private static ZonedDateTime signingTime(SignerInformation info) {
        AttributeTable attributes = info.getSignedAttributes();
        if (attributes == null) {
            return null;
        }
        Attribute attribute = attributes.get(CMSAttributes.signingTime);
        if (attribute == null || attribute.getAttrValues().size() == 0) {
            return null;
        }
        Time time = Time.getInstance(attribute.getAttrValues().getObjectAt(0));
        return ZonedDateTime.ofInstant(time.getDate().toInstant(), ZoneId.systemDefault());
    }
}
