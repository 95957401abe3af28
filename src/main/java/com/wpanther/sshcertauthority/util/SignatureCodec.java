package com.wpanther.sshcertauthority.util;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;

import org.apache.sshd.common.util.buffer.ByteArrayBuffer;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.DERSequence;

import com.wpanther.sshcertauthority.exception.DecodingException;
import com.wpanther.sshcertauthority.exception.MalformedSignatureException;
import com.wpanther.sshcertauthority.model.EcdsaSignature;

/**
 * Converts ECDSA signatures between the DER form returned by key management services,
 * the concatenated r || s form used by JWS, and the SSH signature blob (RFC 5656).
 */
public final class SignatureCodec {

    private static final byte[] EMPTY = new byte[0];

    private SignatureCodec() {
    }

    /**
     * Parses a DER encoded ECDSA signature into its raw components
     *
     * @param der The ASN.1 SEQUENCE { INTEGER r, INTEGER s }
     * @param componentWidth The maximum width in bytes of each component for the curve
     * @return The (r, s) pair
     */
    public static EcdsaSignature derToRaw(byte[] der, int componentWidth) {
        if (der == null || der.length == 0) {
            throw new MalformedSignatureException("Signature is empty");
        }

        ASN1Sequence sequence;
        try {
            sequence = ASN1Sequence.getInstance(der);
        } catch (RuntimeException e) {
            throw new MalformedSignatureException("Signature is not a DER sequence: " + e.getMessage(), e);
        }

        if (sequence.size() != 2) {
            throw new MalformedSignatureException(
                "Signature sequence must have 2 components but has " + sequence.size());
        }

        BigInteger r = readComponent(sequence.getObjectAt(0), "r", componentWidth);
        BigInteger s = readComponent(sequence.getObjectAt(1), "s", componentWidth);
        return new EcdsaSignature(r, s);
    }

    private static BigInteger readComponent(ASN1Encodable element, String name, int componentWidth) {
        if (!(element instanceof ASN1Integer)) {
            throw new MalformedSignatureException("Signature component " + name + " is not an INTEGER");
        }
        BigInteger value = ((ASN1Integer) element).getValue();
        if (value.signum() < 0) {
            throw new MalformedSignatureException("Signature component " + name + " is negative");
        }
        if (value.bitLength() > componentWidth * 8) {
            throw new MalformedSignatureException(
                "Signature component " + name + " exceeds " + componentWidth + " bytes");
        }
        return value;
    }

    /**
     * Encodes raw components as a DER ECDSA signature
     */
    public static byte[] rawToDer(BigInteger r, BigInteger s) {
        ASN1EncodableVector vector = new ASN1EncodableVector();
        vector.add(new ASN1Integer(r));
        vector.add(new ASN1Integer(s));
        try {
            return new DERSequence(vector).getEncoded(ASN1Encoding.DER);
        } catch (IOException e) {
            throw new MalformedSignatureException("Failed to DER encode signature: " + e.getMessage(), e);
        }
    }

    /**
     * Splits a fixed width r || s signature (JWS ES256/ES384/ES512 format)
     */
    public static EcdsaSignature concatenatedToRaw(byte[] signature, int componentWidth) {
        if (signature == null || signature.length != componentWidth * 2) {
            throw new MalformedSignatureException("Expected a " + (componentWidth * 2)
                + " byte signature but got " + (signature == null ? 0 : signature.length));
        }
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(signature, 0, componentWidth));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature, componentWidth, signature.length));
        return new EcdsaSignature(r, s);
    }

    /**
     * Builds the SSH signature blob: string signature type, string (mpint r, mpint s)
     *
     * @param signatureType SSH signature type, e.g. ecdsa-sha2-nistp256
     * @return The signature blob stored as the last certificate field
     */
    public static byte[] rawToSignatureBlob(String signatureType, BigInteger r, BigInteger s) {
        ByteArrayBuffer components = new ByteArrayBuffer();
        components.putBytes(encodeMpint(r));
        components.putBytes(encodeMpint(s));

        ByteArrayBuffer blob = new ByteArrayBuffer();
        blob.putString(signatureType);
        blob.putBytes(components.getCompactData());
        return blob.getCompactData();
    }

    /**
     * Reads back the signature type and components of an SSH ECDSA signature blob
     */
    public static ParsedSignature parseSignatureBlob(byte[] blob) {
        try {
            ByteArrayBuffer buffer = new ByteArrayBuffer(blob);
            String signatureType = buffer.getString();
            ByteArrayBuffer components = new ByteArrayBuffer(buffer.getBytes());
            BigInteger r = decodeMpint(components.getBytes());
            BigInteger s = decodeMpint(components.getBytes());
            if (buffer.available() > 0 || components.available() > 0) {
                throw new DecodingException("Trailing bytes after signature blob");
            }
            return new ParsedSignature(signatureType, new EcdsaSignature(r, s));
        } catch (DecodingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DecodingException("Malformed signature blob: " + e.getMessage(), e);
        }
    }

    /**
     * Encodes a non-negative integer as the body of an SSH mpint: minimal big-endian,
     * with one leading zero byte only when the top bit of the first byte is set.
     * Zero encodes as an empty string.
     */
    public static byte[] encodeMpint(BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("mpint value must not be negative");
        }
        if (value.signum() == 0) {
            return EMPTY;
        }
        // toByteArray is minimal two's complement, so the sign byte is present exactly when needed
        return value.toByteArray();
    }

    public static BigInteger decodeMpint(byte[] encoded) {
        if (encoded.length == 0) {
            return BigInteger.ZERO;
        }
        if ((encoded[0] & 0x80) != 0) {
            throw new DecodingException("Negative mpint is not allowed");
        }
        if (encoded[0] == 0 && (encoded.length == 1 || (encoded[1] & 0x80) == 0)) {
            throw new DecodingException("mpint has a redundant leading zero byte");
        }
        return new BigInteger(encoded);
    }

    /**
     * Signature type and components read from an SSH signature blob
     */
    public static final class ParsedSignature {

        private final String signatureType;
        private final EcdsaSignature signature;

        ParsedSignature(String signatureType, EcdsaSignature signature) {
            this.signatureType = signatureType;
            this.signature = signature;
        }

        public String getSignatureType() {
            return signatureType;
        }

        public EcdsaSignature getSignature() {
            return signature;
        }
    }
}
