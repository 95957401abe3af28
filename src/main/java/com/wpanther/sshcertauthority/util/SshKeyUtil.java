package com.wpanther.sshcertauthority.util;

import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Base64;

import org.apache.sshd.common.util.buffer.Buffer;
import org.apache.sshd.common.util.buffer.ByteArrayBuffer;

import com.wpanther.sshcertauthority.exception.DecodingException;
import com.wpanther.sshcertauthority.model.EcdsaCurve;
import com.wpanther.sshcertauthority.model.SshPublicKey;

/**
 * Helpers for SSH public keys in wire format and in OpenSSH one-line text form
 */
public final class SshKeyUtil {

    private static final int ED25519_KEY_LENGTH = 32;

    private SshKeyUtil() {
    }

    /**
     * Parses and structurally validates an SSH public key blob
     *
     * @param blob string key type followed by the type specific fields
     * @return The subject key
     * @throws DecodingException if the blob is truncated, has trailing bytes or an unsupported type
     */
    public static SshPublicKey parsePublicKey(byte[] blob) {
        if (blob == null || blob.length == 0) {
            throw new DecodingException("Public key blob is empty");
        }
        try {
            ByteArrayBuffer buffer = new ByteArrayBuffer(blob);
            String keyType = buffer.getString();
            byte[] parts = readPublicKeyFields(buffer, keyType);
            if (buffer.available() > 0) {
                throw new DecodingException("Trailing bytes after " + keyType + " public key");
            }
            return toPublicKey(keyType, parts);
        } catch (DecodingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DecodingException("Malformed public key blob: " + e.getMessage(), e);
        }
    }

    /**
     * Reads the fields of a public key of the given type from the current buffer position
     * and returns them exactly as they appear on the wire.
     */
    public static byte[] readPublicKeyFields(Buffer buffer, String keyType) {
        int start = buffer.rpos();
        if (SshPublicKey.SSH_RSA.equals(keyType)) {
            requirePositive(buffer.getMPIntAsBytes(), "RSA exponent");
            requirePositive(buffer.getMPIntAsBytes(), "RSA modulus");
        } else if (SshPublicKey.SSH_DSS.equals(keyType)) {
            requirePositive(buffer.getMPIntAsBytes(), "DSA p");
            requirePositive(buffer.getMPIntAsBytes(), "DSA q");
            requirePositive(buffer.getMPIntAsBytes(), "DSA g");
            requirePositive(buffer.getMPIntAsBytes(), "DSA y");
        } else if (SshPublicKey.SSH_ED25519.equals(keyType)) {
            byte[] key = buffer.getBytes();
            if (key.length != ED25519_KEY_LENGTH) {
                throw new DecodingException("Ed25519 key must be 32 bytes but is " + key.length);
            }
        } else if (EcdsaCurve.isEcdsaKeyType(keyType)) {
            EcdsaCurve curve = EcdsaCurve.fromKeyType(keyType);
            String curveName = buffer.getString();
            if (!curve.getSshName().equals(curveName)) {
                throw new DecodingException("Curve " + curveName + " does not match key type " + keyType);
            }
            byte[] point = buffer.getBytes();
            if (point.length != 1 + 2 * curve.getComponentWidth() || point[0] != 0x04) {
                throw new DecodingException("Invalid uncompressed point for " + curveName);
            }
        } else {
            throw new DecodingException("Unsupported public key type: " + keyType);
        }
        return Arrays.copyOfRange(buffer.array(), start, buffer.rpos());
    }

    private static void requirePositive(byte[] mpint, String name) {
        SignatureCodec.decodeMpint(mpint);
        if (mpint.length == 0) {
            throw new DecodingException(name + " must not be zero");
        }
    }

    /**
     * Rebuilds a subject key from its type and the raw fields following the type string
     */
    public static SshPublicKey toPublicKey(String keyType, byte[] publicParts) {
        ByteArrayBuffer buffer = new ByteArrayBuffer();
        buffer.putString(keyType);
        buffer.putRawBytes(publicParts);
        return new SshPublicKey(keyType, buffer.getCompactData());
    }

    /**
     * Encodes an EC public key as an ecdsa-sha2-* SSH public key blob
     */
    public static byte[] encodePublicKey(PublicKey publicKey) {
        ByteArrayBuffer buffer = new ByteArrayBuffer();
        buffer.putRawPublicKey(publicKey);
        return buffer.getCompactData();
    }

    public static EcdsaCurve curveOf(ECPublicKey publicKey) {
        return EcdsaCurve.fromFieldSize(publicKey.getParams().getCurve().getField().getFieldSize());
    }

    /**
     * Accepts either a base64 key blob or an OpenSSH public key line
     * ({@code <type> <base64> [comment]}) and returns the key blob.
     */
    public static byte[] decodePublicKeyText(String text) {
        if (text == null || text.isBlank()) {
            throw new DecodingException("Public key is empty");
        }
        String[] tokens = text.trim().split("\\s+");
        String encoded = tokens.length == 1 ? tokens[0] : tokens[1];

        byte[] blob;
        try {
            blob = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new DecodingException("Public key is not valid base64", e);
        }

        if (tokens.length > 1) {
            String declaredType = tokens[0];
            String actualType = parsePublicKey(blob).getKeyType();
            if (!declaredType.equals(actualType)) {
                throw new DecodingException(
                    "Key type " + declaredType + " does not match encoded type " + actualType);
            }
        }
        return blob;
    }

    /**
     * Renders {@code <type> <base64> <comment>} as used in authorized_keys and *-cert.pub files.
     * The comment defaults to the current date and time.
     */
    public static String toOpenSshLine(String keyType, byte[] blob, String comment) {
        return toOpenSshLine(keyType, blob, comment, Clock.systemDefaultZone());
    }

    /**
     * Same as {@link #toOpenSshLine(String, byte[], String)}, reading the default comment from {@code clock}
     */
    public static String toOpenSshLine(String keyType, byte[] blob, String comment, Clock clock) {
        String effectiveComment = (comment == null || comment.isBlank())
            ? LocalDateTime.now(clock).toString()
            : comment;
        return keyType + " " + Base64.getEncoder().encodeToString(blob) + " " + effectiveComment;
    }
}
