package com.wpanther.sshcertauthority.util;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.apache.sshd.common.util.buffer.ByteArrayBuffer;

import com.wpanther.sshcertauthority.exception.DecodingException;
import com.wpanther.sshcertauthority.exception.EncodingException;
import com.wpanther.sshcertauthority.exception.ValidationException;
import com.wpanther.sshcertauthority.model.CertificateLimits;
import com.wpanther.sshcertauthority.model.CertificateType;
import com.wpanther.sshcertauthority.model.SshCertificate;
import com.wpanther.sshcertauthority.model.SshPublicKey;

/**
 * Byte-exact OpenSSH certificate encoding as described in PROTOCOL.certkeys:
 *
 * <pre>
 * string    key type (e.g. ecdsa-sha2-nistp256-cert-v01@openssh.com)
 * string    nonce
 * ...       subject public key fields
 * uint64    serial
 * uint32    type
 * string    key id
 * string    valid principals
 * uint64    valid after
 * uint64    valid before
 * string    critical options
 * string    extensions
 * string    reserved
 * string    signature key
 * string    signature
 * </pre>
 */
public final class SshCertificateCodec {

    private SshCertificateCodec() {
    }

    /**
     * Encodes a signed certificate
     *
     * @throws EncodingException if a field is unset, the certificate is unsigned or a limit is exceeded
     */
    public static byte[] encode(SshCertificate certificate) {
        if (certificate.getSignature() == null) {
            throw new EncodingException("Certificate is not signed");
        }
        ByteArrayBuffer buffer = writeToBeSigned(certificate);
        buffer.putBytes(certificate.getSignature());
        return buffer.getCompactData();
    }

    /**
     * Encodes every field up to, but excluding, the signature. This is the message the CA signs.
     */
    public static byte[] toBeSignedBytes(SshCertificate certificate) {
        return writeToBeSigned(certificate).getCompactData();
    }

    /**
     * Renders {@code <cert key type> <base64> <comment>} as written to *-cert.pub files
     *
     * @param comment Optional comment, defaulting to the current date and time
     */
    public static String certificateLine(SshCertificate certificate, String comment) {
        return certificateLine(certificate, comment, Clock.systemDefaultZone());
    }

    public static String certificateLine(SshCertificate certificate, String comment, Clock clock) {
        return SshKeyUtil.toOpenSshLine(certificate.getCertificateKeyType(), encode(certificate), comment, clock);
    }

    private static ByteArrayBuffer writeToBeSigned(SshCertificate certificate) {
        checkEncodable(certificate);

        ByteArrayBuffer buffer = new ByteArrayBuffer();
        buffer.putString(certificate.getCertificateKeyType());
        buffer.putBytes(certificate.getNonce());
        buffer.putRawBytes(certificate.getPublicKey().publicParts());
        buffer.putLong(certificate.getSerial());
        buffer.putInt(certificate.getType().getCode());
        buffer.putString(certificate.getKeyId());
        buffer.putBytes(encodePrincipals(certificate.getPrincipals()));
        buffer.putLong(certificate.getValidAfter());
        buffer.putLong(certificate.getValidBefore());
        buffer.putBytes(encodeOptions(certificate.getCriticalOptions()));
        buffer.putBytes(encodeOptions(certificate.getExtensions()));
        buffer.putBytes(certificate.getReserved());
        buffer.putBytes(certificate.getSignatureKey());
        return buffer;
    }

    private static byte[] encodePrincipals(List<String> principals) {
        ByteArrayBuffer buffer = new ByteArrayBuffer();
        for (String principal : principals) {
            buffer.putString(principal);
        }
        return buffer.getCompactData();
    }

    // Each entry is "string name, string data" where a non-empty value is itself wrapped in a string
    private static byte[] encodeOptions(SortedMap<String, String> options) {
        ByteArrayBuffer buffer = new ByteArrayBuffer();
        for (Map.Entry<String, String> option : new TreeMap<>(options).entrySet()) {
            buffer.putString(option.getKey());
            String value = option.getValue();
            if (value == null || value.isEmpty()) {
                buffer.putString("");
            } else {
                ByteArrayBuffer data = new ByteArrayBuffer();
                data.putString(value);
                buffer.putBytes(data.getCompactData());
            }
        }
        return buffer.getCompactData();
    }

    private static void checkEncodable(SshCertificate certificate) {
        requireSet(certificate.getNonce(), "nonce");
        requireSet(certificate.getPublicKey(), "public key");
        requireSet(certificate.getType(), "type");
        requireSet(certificate.getKeyId(), "key id");
        requireSet(certificate.getPrincipals(), "principals");
        requireSet(certificate.getCriticalOptions(), "critical options");
        requireSet(certificate.getExtensions(), "extensions");
        requireSet(certificate.getReserved(), "reserved");
        requireSet(certificate.getSignatureKey(), "signature key");

        try {
            checkLimits(certificate.getKeyId(), certificate.getPrincipals(),
                certificate.getCriticalOptions(), certificate.getExtensions());
            checkValidity(certificate.getValidAfter(), certificate.getValidBefore());
        } catch (ValidationException e) {
            throw new EncodingException(e.getMessage(), e);
        }
    }

    private static void requireSet(Object field, String name) {
        if (field == null) {
            throw new EncodingException("Certificate field '" + name + "' is not set");
        }
    }

    /**
     * Checks principal, key id and option limits
     *
     * @throws ValidationException if any field exceeds its limit
     */
    public static void checkLimits(String keyId, List<String> principals,
            Map<String, String> criticalOptions, Map<String, String> extensions) {
        if (utf8Length(keyId) > CertificateLimits.MAX_KEY_ID_LENGTH) {
            throw new ValidationException("Key id exceeds " + CertificateLimits.MAX_KEY_ID_LENGTH + " bytes");
        }
        if (principals.size() > CertificateLimits.MAX_PRINCIPALS) {
            throw new ValidationException("Too many principals: " + principals.size()
                + " (max " + CertificateLimits.MAX_PRINCIPALS + ")");
        }
        for (String principal : principals) {
            if (principal == null || principal.isBlank()) {
                throw new ValidationException("Principals must not be blank");
            }
            if (utf8Length(principal) > CertificateLimits.MAX_PRINCIPAL_LENGTH) {
                throw new ValidationException("Principal exceeds "
                    + CertificateLimits.MAX_PRINCIPAL_LENGTH + " bytes: " + principal);
            }
        }
        checkOptionLimits(criticalOptions, "critical option");
        checkOptionLimits(extensions, "extension");
    }

    private static void checkOptionLimits(Map<String, String> options, String kind) {
        for (Map.Entry<String, String> option : options.entrySet()) {
            String name = option.getKey();
            if (name == null || name.isEmpty()) {
                throw new ValidationException("Empty " + kind + " name");
            }
            if (utf8Length(name) > CertificateLimits.MAX_OPTION_NAME_LENGTH) {
                throw new ValidationException(kind + " name exceeds "
                    + CertificateLimits.MAX_OPTION_NAME_LENGTH + " bytes: " + name);
            }
            if (option.getValue() != null && utf8Length(option.getValue()) > CertificateLimits.MAX_OPTION_VALUE_LENGTH) {
                throw new ValidationException(kind + " value exceeds "
                    + CertificateLimits.MAX_OPTION_VALUE_LENGTH + " bytes: " + name);
            }
        }
    }

    /**
     * Valid-after must be strictly before valid-before (both unsigned 64-bit)
     *
     * @throws ValidationException if the window is empty or inverted
     */
    public static void checkValidity(long validAfter, long validBefore) {
        boolean unbounded = validAfter == SshCertificate.MIN_EPOCH && validBefore == SshCertificate.INFINITY;
        if (!unbounded && Long.compareUnsigned(validAfter, validBefore) >= 0) {
            throw new ValidationException("Valid-after (" + Long.toUnsignedString(validAfter)
                + ") must be before valid-before (" + Long.toUnsignedString(validBefore) + ")");
        }
    }

    private static int utf8Length(String value) {
        return value.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Parses an encoded certificate
     *
     * @throws DecodingException on truncated input, unknown type, malformed fields or trailing bytes
     */
    public static SshCertificate parse(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            throw new DecodingException("Certificate is empty");
        }
        try {
            ByteArrayBuffer buffer = new ByteArrayBuffer(encoded);

            String certKeyType = buffer.getString();
            if (!certKeyType.endsWith(SshCertificate.CERT_SUFFIX)) {
                throw new DecodingException("Not a certificate key type: " + certKeyType);
            }
            String keyType = certKeyType.substring(0, certKeyType.length() - SshCertificate.CERT_SUFFIX.length());

            byte[] nonce = buffer.getBytes();
            SshPublicKey publicKey = SshKeyUtil.toPublicKey(keyType, SshKeyUtil.readPublicKeyFields(buffer, keyType));
            long serial = buffer.getLong();
            CertificateType type = CertificateType.fromCode(buffer.getUInt());
            String keyId = buffer.getString();
            List<String> principals = decodePrincipals(buffer.getBytes());
            long validAfter = buffer.getLong();
            long validBefore = buffer.getLong();
            SortedMap<String, String> criticalOptions = decodeOptions(buffer.getBytes());
            SortedMap<String, String> extensions = decodeOptions(buffer.getBytes());
            byte[] reserved = buffer.getBytes();
            byte[] signatureKey = buffer.getBytes();
            byte[] signature = buffer.getBytes();

            if (buffer.available() > 0) {
                throw new DecodingException(buffer.available() + " trailing bytes after certificate");
            }

            return SshCertificate.builder()
                .nonce(nonce)
                .publicKey(publicKey)
                .serial(serial)
                .type(type)
                .keyId(keyId)
                .principals(principals)
                .validAfter(validAfter)
                .validBefore(validBefore)
                .criticalOptions(criticalOptions)
                .extensions(extensions)
                .reserved(reserved)
                .signatureKey(signatureKey)
                .signature(signature)
                .build();
        } catch (DecodingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DecodingException("Truncated or malformed certificate: " + e.getMessage(), e);
        }
    }

    private static List<String> decodePrincipals(byte[] encoded) {
        ByteArrayBuffer buffer = new ByteArrayBuffer(encoded);
        List<String> principals = new ArrayList<>();
        while (buffer.available() > 0) {
            principals.add(buffer.getString());
        }
        return principals;
    }

    private static SortedMap<String, String> decodeOptions(byte[] encoded) {
        ByteArrayBuffer buffer = new ByteArrayBuffer(encoded);
        SortedMap<String, String> options = new TreeMap<>();
        String previous = null;
        while (buffer.available() > 0) {
            String name = buffer.getString();
            byte[] data = buffer.getBytes();
            if (previous != null && previous.compareTo(name) >= 0) {
                throw new DecodingException("Options are not in lexical order: " + name);
            }
            previous = name;

            String value = "";
            if (data.length > 0) {
                ByteArrayBuffer inner = new ByteArrayBuffer(data);
                value = inner.getString();
                if (inner.available() > 0) {
                    throw new DecodingException("Trailing bytes in data of option " + name);
                }
            }
            options.put(name, value);
        }
        return options;
    }
}
