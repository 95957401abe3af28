package com.wpanther.sshcertauthority.service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.wpanther.sshcertauthority.dto.CertificateSigningRequest;
import com.wpanther.sshcertauthority.exception.DecodingException;
import com.wpanther.sshcertauthority.exception.ValidationException;
import com.wpanther.sshcertauthority.model.CertificateCriticalOption;
import com.wpanther.sshcertauthority.model.CertificateExtension;
import com.wpanther.sshcertauthority.model.CertificateParameters;
import com.wpanther.sshcertauthority.model.CertificateType;
import com.wpanther.sshcertauthority.model.SshCertificate;
import com.wpanther.sshcertauthority.model.SshPublicKey;
import com.wpanther.sshcertauthority.util.SshCertificateCodec;
import com.wpanther.sshcertauthority.util.SshKeyUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a signing request into a subject key and certificate parameters,
 * rejecting anything a certificate cannot carry
 */
@Service
@Slf4j
public class CertificateRequestValidationService {

    private final SecureRandom secureRandom;
    private final Clock clock;
    private final Duration defaultValidity;

    public CertificateRequestValidationService(SecureRandom secureRandom, Clock clock,
            @Value("${app.ca.default-validity:1h}") Duration defaultValidity) {
        this.secureRandom = secureRandom;
        this.clock = clock;
        this.defaultValidity = defaultValidity;
    }

    /**
     * Validates the request and fills in defaults
     *
     * @throws ValidationException if any field is unusable
     */
    public ValidatedRequest validate(CertificateSigningRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }

        SshPublicKey subjectKey = parseSubjectKey(request.getPublicKey());

        List<String> principals = request.getPrincipals() == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(request.getPrincipals()));
        String keyId = request.getKeyId() == null ? "" : request.getKeyId();

        SortedMap<String, String> criticalOptions = toSortedMap(request.getCriticalOptions());
        for (String option : criticalOptions.keySet()) {
            if (!CertificateCriticalOption.isKnown(option)) {
                throw new ValidationException("Unknown critical option: " + option);
            }
        }
        SortedMap<String, String> extensions = request.getExtensions() == null
            ? CertificateExtension.permitAll()
            : toSortedMap(request.getExtensions());

        SshCertificateCodec.checkLimits(keyId, principals, criticalOptions, extensions);

        long validAfter = resolveValidAfter(request);
        long validBefore = resolveValidBefore(request, validAfter);
        SshCertificateCodec.checkValidity(validAfter, validBefore);

        CertificateParameters parameters = CertificateParameters.builder()
            .type(parseType(request.getCertificateType()))
            .keyId(keyId)
            .serial(parseSerial(request.getSerial()))
            .principals(principals)
            .validAfter(validAfter)
            .validBefore(validBefore)
            .criticalOptions(criticalOptions)
            .extensions(extensions)
            .build();

        log.debug("Validated request for {} key with {} principal(s)", subjectKey.getKeyType(), principals.size());
        return new ValidatedRequest(subjectKey, parameters);
    }

    private SshPublicKey parseSubjectKey(String publicKey) {
        try {
            return SshKeyUtil.parsePublicKey(SshKeyUtil.decodePublicKeyText(publicKey));
        } catch (DecodingException e) {
            throw new ValidationException("Invalid public key: " + e.getMessage(), e);
        }
    }

    private CertificateType parseType(String certificateType) {
        if (certificateType == null || certificateType.isBlank()) {
            return CertificateType.USER;
        }
        try {
            return CertificateType.valueOf(certificateType.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown certificate type: " + certificateType);
        }
    }

    private long parseSerial(String serial) {
        if (serial == null || serial.isBlank()) {
            return secureRandom.nextLong();
        }
        try {
            return Long.parseUnsignedLong(serial.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Serial must be an unsigned 64-bit integer: " + serial);
        }
    }

    private long resolveValidAfter(CertificateSigningRequest request) {
        if (request.getValidAfter() == null) {
            return clock.instant().getEpochSecond();
        }
        if (request.getValidAfter() < 0) {
            throw new ValidationException("Valid-after must not be negative");
        }
        return request.getValidAfter();
    }

    // -1 stands for the unbounded valid-before sentinel, which is 2^64 - 1 unsigned
    private long resolveValidBefore(CertificateSigningRequest request, long validAfter) {
        if (request.getValidBefore() != null) {
            long validBefore = request.getValidBefore();
            if (validBefore < 0 && validBefore != SshCertificate.INFINITY) {
                throw new ValidationException("Valid-before must not be negative");
            }
            return validBefore;
        }
        Duration validFor = defaultValidity;
        if (request.getValidForSeconds() != null) {
            if (request.getValidForSeconds() <= 0) {
                throw new ValidationException("Validity duration must be positive");
            }
            validFor = Duration.ofSeconds(request.getValidForSeconds());
        }
        try {
            return Math.addExact(validAfter, validFor.getSeconds());
        } catch (ArithmeticException e) {
            throw new ValidationException("Validity window overflows");
        }
    }

    private static SortedMap<String, String> toSortedMap(Map<String, String> options) {
        SortedMap<String, String> sorted = new TreeMap<>();
        if (options != null) {
            for (Map.Entry<String, String> option : options.entrySet()) {
                if (option.getKey() == null) {
                    throw new ValidationException("Option names must not be null");
                }
                sorted.put(option.getKey(), option.getValue() == null ? "" : option.getValue());
            }
        }
        return sorted;
    }
}
