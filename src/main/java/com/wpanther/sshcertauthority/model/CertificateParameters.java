package com.wpanther.sshcertauthority.model;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import lombok.Builder;
import lombok.Value;

/**
 * Certificate fields chosen by the requester. Unset fields fall back to a user
 * certificate with a random serial, valid from the signing time for the key's
 * default validity, with all extensions permitted.
 */
@Value
@Builder(toBuilder = true)
public class CertificateParameters {

    @Builder.Default
    CertificateType type = CertificateType.USER;

    @Builder.Default
    String keyId = "";

    // null: random unsigned 64-bit serial
    Long serial;

    @Builder.Default
    List<String> principals = Collections.emptyList();

    // null: signing time
    Long validAfter;

    // null: valid-after plus the default validity
    Long validBefore;

    @Builder.Default
    SortedMap<String, String> criticalOptions = new TreeMap<>();

    @Builder.Default
    SortedMap<String, String> extensions = CertificateExtension.permitAll();
}
