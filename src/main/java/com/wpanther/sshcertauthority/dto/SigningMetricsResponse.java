package com.wpanther.sshcertauthority.dto;

import java.time.Instant;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters of signing requests handled since startup
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SigningMetricsResponse {

    private long signedCertificates;
    private long rejectedRequests;
    private long failedRequests;

    // signed certificates by subject key type
    private Map<String, Long> certificatesByKeyType;

    // rejected and failed requests by error code
    private Map<String, Long> errorsByCode;

    private Instant startedAt;
    private Instant timestamp;
}
