package com.wpanther.sshcertauthority.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

import org.springframework.stereotype.Service;

import com.wpanther.sshcertauthority.dto.SigningMetricsResponse;
import com.wpanther.sshcertauthority.exception.ErrorCode;

import lombok.extern.slf4j.Slf4j;

/**
 * In-memory counters of signing outcomes since startup
 */
@Service
@Slf4j
public class MetricsService {

    private final Clock clock;
    private final Instant startedAt;

    private final LongAdder signed = new LongAdder();
    private final LongAdder rejected = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final Map<String, LongAdder> byKeyType = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> byErrorCode = new ConcurrentHashMap<>();

    public MetricsService(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void recordSigned(String keyType) {
        signed.increment();
        byKeyType.computeIfAbsent(keyType, k -> new LongAdder()).increment();
    }

    public void recordRejected(ErrorCode errorCode) {
        rejected.increment();
        byErrorCode.computeIfAbsent(errorCode.name(), k -> new LongAdder()).increment();
    }

    public void recordFailed(ErrorCode errorCode) {
        failed.increment();
        byErrorCode.computeIfAbsent(errorCode.name(), k -> new LongAdder()).increment();
    }

    /**
     * Snapshot of the current counters
     */
    public SigningMetricsResponse calculateMetrics() {
        log.debug("Calculating signing metrics");
        return SigningMetricsResponse.builder()
            .signedCertificates(signed.sum())
            .rejectedRequests(rejected.sum())
            .failedRequests(failed.sum())
            .certificatesByKeyType(snapshot(byKeyType))
            .errorsByCode(snapshot(byErrorCode))
            .startedAt(startedAt)
            .timestamp(clock.instant())
            .build();
    }

    private static Map<String, Long> snapshot(Map<String, LongAdder> counters) {
        Map<String, Long> result = new TreeMap<>();
        counters.forEach((name, counter) -> result.put(name, counter.sum()));
        return result;
    }
}
