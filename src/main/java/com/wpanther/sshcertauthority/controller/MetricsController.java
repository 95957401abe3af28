package com.wpanther.sshcertauthority.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.wpanther.sshcertauthority.dto.SigningMetricsResponse;
import com.wpanther.sshcertauthority.service.MetricsService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Controller for retrieving metrics about signing operations
 */
@RestController
@RequestMapping(value = "/api/v1/metrics", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Slf4j
public class MetricsController {

    private final MetricsService metricsService;

    @GetMapping
    public ResponseEntity<SigningMetricsResponse> getMetrics() {
        log.debug("Fetching signing metrics");
        return ResponseEntity.ok(metricsService.calculateMetrics());
    }
}
