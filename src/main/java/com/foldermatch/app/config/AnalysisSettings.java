package com.foldermatch.app.config;

import java.time.Duration;

import com.foldermatch.app.model.FilterCriteria;

/**
 * Retrato imutavel dos parametros usados por uma sessao.
 */
public record AnalysisSettings(int maxParallelism,
                               Duration scanTimeout,
                               Duration networkProbeTimeout,
                               int maxHashRetries,
                               Duration retryDelayCap,
                               FilterCriteria defaultCriteria) {

    public AnalysisSettings {
        maxParallelism = Math.max(1, maxParallelism);
        maxHashRetries = Math.max(0, maxHashRetries);
        scanTimeout = scanTimeout == null ? Duration.ofMinutes(30) : scanTimeout;
        networkProbeTimeout = networkProbeTimeout == null ? Duration.ofSeconds(5) : networkProbeTimeout;
        retryDelayCap = retryDelayCap == null ? Duration.ofSeconds(5) : retryDelayCap;
        defaultCriteria = defaultCriteria == null ? FilterCriteria.defaults() : defaultCriteria;
    }

    public static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    /**
     * Padroes embutidos, ignorando o ambiente.
     */
    public static AnalysisSettings defaults() {
        return new AnalysisSettings(defaultParallelism(), Duration.ofMinutes(30), Duration.ofSeconds(5), 1,
                Duration.ofSeconds(5), FilterCriteria.defaults());
    }

    public AnalysisSettings withMaxParallelism(int parallelism) {
        return new AnalysisSettings(parallelism, scanTimeout, networkProbeTimeout, maxHashRetries, retryDelayCap,
                defaultCriteria);
    }

    public AnalysisSettings withScanTimeout(Duration timeout) {
        return new AnalysisSettings(maxParallelism, timeout, networkProbeTimeout, maxHashRetries, retryDelayCap,
                defaultCriteria);
    }

    public AnalysisSettings withRetryDelayCap(Duration cap) {
        return new AnalysisSettings(maxParallelism, scanTimeout, networkProbeTimeout, maxHashRetries, cap,
                defaultCriteria);
    }
}
