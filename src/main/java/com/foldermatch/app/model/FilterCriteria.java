package com.foldermatch.app.model;

import java.time.Instant;

/**
 * Configuracao de filtro das correspondencias. Limites de data sao opcionais ({@code null} = sem limite).
 */
public record FilterCriteria(double minimumSimilarityPercent,
                             long minimumSizeBytes,
                             Instant minimumDate,
                             Instant maximumDate) {

    public static final double DEFAULT_MIN_SIMILARITY = 50.0;
    public static final long DEFAULT_MIN_SIZE_BYTES = 1024L * 1024L;

    public static FilterCriteria defaults() {
        return new FilterCriteria(DEFAULT_MIN_SIMILARITY, DEFAULT_MIN_SIZE_BYTES, null, null);
    }

    public FilterCriteria withMinimumSimilarity(double percent) {
        return new FilterCriteria(percent, minimumSizeBytes, minimumDate, maximumDate);
    }

    public FilterCriteria withMinimumSize(long bytes) {
        return new FilterCriteria(minimumSimilarityPercent, bytes, minimumDate, maximumDate);
    }

    public FilterCriteria withDateRange(Instant from, Instant to) {
        return new FilterCriteria(minimumSimilarityPercent, minimumSizeBytes, from, to);
    }

    public boolean matches(FolderMatch match) {
        if (match.similarityPercentage() < minimumSimilarityPercent) return false;
        if (match.folderSizeBytes() < minimumSizeBytes) return false;

        Instant date = match.latestModificationDate().orElse(null);
        if (minimumDate != null && (date == null || date.isBefore(minimumDate))) return false;
        if (maximumDate != null && (date == null || date.isAfter(maximumDate))) return false;
        return true;
    }
}
