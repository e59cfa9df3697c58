package com.foldermatch.app.model;

import java.time.Instant;
import java.util.List;

/**
 * Copia imutavel dos erros registrados numa sessao de analise.
 * {@code lastErrorTime} e {@code null} ate o primeiro registro.
 */
public record ErrorSummary(int skippedFiles,
                           int permissionErrors,
                           int networkErrors,
                           int resourceErrors,
                           List<String> skippedPaths,
                           List<String> errorMessages,
                           Instant lastErrorTime) {

    public ErrorSummary {
        skippedPaths = List.copyOf(skippedPaths);
        errorMessages = List.copyOf(errorMessages);
    }

    public static ErrorSummary empty() {
        return new ErrorSummary(0, 0, 0, 0, List.of(), List.of(), null);
    }

    public boolean hasErrors() {
        return skippedFiles > 0 || permissionErrors > 0 || networkErrors > 0 || resourceErrors > 0;
    }

    public int totalErrors() {
        return permissionErrors + networkErrors + resourceErrors;
    }
}
