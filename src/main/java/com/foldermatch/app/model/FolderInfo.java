package com.foldermatch.app.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Informacao agregada de uma pasta varrida.
 *
 * Criada uma vez pelo scanner e substituida inteira numa nova varredura.
 * {@code latestModificationDate} e {@code null} para pastas vazias ou inacessiveis.
 */
public record FolderInfo(List<String> files, long totalSize, Instant latestModificationDate) {

    public FolderInfo {
        files = List.copyOf(Objects.requireNonNull(files, "files"));
    }

    public static FolderInfo empty() {
        return new FolderInfo(List.of(), 0L, null);
    }

    public int fileCount() {
        return files.size();
    }

    public Optional<Instant> latestModification() {
        return Optional.ofNullable(latestModificationDate);
    }
}
