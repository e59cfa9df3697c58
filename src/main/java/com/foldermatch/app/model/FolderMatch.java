package com.foldermatch.app.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.foldermatch.app.cache.PathKeys;

/**
 * Par de pastas com ao menos um arquivo duplicado confirmado, junto com a similaridade.
 *
 * A similaridade e o indice de Jaccard por contagem: os duplicados sao a intersecao e
 * {@code left + right - duplicates} a uniao. Os valores sao fixados na construcao.
 */
public final class FolderMatch {

    private final String leftFolder;
    private final String rightFolder;
    private final List<FileMatch> duplicateFiles;
    private final double similarityPercentage;
    private final long folderSizeBytes;
    private final Instant latestModificationDate;

    public FolderMatch(String leftFolder,
                       String rightFolder,
                       List<FileMatch> duplicateFiles,
                       int totalLeftFiles,
                       int totalRightFiles,
                       long folderSizeBytes,
                       Instant latestModificationDate) {
        this.leftFolder = Objects.requireNonNull(leftFolder, "leftFolder");
        this.rightFolder = Objects.requireNonNull(rightFolder, "rightFolder");
        this.duplicateFiles = List.copyOf(Objects.requireNonNull(duplicateFiles, "duplicateFiles"));
        this.folderSizeBytes = folderSizeBytes;
        this.latestModificationDate = latestModificationDate;
        this.similarityPercentage = similarity(this.duplicateFiles.size(), totalLeftFiles, totalRightFiles);
    }

    /**
     * 100 * d / (left + right - d), ou 0 quando a uniao e vazia.
     */
    public static double similarity(int duplicates, int totalLeftFiles, int totalRightFiles) {
        int unionSize = totalLeftFiles + totalRightFiles - duplicates;
        if (unionSize <= 0) return 0.0;
        double value = duplicates / (double) unionSize * 100.0;
        return Math.max(0.0, Math.min(100.0, value));
    }

    public String leftFolder() { return leftFolder; }
    public String rightFolder() { return rightFolder; }
    public List<FileMatch> duplicateFiles() { return duplicateFiles; }
    public double similarityPercentage() { return similarityPercentage; }
    public long folderSizeBytes() { return folderSizeBytes; }

    public Optional<Instant> latestModificationDate() {
        return Optional.ofNullable(latestModificationDate);
    }

    /**
     * Ultimo segmento do caminho da pasta esquerda.
     */
    public String folderName() {
        return PathKeys.fileNameOf(leftFolder);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FolderMatch other)) return false;
        return Double.compare(similarityPercentage, other.similarityPercentage) == 0
                && folderSizeBytes == other.folderSizeBytes
                && leftFolder.equals(other.leftFolder)
                && rightFolder.equals(other.rightFolder)
                && duplicateFiles.equals(other.duplicateFiles)
                && Objects.equals(latestModificationDate, other.latestModificationDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(leftFolder, rightFolder, duplicateFiles, similarityPercentage, folderSizeBytes,
                latestModificationDate);
    }

    @Override
    public String toString() {
        return "FolderMatch[" + leftFolder + " <-> " + rightFolder
                + ", duplicates=" + duplicateFiles.size()
                + ", similarity=" + String.format(java.util.Locale.ROOT, "%.2f", similarityPercentage) + "%]";
    }
}
