package com.foldermatch.app.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Um lado (pasta esquerda ou direita) de um {@link FileDetail}. Quando o arquivo nao pode ser
 * lido, {@code available} e false, {@code sizeBytes} vale -1 e {@code lastWriteTime} e {@code null}.
 */
public record FileSide(String fullPath, String fileName, long sizeBytes, Instant lastWriteTime, boolean available) {

    public static FileSide of(String fullPath, String fileName, long sizeBytes, Instant lastWriteTime) {
        return new FileSide(fullPath, fileName, sizeBytes, lastWriteTime, true);
    }

    public static FileSide notAvailable(String fullPath, String fileName) {
        return new FileSide(fullPath, fileName, -1L, null, false);
    }

    public Optional<Instant> lastWrite() {
        return Optional.ofNullable(lastWriteTime);
    }
}
