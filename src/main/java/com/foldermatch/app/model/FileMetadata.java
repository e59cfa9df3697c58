package com.foldermatch.app.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Retrato de um arquivo no momento da varredura. Fica desatualizado se o arquivo mudar; so uma
 * nova varredura explicita o atualiza.
 */
public record FileMetadata(String fileName, long size, Instant lastWriteTime) {

    public FileMetadata {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(lastWriteTime, "lastWriteTime");
        if (size < 0) throw new IllegalArgumentException("size deve ser >= 0: " + size);
    }
}
