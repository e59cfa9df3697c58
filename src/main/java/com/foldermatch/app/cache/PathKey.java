package com.foldermatch.app.cache;

import java.util.Objects;

/**
 * Chave de mapa que guarda o caminho como veio mas compara sem diferenciar maiusculas,
 * ignorando separadores finais.
 */
final class PathKey {

    private final String original;
    private final String normalized;

    PathKey(String path) {
        this.original = Objects.requireNonNull(path, "path");
        this.normalized = PathKeys.normalize(path);
    }

    String original() {
        return original;
    }

    String normalized() {
        return normalized;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof PathKey other && normalized.equals(other.normalized));
    }

    @Override
    public int hashCode() {
        return normalized.hashCode();
    }

    @Override
    public String toString() {
        return original;
    }
}
