package com.foldermatch.app.model;

import java.util.Objects;

import com.foldermatch.app.cache.PathKeys;

/**
 * Dois arquivos de conteudo identico em pastas diferentes.
 *
 * Sempre criado por {@link #of(String, String)}, que coloca em {@code pathA} o arquivo cuja pasta
 * pai vem primeiro na ordem sem diferenciar maiusculas. A agregacao agrupa por
 * (dir(pathA), dir(pathB)), entao um par de pastas cai sempre no mesmo grupo, seja qual for a
 * ordem em que o hashing encontrou os arquivos.
 */
public record FileMatch(String pathA, String pathB) {

    public FileMatch {
        Objects.requireNonNull(pathA, "pathA");
        Objects.requireNonNull(pathB, "pathB");
    }

    public static FileMatch of(String first, String second) {
        String dirFirst = PathKeys.normalize(PathKeys.parentOf(first));
        String dirSecond = PathKeys.normalize(PathKeys.parentOf(second));
        int cmp = dirFirst.compareTo(dirSecond);
        if (cmp == 0) {
            cmp = PathKeys.normalize(first).compareTo(PathKeys.normalize(second));
        }
        return cmp <= 0 ? new FileMatch(first, second) : new FileMatch(second, first);
    }

    public String folderA() {
        return PathKeys.parentOf(pathA);
    }

    public String folderB() {
        return PathKeys.parentOf(pathB);
    }
}
