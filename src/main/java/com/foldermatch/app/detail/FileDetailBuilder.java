package com.foldermatch.app.detail;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.foldermatch.app.cache.CacheStore;
import com.foldermatch.app.cache.PathKeys;
import com.foldermatch.app.fs.FileAccess;
import com.foldermatch.app.model.FileDetail;
import com.foldermatch.app.model.FileMatch;
import com.foldermatch.app.model.FileMetadata;
import com.foldermatch.app.model.FileSide;

/**
 * Visao arquivo a arquivo de um par de pastas: todo nome encontrado em qualquer lado, marcado
 * como duplicado quando participou de uma correspondencia confirmada.
 */
public class FileDetailBuilder {

    private static final Logger logger = LoggerFactory.getLogger(FileDetailBuilder.class);

    private final FileAccess fileAccess;

    public FileDetailBuilder(FileAccess fileAccess) {
        this.fileAccess = Objects.requireNonNull(fileAccess, "fileAccess");
    }

    /**
     * Linhas ordenadas por nome, sem diferenciar maiusculas. Tamanho e data vem do cache quando
     * existem, senao do sistema de arquivos; um lado que nao pode ser lido fica como indisponivel.
     */
    public List<FileDetail> build(String leftFolder, String rightFolder, List<FileMatch> duplicateFiles,
                                  CacheStore cache) {
        Objects.requireNonNull(cache, "cache");

        Set<String> duplicateNames = new HashSet<>();
        if (duplicateFiles != null) {
            for (FileMatch m : duplicateFiles) {
                duplicateNames.add(key(PathKeys.fileNameOf(m.pathA())));
                duplicateNames.add(key(PathKeys.fileNameOf(m.pathB())));
            }
        }

        Map<String, String> left = byName(cache.getFolderFiles(leftFolder));
        Map<String, String> right = byName(cache.getFolderFiles(rightFolder));

        // uniao ordenada, a primeira grafia vence
        TreeMap<String, String> names = new TreeMap<>();
        left.forEach((k, path) -> names.putIfAbsent(k, PathKeys.fileNameOf(path)));
        right.forEach((k, path) -> names.putIfAbsent(k, PathKeys.fileNameOf(path)));

        List<FileDetail> rows = new ArrayList<>(names.size());
        for (Map.Entry<String, String> e : names.entrySet()) {
            String leftPath = left.get(e.getKey());
            String rightPath = right.get(e.getKey());
            rows.add(new FileDetail(
                    e.getValue(),
                    duplicateNames.contains(e.getKey()),
                    leftPath == null ? null : side(leftPath, cache),
                    rightPath == null ? null : side(rightPath, cache)
            ));
        }
        return rows;
    }

    /**
     * Todas as linhas, ou so as duplicadas.
     */
    public static List<FileDetail> filter(List<FileDetail> details, boolean includeUnique) {
        if (details == null) return List.of();
        if (includeUnique) return List.copyOf(details);
        return details.stream().filter(FileDetail::duplicate).toList();
    }

    private FileSide side(String path, CacheStore cache) {
        String name = PathKeys.fileNameOf(path);
        FileMetadata meta = cache.getMetadata(path).orElse(null);
        if (meta != null) {
            return FileSide.of(path, name, meta.size(), meta.lastWriteTime());
        }
        try {
            FileMetadata fresh = fileAccess.stat(Path.of(path));
            return FileSide.of(path, name, fresh.size(), fresh.lastWriteTime());
        } catch (IOException | InvalidPathException | SecurityException e) {
            logger.debug("Detalhe: {} indisponivel: {}", path, e.toString());
            return FileSide.notAvailable(path, name);
        }
    }

    private static Map<String, String> byName(List<String> files) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String f : files) out.putIfAbsent(key(PathKeys.fileNameOf(f)), f);
        return out;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
