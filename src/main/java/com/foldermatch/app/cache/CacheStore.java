package com.foldermatch.app.cache;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.foldermatch.app.fs.FileAccess;
import com.foldermatch.app.fs.LocalFileAccess;
import com.foldermatch.app.model.FileMetadata;
import com.foldermatch.app.model.FolderInfo;
import com.foldermatch.app.model.ProjectData;

/**
 * Cache incremental de uma sessao de analise.
 *
 * Quatro mapas concorrentes independentes (info de pasta, lista de arquivos, hashes, metadados),
 * com chaves de caminho sem diferenciar maiusculas. Workers do scanner gravam em paralelo; nao ha
 * lock global.
 */
public final class CacheStore {

    private static final Logger logger = LoggerFactory.getLogger(CacheStore.class);

    private final Map<PathKey, FolderInfo> folderInfo = new ConcurrentHashMap<>();
    private final Map<PathKey, List<String>> folderFiles = new ConcurrentHashMap<>();
    private final Map<PathKey, String> fileHashes = new ConcurrentHashMap<>();
    private final Map<PathKey, FileMetadata> fileMetadata = new ConcurrentHashMap<>();

    private final FileAccess fileAccess;

    public CacheStore() {
        this(LocalFileAccess.instance());
    }

    public CacheStore(FileAccess fileAccess) {
        this.fileAccess = Objects.requireNonNull(fileAccess, "fileAccess");
    }

    // --- pastas -------------------------------------------------------------

    public boolean isCached(String folder) {
        return folder != null && folderInfo.containsKey(new PathKey(folder));
    }

    public void put(String folder, FolderInfo info) {
        Objects.requireNonNull(info, "info");
        PathKey key = new PathKey(Objects.requireNonNull(folder, "folder"));
        folderInfo.put(key, info);
        folderFiles.put(key, info.files());
    }

    public Optional<FolderInfo> get(String folder) {
        if (folder == null) return Optional.empty();
        return Optional.ofNullable(folderInfo.get(new PathKey(folder)));
    }

    public List<String> getFolderFiles(String folder) {
        if (folder == null) return List.of();
        List<String> files = folderFiles.get(new PathKey(folder));
        return files == null ? List.of() : files;
    }

    public long getFolderSize(String folder) {
        return get(folder).map(FolderInfo::totalSize).orElse(0L);
    }

    /**
     * Caminhos de todas as pastas em cache, como foram informados.
     */
    public List<String> cachedFolders() {
        List<String> out = new ArrayList<>(folderInfo.size());
        for (PathKey k : folderInfo.keySet()) out.add(k.original());
        return out;
    }

    public int cachedFolderCount() {
        return folderInfo.size();
    }

    // --- arquivos ---------------------------------------------------------------

    public void putHash(String file, String hash) {
        if (hash == null || hash.isEmpty()) return;
        fileHashes.put(new PathKey(Objects.requireNonNull(file, "file")), hash);
    }

    public Optional<String> getHash(String file) {
        if (file == null) return Optional.empty();
        return Optional.ofNullable(fileHashes.get(new PathKey(file)));
    }

    public int cachedHashCount() {
        return fileHashes.size();
    }

    public void putMetadata(String file, FileMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        fileMetadata.put(new PathKey(Objects.requireNonNull(file, "file")), metadata);
    }

    public Optional<FileMetadata> getMetadata(String file) {
        if (file == null) return Optional.empty();
        return Optional.ofNullable(fileMetadata.get(new PathKey(file)));
    }

    // --- invalidacao --------------------------------------------------------

    public void clear() {
        folderInfo.clear();
        folderFiles.clear();
        fileHashes.clear();
        fileMetadata.clear();
    }

    /**
     * Remove toda entrada de {@code root} e de tudo abaixo dela, nos quatro mapas.
     * Pastas irmas com o mesmo prefixo ("C:\AB" ao lado de "C:\A") ficam intactas.
     *
     * @return quantidade de pastas removidas
     */
    public int removeSubtree(String root) {
        if (root == null || root.isBlank()) return 0;

        int before = folderInfo.size();
        folderInfo.keySet().removeIf(k -> PathKeys.isSameOrDescendant(k.original(), root));
        folderFiles.keySet().removeIf(k -> PathKeys.isSameOrDescendant(k.original(), root));
        fileHashes.keySet().removeIf(k -> PathKeys.isSameOrDescendant(k.original(), root));
        fileMetadata.keySet().removeIf(k -> PathKeys.isSameOrDescendant(k.original(), root));
        int removed = Math.max(0, before - folderInfo.size());

        logger.debug("Cache: removidas {} pastas abaixo de {}", removed, root);
        return removed;
    }

    // --- snapshot ------------------------------------------------------------

    public ProjectData exportSnapshot(List<String> scanRoots) {
        return new ProjectData(
                scanRoots == null ? List.of() : scanRoots,
                toPlainMap(folderFiles),
                toPlainMap(fileHashes),
                toPlainMap(folderInfo),
                toPlainMap(fileMetadata),
                Instant.now(),
                ProjectData.CURRENT_VERSION,
                ProjectData.APPLICATION_NAME
        );
    }

    /**
     * Substitui todo o estado pelo snapshot. Os metadados sao refeitos lendo de novo cada arquivo
     * de cada pasta em cache; arquivos que sumiram ou nao podem ser lidos ficam de fora.
     */
    public void importSnapshot(ProjectData data) {
        Objects.requireNonNull(data, "data");
        clear();

        data.folderInfoCache().forEach((k, v) -> { if (k != null && v != null) folderInfo.put(new PathKey(k), v); });
        data.fileHashCache().forEach(this::putHash);
        data.folderFileCache().forEach((k, v) -> { if (k != null && v != null) folderFiles.put(new PathKey(k), List.copyOf(v)); });

        // info de pasta e a fonte de verdade das listas de arquivos
        folderInfo.forEach((k, v) -> folderFiles.putIfAbsent(k, v.files()));

        int restored = 0;
        int dropped = 0;
        for (FolderInfo info : folderInfo.values()) {
            for (String file : info.files()) {
                try {
                    Path p = Path.of(file);
                    if (!fileAccess.exists(p)) {
                        dropped++;
                        continue;
                    }
                    fileMetadata.put(new PathKey(file), fileAccess.stat(p));
                    restored++;
                } catch (IOException | InvalidPathException | SecurityException e) {
                    dropped++;
                    logger.debug("Cache: metadados nao restaurados para {}: {}", file, e.getMessage());
                }
            }
        }
        logger.info("Cache: imported {} folders, {} hashes; metadata restored for {} files ({} unavailable)",
                folderInfo.size(), fileHashes.size(), restored, dropped);
    }

    private static <V> Map<String, V> toPlainMap(Map<PathKey, V> source) {
        Map<String, V> out = new LinkedHashMap<>();
        source.forEach((k, v) -> out.put(k.original(), v));
        return out;
    }
}
