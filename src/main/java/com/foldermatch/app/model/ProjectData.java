package com.foldermatch.app.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot duravel de uma sessao: raizes varridas mais os quatro mapas do cache.
 *
 * Colecoes ausentes (arquivos de projeto antigos) viram colecoes vazias.
 */
public record ProjectData(List<String> scanFolders,
                          Map<String, List<String>> folderFileCache,
                          Map<String, String> fileHashCache,
                          Map<String, FolderInfo> folderInfoCache,
                          Map<String, FileMetadata> fileMetadataCache,
                          Instant createdDate,
                          String version,
                          String applicationName) {

    public static final String CURRENT_VERSION = "1.0";
    public static final String APPLICATION_NAME = "FolderMatch";

    public ProjectData {
        scanFolders = scanFolders == null ? List.of() : List.copyOf(scanFolders);
        folderFileCache = folderFileCache == null ? Map.of() : copy(folderFileCache);
        fileHashCache = fileHashCache == null ? Map.of() : copy(fileHashCache);
        folderInfoCache = folderInfoCache == null ? Map.of() : copy(folderInfoCache);
        fileMetadataCache = fileMetadataCache == null ? Map.of() : copy(fileMetadataCache);
        createdDate = createdDate == null ? Instant.now() : createdDate;
        version = version == null || version.isBlank() ? CURRENT_VERSION : version;
    }

    public ProjectData withApplicationName(String name) {
        return new ProjectData(scanFolders, folderFileCache, fileHashCache, folderInfoCache, fileMetadataCache,
                createdDate, version, name);
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        // mantem a ordem de insercao para o arquivo de projeto ficar legivel
        return java.util.Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
