package com.foldermatch.app.project;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.foldermatch.app.model.ProjectData;
import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;

/**
 * Le e grava arquivos de projeto: um {@link ProjectData} em JSON indentado ({@code .fmp}) ou o
 * mesmo JSON comprimido com Zstandard ({@code .fmpz}).
 */
public class ProjectStore {

    private static final Logger logger = LoggerFactory.getLogger(ProjectStore.class);

    public static final String EXTENSION = ".fmp";
    public static final String COMPRESSED_EXTENSION = ".fmpz";

    private static final int ZSTD_LEVEL = 3;

    private final ObjectMapper mapper;

    public ProjectStore() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Grava {@code data} (com o nome da aplicacao carimbado) num arquivo temporario ao lado e o move
     * para o lugar.
     */
    public void save(Path file, ProjectData data) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(data, "data");
        ProjectData stamped = data.withApplicationName(ProjectData.APPLICATION_NAME);

        Path target = file.toAbsolutePath();
        Path dir = target.getParent();
        if (dir != null) Files.createDirectories(dir);
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");

        try {
            try (OutputStream base = Files.newOutputStream(temp);
                 OutputStream out = isCompressed(target) ? new ZstdOutputStream(base, ZSTD_LEVEL) : base) {
                mapper.writeValue(out, stamped);
            }
            move(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.info("Projeto salvo: {} ({} raizes, {} pastas, {} hashes)", target,
                stamped.scanFolders().size(), stamped.folderInfoCache().size(), stamped.fileHashCache().size());
    }

    /**
     * @throws NoSuchFileException o arquivo nao existe
     * @throws IOException o arquivo e ilegivel ou nao e um projeto
     */
    public ProjectData load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString(), null, "Arquivo de projeto nao encontrado");
        }
        ProjectData data;
        try (InputStream base = Files.newInputStream(file);
             InputStream in = isCompressed(file) ? new ZstdInputStream(base) : base) {
            data = mapper.readValue(in, ProjectData.class);
        } catch (JsonProcessingException e) {
            throw new IOException("Formato de arquivo de projeto invalido: " + file + " (" + e.getOriginalMessage() + ")", e);
        }
        if (data == null) {
            throw new IOException("Formato de arquivo de projeto invalido: " + file);
        }
        // arquivos antigos nao tem nome de aplicacao
        if (data.applicationName() == null || data.applicationName().isBlank()) {
            data = data.withApplicationName(ProjectData.APPLICATION_NAME);
        }
        logger.info("Projeto carregado: {} ({} raizes, {} pastas)", file, data.scanFolders().size(),
                data.folderInfoCache().size());
        return data;
    }

    /**
     * True quando o arquivo existe, tem extensao de projeto e e legivel. Nunca lanca.
     */
    public boolean isValidProjectFile(Path file) {
        if (file == null || !Files.isRegularFile(file) || !hasProjectExtension(file)) return false;
        try {
            load(file);
            return true;
        } catch (IOException | RuntimeException e) {
            logger.debug("Arquivo de projeto invalido {}: {}", file, e.toString());
            return false;
        }
    }

    public static boolean hasProjectExtension(Path file) {
        String name = fileName(file);
        return name.endsWith(EXTENSION) || name.endsWith(COMPRESSED_EXTENSION);
    }

    static boolean isCompressed(Path file) {
        return fileName(file).endsWith(COMPRESSED_EXTENSION);
    }

    private static String fileName(Path file) {
        Path name = file.getFileName();
        return name == null ? "" : name.toString().toLowerCase(Locale.ROOT);
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
