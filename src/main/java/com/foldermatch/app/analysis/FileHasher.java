package com.foldermatch.app.analysis;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

import com.foldermatch.app.fs.FileAccess;

/**
 * SHA-256 do conteudo de um arquivo, em hex maiusculo.
 */
public class FileHasher {

    private final FileAccess fileAccess;

    public FileHasher(FileAccess fileAccess) {
        this.fileAccess = Objects.requireNonNull(fileAccess, "fileAccess");
    }

    public String hash(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IOException("SHA-256 indisponivel", e);
        }
        try (InputStream in = fileAccess.openRead(file)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().withUpperCase().formatHex(digest.digest());
    }
}
