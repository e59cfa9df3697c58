package com.foldermatch.app.fs;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.foldermatch.app.model.FileMetadata;

/**
 * {@link FileAccess} sobre o sistema de arquivos NIO padrao.
 */
public final class LocalFileAccess implements FileAccess {

    private static final LocalFileAccess INSTANCE = new LocalFileAccess();

    public static LocalFileAccess instance() {
        return INSTANCE;
    }

    @Override
    public boolean isDirectory(Path path) {
        return path != null && Files.isDirectory(path);
    }

    @Override
    public boolean exists(Path path) {
        return path != null && Files.exists(path);
    }

    @Override
    public List<Path> listDirectories(Path dir) throws IOException {
        List<Path> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                BasicFileAttributes attrs;
                try {
                    attrs = Files.readAttributes(child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                } catch (IOException e) {
                    // sumiu entre a listagem e o stat: nao da para descer nele
                    continue;
                }
                if (attrs.isDirectory()) out.add(child);
            }
        } catch (DirectoryIteratorException e) {
            throw e.getCause();
        }
        out.sort(Comparator.naturalOrder());
        return out;
    }

    @Override
    public List<Path> listFiles(Path dir) throws IOException {
        List<Path> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, Files::isRegularFile)) {
            for (Path child : stream) {
                out.add(child);
            }
        } catch (DirectoryIteratorException e) {
            throw e.getCause();
        }
        out.sort(Comparator.naturalOrder());
        return out;
    }

    @Override
    public FileMetadata stat(Path file) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        Path name = file.getFileName();
        return new FileMetadata(
                name == null ? file.toString() : name.toString(),
                attrs.size(),
                attrs.lastModifiedTime().toInstant()
        );
    }

    @Override
    public InputStream openRead(Path file) throws IOException {
        return Files.newInputStream(file);
    }
}
