package com.foldermatch.app.fs;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import com.foldermatch.app.model.FileMetadata;

/**
 * Local filesystem access that counts calls and can be told to fail for given paths.
 */
public class CountingFileAccess implements FileAccess {

    public final AtomicInteger statCalls = new AtomicInteger();
    public final AtomicInteger openCalls = new AtomicInteger();
    public final AtomicInteger listFileCalls = new AtomicInteger();
    public final AtomicInteger listDirectoryCalls = new AtomicInteger();

    private final Map<Path, IOException> statFailures = new ConcurrentHashMap<>();
    private final Map<Path, IOException> openFailures = new ConcurrentHashMap<>();
    private final Map<Path, IOException> listFailures = new ConcurrentHashMap<>();

    private final FileAccess delegate = LocalFileAccess.instance();

    public CountingFileAccess failStat(Path p, IOException e) {
        statFailures.put(p, e);
        return this;
    }

    public CountingFileAccess failOpen(Path p, IOException e) {
        openFailures.put(p, e);
        return this;
    }

    public CountingFileAccess failList(Path p, IOException e) {
        listFailures.put(p, e);
        return this;
    }

    @Override
    public boolean isDirectory(Path path) {
        return delegate.isDirectory(path);
    }

    @Override
    public boolean exists(Path path) {
        return delegate.exists(path);
    }

    @Override
    public List<Path> listDirectories(Path dir) throws IOException {
        listDirectoryCalls.incrementAndGet();
        IOException e = listFailures.get(dir);
        if (e != null) throw e;
        return delegate.listDirectories(dir);
    }

    @Override
    public List<Path> listFiles(Path dir) throws IOException {
        listFileCalls.incrementAndGet();
        IOException e = listFailures.get(dir);
        if (e != null) throw e;
        return delegate.listFiles(dir);
    }

    @Override
    public FileMetadata stat(Path file) throws IOException {
        statCalls.incrementAndGet();
        IOException e = statFailures.get(file);
        if (e != null) throw e;
        return delegate.stat(file);
    }

    @Override
    public InputStream openRead(Path file) throws IOException {
        openCalls.incrementAndGet();
        IOException e = openFailures.get(file);
        if (e != null) throw e;
        return delegate.openRead(file);
    }
}
