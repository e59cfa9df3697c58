package com.foldermatch.app.scan;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.foldermatch.app.cache.CacheStore;
import com.foldermatch.app.concurrent.AnalysisAbortedException;
import com.foldermatch.app.concurrent.BoundedWorkerPool;
import com.foldermatch.app.concurrent.CancellationToken;
import com.foldermatch.app.concurrent.ProgressReporter;
import com.foldermatch.app.concurrent.WorkerBudget;
import com.foldermatch.app.config.AnalysisSettings;
import com.foldermatch.app.fs.ErrorKind;
import com.foldermatch.app.fs.FileAccess;
import com.foldermatch.app.fs.FsError;
import com.foldermatch.app.model.AnalysisPhase;
import com.foldermatch.app.model.AnalysisProgress;
import com.foldermatch.app.model.FileMetadata;
import com.foldermatch.app.model.FolderInfo;
import com.foldermatch.app.model.RecoveryAction;
import com.foldermatch.app.recovery.ErrorRecoveryService;
import com.foldermatch.app.recovery.RecoveryActions;

/**
 * Percorre uma pasta raiz e preenche o cache com um {@link FolderInfo} por pasta.
 *
 * Duas fases: enumeracao de todos os diretorios abaixo da raiz numa thread vigiada, depois
 * analise paralela das pastas que o cache ainda nao conhece.
 */
public class FolderScanner {

    private static final Logger logger = LoggerFactory.getLogger(FolderScanner.class);

    static final int COUNT_REPORT_EVERY = 100;
    static final int SCAN_REPORT_EVERY = 25;

    private final CacheStore cache;
    private final ErrorRecoveryService recovery;
    private final FileAccess fileAccess;
    private final AnalysisSettings settings;

    public FolderScanner(CacheStore cache, ErrorRecoveryService recovery, FileAccess fileAccess, AnalysisSettings settings) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.recovery = Objects.requireNonNull(recovery, "recovery");
        this.fileAccess = Objects.requireNonNull(fileAccess, "fileAccess");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Enumera todas as pastas abaixo de {@code root} (inclusive) e analisa as que nao estao em cache.
     *
     * @return todas as pastas encontradas, na ordem da enumeracao
     * @throws NoSuchFileException a raiz nao existe
     * @throws NotDirectoryException a raiz nao e um diretorio
     * @throws CancellationException o token disparou (cancelamento ou timeout)
     * @throws AnalysisAbortedException a politica de recuperacao mandou parar (disco cheio)
     */
    public List<String> scanHierarchy(String root, Consumer<AnalysisProgress> progressSink, CancellationToken cancel)
            throws IOException {
        cancel.throwIfCancellationRequested();
        Path rootPath = validateFolder(root);
        ProgressReporter progress = ProgressReporter.of(progressSink);

        long start = System.nanoTime();
        BoundedWorkerPool walker = new BoundedWorkerPool("foldermatch-walk-", new WorkerBudget(1));
        List<String> folders = walker.call(() -> enumerate(rootPath, progress, cancel), cancel);

        List<String> toScan = new ArrayList<>();
        for (String f : folders) {
            if (!cache.isCached(f)) toScan.add(f);
        }

        if (toScan.isEmpty()) {
            progress.complete(folders.size(), "Todas as " + folders.size() + " pastas ja estavam no cache");
            logger.info("Varredura de {}: {} pastas, todas em cache", root, folders.size());
            return folders;
        }

        int total = toScan.size();
        progress.report(AnalysisPhase.SCANNING_FOLDERS, 0, total, "Varrendo " + total + " pastas novas...");

        WorkerBudget budget = new WorkerBudget(settings.maxParallelism());
        BoundedWorkerPool pool = new BoundedWorkerPool("foldermatch-scan-", budget);
        AtomicInteger done = new AtomicInteger();

        pool.runAll(toScan, folder -> {
            cache.put(folder, analyze(Path.of(folder), budget, cancel));
            int n = done.incrementAndGet();
            if (n % SCAN_REPORT_EVERY == 0 || n == total) {
                progress.report(AnalysisPhase.SCANNING_FOLDERS, n, total,
                        "Varrendo pastas: " + n + "/" + total + "...");
            }
        }, cancel);

        progress.complete(folders.size(), "Varridas " + total + " de " + folders.size() + " pastas");
        logger.info("Varredura de {}: {} pastas ({} analisadas) em {} ms",
                root, folders.size(), total, (System.nanoTime() - start) / 1_000_000);
        return folders;
    }

    /**
     * Analisa uma pasta: arquivos imediatos, tamanho total e ultima modificacao. Os metadados de cada
     * arquivo vao para o cache; o FolderInfo e devolvido, nao guardado.
     */
    public FolderInfo analyzeFolder(String folder) throws IOException {
        Path path = validateFolder(folder);
        return analyze(path, null, CancellationToken.none());
    }

    /**
     * Contagem aproximada das pastas abaixo de {@code root}, raiz inclusive. Ramos ilegiveis nao
     * contam; devolve 1 quando a travessia falha por completo.
     */
    public int countSubfolders(String root) throws IOException {
        Path rootPath = validateFolder(root);
        try {
            int count = 0;
            Deque<Path> stack = new ArrayDeque<>();
            stack.push(rootPath);
            while (!stack.isEmpty()) {
                Path current = stack.pop();
                count++;
                try {
                    for (Path child : listDirectories(current)) stack.push(child);
                } catch (IOException | SecurityException e) {
                    logger.debug("Contagem: ignorando {}: {}", current, e.toString());
                }
            }
            return count;
        } catch (RuntimeException e) {
            logger.warn("Falha na contagem de {}: {}", root, e.toString());
            return 1;
        }
    }

    private List<String> enumerate(Path root, ProgressReporter progress, CancellationToken cancel) {
        progress.indeterminate(AnalysisPhase.COUNTING_FOLDERS, 0, "Contando subpastas...");

        List<String> folders = new ArrayList<>();
        Deque<Path> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            cancel.throwIfCancellationRequested();
            Path current = stack.pop();
            folders.add(current.toString());
            try {
                List<Path> children = listDirectories(current);
                // invertido para visitar os filhos na ordem da listagem
                for (int i = children.size() - 1; i >= 0; i--) stack.push(children.get(i));
            } catch (IOException | SecurityException e) {
                // walk interrompido nao conta como pasta ignorada
                cancel.throwIfCancellationRequested();
                recovery.logSkippedItem(current.toString(), reasonOf(e));
            }
            if (folders.size() == 1 || folders.size() % COUNT_REPORT_EVERY == 0) {
                progress.indeterminate(AnalysisPhase.COUNTING_FOLDERS, folders.size(),
                        "Encontradas " + folders.size() + " subpastas...");
            }
        }
        return folders;
    }

    private FolderInfo analyze(Path folder, WorkerBudget budget, CancellationToken cancel) {
        List<Path> files;
        try {
            files = listFiles(folder);
        } catch (IOException | SecurityException e) {
            onFailure(folder.toString(), e, budget);
            recovery.logSkippedItem(folder.toString(), "Falha ao varrer pasta: " + reasonOf(e));
            return FolderInfo.empty();
        }

        List<String> paths = new ArrayList<>(files.size());
        long totalSize = 0;
        Instant latest = null;
        for (Path file : files) {
            cancel.throwIfCancellationRequested();
            String name = file.toString();
            paths.add(name);
            try {
                FileMetadata meta = fileAccess.stat(file);
                cache.putMetadata(name, meta);
                totalSize += meta.size();
                if (meta.lastWriteTime() != null && (latest == null || meta.lastWriteTime().isAfter(latest))) {
                    latest = meta.lastWriteTime();
                }
            } catch (IOException | SecurityException e) {
                onFailure(name, e, budget);
                recovery.logSkippedItem(name, "Falha ao acessar arquivo: " + reasonOf(e));
            }
        }
        return new FolderInfo(paths, totalSize, latest);
    }

    // DirectoryIteratorException embrulha o erro de I/O ocorrido no meio da listagem
    private List<Path> listDirectories(Path dir) throws IOException {
        try {
            return fileAccess.listDirectories(dir);
        } catch (DirectoryIteratorException e) {
            throw e.getCause();
        }
    }

    private List<Path> listFiles(Path dir) throws IOException {
        try {
            return fileAccess.listFiles(dir);
        } catch (DirectoryIteratorException e) {
            throw e.getCause();
        }
    }

    private void onFailure(String path, Throwable error, WorkerBudget budget) {
        FsError classified = FsError.classify(path, error);
        if (classified.kind() == ErrorKind.CANCELLED) {
            throw new CancellationException("Interrompido lendo " + path);
        }
        RecoveryAction action = recovery.handleFileAccessError(classified);
        RecoveryActions.enforce(action, budget, error);
    }

    private Path validateFolder(String folder) throws IOException {
        if (folder == null || folder.isBlank()) {
            throw new IllegalArgumentException("Caminho nao pode ser vazio");
        }
        Path path;
        try {
            path = Path.of(folder);
        } catch (InvalidPathException e) {
            throw new NoSuchFileException(folder, null, e.getMessage());
        }
        if (!fileAccess.exists(path)) throw new NoSuchFileException(folder);
        if (!fileAccess.isDirectory(path)) throw new NotDirectoryException(folder);
        return path;
    }

    private static String reasonOf(Throwable e) {
        String msg = e.getMessage();
        return e.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
    }
}
