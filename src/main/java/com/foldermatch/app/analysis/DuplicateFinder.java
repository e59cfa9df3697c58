package com.foldermatch.app.analysis;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.foldermatch.app.cache.CacheStore;
import com.foldermatch.app.cache.PathKeys;
import com.foldermatch.app.concurrent.BoundedWorkerPool;
import com.foldermatch.app.concurrent.CancellationToken;
import com.foldermatch.app.concurrent.ProgressReporter;
import com.foldermatch.app.concurrent.WorkerBudget;
import com.foldermatch.app.config.AnalysisSettings;
import com.foldermatch.app.fs.ErrorKind;
import com.foldermatch.app.fs.FsError;
import com.foldermatch.app.model.AnalysisPhase;
import com.foldermatch.app.model.AnalysisProgress;
import com.foldermatch.app.model.FileMatch;
import com.foldermatch.app.model.FileMetadata;
import com.foldermatch.app.model.RecoveryAction;
import com.foldermatch.app.model.RecoveryActionType;
import com.foldermatch.app.recovery.ErrorRecoveryService;
import com.foldermatch.app.recovery.RecoveryActions;

/**
 * Encontra arquivos de conteudo identico em pastas diferentes.
 *
 * Trabalha so com o cache, exceto no hash: arquivos sao agrupados por (nome minusculo, tamanho),
 * grupos presentes em uma unica pasta sao descartados e os restantes confirmados por SHA-256.
 */
public class DuplicateFinder {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateFinder.class);

    static final int INDEX_REPORT_EVERY_FILES = 100;
    static final int GROUP_REPORT_EVERY_FILES = 50;
    static final int HASH_REPORT_EVERY_GROUPS = 10;

    private static final String NO_HASH = "";

    private final CacheStore cache;
    private final ErrorRecoveryService recovery;
    private final FileHasher hasher;
    private final AnalysisSettings settings;

    public DuplicateFinder(CacheStore cache, ErrorRecoveryService recovery, FileHasher hasher, AnalysisSettings settings) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.recovery = Objects.requireNonNull(recovery, "recovery");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    record CandidateKey(String name, long size) {
        static CandidateKey of(FileMetadata meta) {
            return new CandidateKey(meta.fileName().toLowerCase(Locale.ROOT), meta.size());
        }
    }

    /**
     * @param folders pastas em cache a comparar entre si
     * @throws CancellationException o token disparou
     * @throws com.foldermatch.app.concurrent.AnalysisAbortedException a politica de recuperacao mandou parar
     */
    public List<FileMatch> findDuplicates(List<String> folders, Consumer<AnalysisProgress> progressSink,
                                          CancellationToken cancel) {
        cancel.throwIfCancellationRequested();
        ProgressReporter progress = ProgressReporter.of(progressSink);
        long start = System.nanoTime();

        Map<CandidateKey, Set<String>> index = buildIndex(folders, progress, cancel);
        cancel.throwIfCancellationRequested();

        List<List<String>> groups = groupCandidates(index, folders.size(), progress, cancel);
        if (groups.isEmpty()) {
            progress.complete(0, "Nenhum possivel arquivo duplicado encontrado");
            logger.info("Busca de duplicados em {} pastas: nenhum candidato", folders.size());
            return List.of();
        }

        List<FileMatch> matches = confirmByHash(groups, progress, cancel);

        progress.complete(matches.size(), "Encontrados " + matches.size() + " arquivos duplicados");
        logger.info("Busca de duplicados em {} pastas: {} grupos candidatos, {} duplicados em {} ms",
                folders.size(), groups.size(), matches.size(), (System.nanoTime() - start) / 1_000_000);
        return matches;
    }

    private Map<CandidateKey, Set<String>> buildIndex(List<String> folders, ProgressReporter progress,
                                                      CancellationToken cancel) {
        int total = folders.size();
        progress.report(AnalysisPhase.BUILDING_FILE_INDEX, 0, total,
                "Organizando dados de arquivos de " + total + " pastas em cache...");

        Map<CandidateKey, Set<String>> index = new LinkedHashMap<>();
        int filesSeen = 0;
        int foldersDone = 0;
        for (String folder : folders) {
            cancel.throwIfCancellationRequested();
            for (String file : cache.getFolderFiles(folder)) {
                FileMetadata meta = cache.getMetadata(file).orElse(null);
                if (meta == null) {
                    recovery.logSkippedItem(file, "Sem metadados em cache");
                } else {
                    index.computeIfAbsent(CandidateKey.of(meta), k -> new LinkedHashSet<>()).add(folder);
                }
                if (++filesSeen % INDEX_REPORT_EVERY_FILES == 0) {
                    cancel.throwIfCancellationRequested();
                    progress.report(AnalysisPhase.BUILDING_FILE_INDEX, foldersDone, total,
                            "Organizando dados de arquivos: " + filesSeen + " arquivos...");
                }
            }
            foldersDone++;
        }
        progress.report(AnalysisPhase.BUILDING_FILE_INDEX, total, total,
                "Indexados " + filesSeen + " arquivos em " + total + " pastas");
        return index;
    }

    /**
     * Reexpande cada grupo com mais de uma pasta nos caminhos dos arquivos. O progresso continua o
     * contador do indice, entao nunca volta dentro da fase.
     */
    private List<List<String>> groupCandidates(Map<CandidateKey, Set<String>> index, int folderCount,
                                               ProgressReporter progress, CancellationToken cancel) {
        List<Map.Entry<CandidateKey, Set<String>>> buckets = new ArrayList<>();
        for (Map.Entry<CandidateKey, Set<String>> e : index.entrySet()) {
            if (e.getValue().size() > 1) buckets.add(e);
        }
        int totalGroups = buckets.size();
        int max = folderCount + totalGroups;
        progress.report(AnalysisPhase.BUILDING_FILE_INDEX, folderCount, max,
                "Agrupando " + totalGroups + " grupos de possiveis duplicados...");

        List<List<String>> groups = new ArrayList<>();
        int filesSeen = 0;
        int groupsDone = 0;
        for (Map.Entry<CandidateKey, Set<String>> bucket : buckets) {
            cancel.throwIfCancellationRequested();
            CandidateKey key = bucket.getKey();

            Set<String> seen = new HashSet<>();
            List<String> files = new ArrayList<>();
            for (String folder : bucket.getValue()) {
                for (String file : cache.getFolderFiles(folder)) {
                    FileMetadata meta = cache.getMetadata(file).orElse(null);
                    if (meta != null && key.equals(CandidateKey.of(meta)) && seen.add(PathKeys.normalize(file))) {
                        files.add(file);
                    }
                    if (++filesSeen % GROUP_REPORT_EVERY_FILES == 0) {
                        cancel.throwIfCancellationRequested();
                        progress.report(AnalysisPhase.BUILDING_FILE_INDEX, folderCount + groupsDone, max,
                                "Agrupando duplicados: " + (groupsDone + 1) + "/" + totalGroups + " grupos ("
                                        + filesSeen + " arquivos processados)...");
                    }
                }
            }
            if (files.size() > 1) groups.add(files);

            groupsDone++;
            progress.report(AnalysisPhase.BUILDING_FILE_INDEX, folderCount + groupsDone, max,
                    "Agrupando possiveis duplicados: " + groupsDone + "/" + totalGroups + " grupos...");
        }
        logger.debug("Agrupamento de candidatos: {} baldes -> {} grupos", totalGroups, groups.size());
        return groups;
    }

    private List<FileMatch> confirmByHash(List<List<String>> groups, ProgressReporter progress,
                                          CancellationToken cancel) {
        int total = groups.size();
        progress.report(AnalysisPhase.COMPARING_FILES, 0, total,
                "Comparando " + total + " grupos de possiveis duplicados...");

        WorkerBudget budget = new WorkerBudget(settings.maxParallelism());
        BoundedWorkerPool pool = new BoundedWorkerPool("foldermatch-hash-", budget);
        ConcurrentLinkedQueue<FileMatch> matches = new ConcurrentLinkedQueue<>();
        AtomicInteger done = new AtomicInteger();

        pool.runAll(groups, group -> {
            compareGroup(group, matches, budget, cancel);
            int n = done.incrementAndGet();
            if (n % HASH_REPORT_EVERY_GROUPS == 0 || n == total) {
                progress.report(AnalysisPhase.COMPARING_FILES, n, total,
                        "Processados " + n + " de " + total + " grupos... (" + matches.size() + " correspondencias)");
            }
        }, cancel);

        List<FileMatch> out = new ArrayList<>(matches);
        out.sort(Comparator.comparing((FileMatch m) -> PathKeys.normalize(m.pathA()))
                .thenComparing(m -> PathKeys.normalize(m.pathB())));
        return out;
    }

    private void compareGroup(List<String> group, ConcurrentLinkedQueue<FileMatch> matches, WorkerBudget budget,
                              CancellationToken cancel) {
        cancel.throwIfCancellationRequested();
        Map<String, String> hashes = new HashMap<>();
        for (int i = 0; i < group.size(); i++) {
            String a = group.get(i);
            for (int j = i + 1; j < group.size(); j++) {
                String b = group.get(j);
                if (PathKeys.sameFolder(a, b)) continue;

                String hashA = hashes.computeIfAbsent(a, f -> hashOf(f, budget, cancel));
                if (hashA.isEmpty()) break;
                String hashB = hashes.computeIfAbsent(b, f -> hashOf(f, budget, cancel));
                if (!hashB.isEmpty() && hashA.equals(hashB)) {
                    matches.add(FileMatch.of(a, b));
                }
            }
        }
    }

    /**
     * Hash do cache, ou calculado na hora (e guardado). Falhas passam pela politica de recuperacao e
     * devolvem o sentinela vazio; retry e pausa sao respeitados um numero limitado de vezes.
     */
    String hashOf(String file, WorkerBudget budget, CancellationToken cancel) {
        String cached = cache.getHash(file).orElse(null);
        if (cached != null) return cached;

        int attempts = 0;
        while (true) {
            cancel.throwIfCancellationRequested();
            try {
                String hash = hasher.hash(Path.of(file));
                cache.putHash(file, hash);
                return hash;
            } catch (IOException | SecurityException | InvalidPathException e) {
                FsError error = FsError.classify(file, e);
                if (error.kind() == ErrorKind.CANCELLED) {
                    throw new CancellationException("Interrompido calculando hash de " + file);
                }
                RecoveryAction action = recovery.handleFileAccessError(error);
                RecoveryActions.enforce(action, budget, e);
                if (isRetryable(action) && attempts < settings.maxHashRetries()) {
                    attempts++;
                    pause(action.retryDelay(), cancel);
                    continue;
                }
                recovery.logSkippedItem(file, "Falha ao calcular hash: " + error.message());
                return NO_HASH;
            }
        }
    }

    private static boolean isRetryable(RecoveryAction action) {
        return action.shouldRetry()
                && (action.type() == RecoveryActionType.RETRY || action.type() == RecoveryActionType.PAUSE_AND_WAIT);
    }

    private void pause(Duration requested, CancellationToken cancel) {
        long remaining = Math.min(requested.toMillis(), settings.retryDelayCap().toMillis());
        try {
            while (remaining > 0) {
                cancel.throwIfCancellationRequested();
                long slice = Math.min(remaining, 50);
                Thread.sleep(slice);
                remaining -= slice;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrompido durante espera de retry");
        }
    }
}
