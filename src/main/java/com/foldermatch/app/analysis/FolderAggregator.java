package com.foldermatch.app.analysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.foldermatch.app.cache.CacheStore;
import com.foldermatch.app.cache.PathKeys;
import com.foldermatch.app.concurrent.CancellationToken;
import com.foldermatch.app.concurrent.ProgressReporter;
import com.foldermatch.app.model.AnalysisPhase;
import com.foldermatch.app.model.AnalysisProgress;
import com.foldermatch.app.model.FileMatch;
import com.foldermatch.app.model.FilterCriteria;
import com.foldermatch.app.model.FolderInfo;
import com.foldermatch.app.model.FolderMatch;

/**
 * Consolida correspondencias de arquivos em correspondencias de pastas e as filtra.
 */
public class FolderAggregator {

    private static final Logger logger = LoggerFactory.getLogger(FolderAggregator.class);

    static final int REPORT_EVERY_GROUPS = 25;

    private final Executor executor;

    public FolderAggregator() {
        this(ForkJoinPool.commonPool());
    }

    public FolderAggregator(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public CompletableFuture<List<FolderMatch>> aggregateAsync(List<FileMatch> fileMatches, CacheStore cache,
                                                               Consumer<AnalysisProgress> progress) {
        return aggregateAsync(fileMatches, cache, progress, CancellationToken.none());
    }

    /**
     * Agrupa por (pasta de pathA, pasta de pathB) e pontua cada par. Contagens, tamanho e data vem
     * do cache; tamanho e data sao os da pasta da esquerda. Resultado ordenado por similaridade,
     * maior primeiro. Com o token disparado o futuro falha com {@link CancellationException}.
     */
    public CompletableFuture<List<FolderMatch>> aggregateAsync(List<FileMatch> fileMatches, CacheStore cache,
                                                               Consumer<AnalysisProgress> progressSink,
                                                               CancellationToken cancel) {
        Objects.requireNonNull(fileMatches, "fileMatches");
        Objects.requireNonNull(cache, "cache");
        if (cancel.isCancellationRequested()) {
            return CompletableFuture.failedFuture(new CancellationException("Operacao cancelada"));
        }
        List<FileMatch> input = List.copyOf(fileMatches);
        // completado a mao: cancelamento no meio sai de get() igual ao cancelamento antecipado
        CompletableFuture<List<FolderMatch>> result = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                result.complete(aggregateNow(input, cache, ProgressReporter.of(progressSink), cancel));
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        return result;
    }

    /**
     * Forma bloqueante de {@link #aggregateAsync(List, CacheStore, Consumer, CancellationToken)}.
     */
    public List<FolderMatch> aggregate(List<FileMatch> fileMatches, CacheStore cache,
                                       Consumer<AnalysisProgress> progress, CancellationToken cancel) {
        try {
            return aggregateAsync(fileMatches, cache, progress, cancel).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrompido durante a consolidacao");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException(cause);
        }
    }

    public List<FolderMatch> aggregate(List<FileMatch> fileMatches, CacheStore cache) {
        return aggregate(fileMatches, cache, null, CancellationToken.none());
    }

    /**
     * Correspondencias que passam em {@code criteria}, na ordem original. A entrada nao e alterada.
     */
    public static List<FolderMatch> applyFilters(List<FolderMatch> matches, FilterCriteria criteria) {
        Objects.requireNonNull(criteria, "criteria");
        if (matches == null || matches.isEmpty()) return List.of();
        return matches.stream().filter(criteria::matches).toList();
    }

    private List<FolderMatch> aggregateNow(List<FileMatch> fileMatches, CacheStore cache, ProgressReporter progress,
                                           CancellationToken cancel) {
        cancel.throwIfCancellationRequested();
        if (fileMatches.isEmpty()) {
            progress.complete(0, "Nenhuma pasta correspondente");
            return List.of();
        }
        progress.indeterminate(AnalysisPhase.AGGREGATING_RESULTS, "Agrupando correspondencias por pasta...");

        Map<String, List<FileMatch>> byPair = new LinkedHashMap<>();
        for (FileMatch m : fileMatches) {
            String left = m.folderA();
            String right = m.folderB();
            if (left.isEmpty() || right.isEmpty()) continue;
            String key = PathKeys.normalize(left) + '\u0000' + PathKeys.normalize(right);
            byPair.computeIfAbsent(key, k -> new ArrayList<>()).add(m);
        }

        int total = byPair.size();
        progress.report(AnalysisPhase.AGGREGATING_RESULTS, 0, total,
                "Criando correspondencias para " + total + " pares de pastas...");

        List<FolderMatch> result = new ArrayList<>(total);
        int processed = 0;
        for (List<FileMatch> duplicates : byPair.values()) {
            cancel.throwIfCancellationRequested();
            FileMatch first = duplicates.get(0);
            FolderInfo left = cache.get(first.folderA()).orElse(FolderInfo.empty());
            FolderInfo right = cache.get(first.folderB()).orElse(FolderInfo.empty());

            result.add(new FolderMatch(first.folderA(), first.folderB(), duplicates,
                    left.fileCount(), right.fileCount(), left.totalSize(), left.latestModificationDate()));

            processed++;
            if (processed % REPORT_EVERY_GROUPS == 0 || processed == total) {
                progress.report(AnalysisPhase.AGGREGATING_RESULTS, processed, total,
                        "Processados " + processed + " de " + total + " pares de pastas...");
            }
        }

        result.sort(Comparator.comparingDouble(FolderMatch::similarityPercentage).reversed());
        progress.complete(result.size(), "Encontradas " + result.size() + " pastas correspondentes");
        logger.info("Consolidadas {} correspondencias de arquivos em {} de pastas", fileMatches.size(), result.size());
        return result;
    }
}
