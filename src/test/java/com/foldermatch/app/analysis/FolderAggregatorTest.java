package com.foldermatch.app.analysis;

import com.foldermatch.app.cache.CacheStore;
import com.foldermatch.app.concurrent.CancellationToken;
import com.foldermatch.app.model.AnalysisProgress;
import com.foldermatch.app.model.FileMatch;
import com.foldermatch.app.model.FilterCriteria;
import com.foldermatch.app.model.FolderInfo;
import com.foldermatch.app.model.FolderMatch;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

public class FolderAggregatorTest {

    private static final Instant T = Instant.parse("2023-05-01T10:00:00Z");

    private final FolderAggregator aggregator = new FolderAggregator();

    private static CacheStore cacheWith(String folder, int files, long size, Instant date) {
        CacheStore cache = new CacheStore();
        put(cache, folder, files, size, date);
        return cache;
    }

    private static void put(CacheStore cache, String folder, int files, long size, Instant date) {
        List<String> paths = new ArrayList<>();
        for (int i = 0; i < files; i++) paths.add(folder + "/f" + i);
        cache.put(folder, new FolderInfo(paths, size, date));
    }

    @Test
    void aggregate_groupsByFolderPairAndScores() {
        CacheStore cache = cacheWith("/x/a", 4, 4096, T);
        put(cache, "/x/b", 3, 999, null);
        put(cache, "/x/c", 2, 10, null);

        List<FileMatch> matches = List.of(
                FileMatch.of("/x/a/f0", "/x/b/f0"),
                FileMatch.of("/x/b/f1", "/x/a/f1"),
                FileMatch.of("/x/a/f0", "/x/c/f0"),
                FileMatch.of("/x/a/f1", "/x/c/f1"));

        List<FolderMatch> result = aggregator.aggregate(matches, cache);

        assertEquals(2, result.size());
        FolderMatch best = result.get(0);
        assertEquals("/x/a", best.leftFolder());
        assertEquals("/x/c", best.rightFolder());
        assertEquals(50.0, best.similarityPercentage(), 1e-9);   // 2 / (4 + 2 - 2)

        FolderMatch ab = result.get(1);
        assertEquals("/x/b", ab.rightFolder());
        assertEquals(2, ab.duplicateFiles().size(), "reversed pair lands in the same group");
        assertEquals(40.0, ab.similarityPercentage(), 1e-9);
        assertEquals(4096, ab.folderSizeBytes());
        assertEquals(T, ab.latestModificationDate().orElseThrow());
    }

    @Test
    void aggregate_unknownFoldersCountAsEmpty() {
        List<FolderMatch> result = aggregator.aggregate(List.of(FileMatch.of("/p/x", "/q/x")), new CacheStore());
        assertEquals(1, result.size());
        assertEquals(0.0, result.get(0).similarityPercentage(), 1e-9);
        assertTrue(result.get(0).latestModificationDate().isEmpty());
    }

    @Test
    void aggregateAsync_reportsProgressEndingInComplete() throws Exception {
        List<AnalysisProgress> progress = new ArrayList<>();
        CompletableFuture<List<FolderMatch>> future = aggregator.aggregateAsync(
                List.of(FileMatch.of("/p/x", "/q/x")), cacheWith("/p", 1, 1, T), progress::add);

        assertEquals(1, future.get().size());
        assertTrue(progress.get(progress.size() - 1).isComplete());
    }

    @Test
    void aggregate_emptyInputIsEmptyResult() {
        assertTrue(aggregator.aggregate(List.of(), new CacheStore()).isEmpty());
    }

    @Test
    void aggregate_cancelledBeforeStart() {
        CancellationToken cancel = CancellationToken.create();
        cancel.cancel();

        assertThrows(CancellationException.class,
                () -> aggregator.aggregate(List.of(FileMatch.of("/p/x", "/q/x")), new CacheStore(), null, cancel));
        CompletableFuture<List<FolderMatch>> future = aggregator.aggregateAsync(List.of(), new CacheStore(), null, cancel);
        assertThrows(CancellationException.class, future::get);
        assertTrue(future.isCancelled());
    }

    @Test
    void aggregateAsync_cancelledWhileQueued_failsTheSameWay() {
        CancellationToken cancel = CancellationToken.create();
        // the token fires after the call returns but before the work starts
        FolderAggregator late = new FolderAggregator(task -> {
            cancel.cancel();
            task.run();
        });

        CompletableFuture<List<FolderMatch>> future =
                late.aggregateAsync(List.of(FileMatch.of("/p/x", "/q/x")), new CacheStore(), null, cancel);

        assertThrows(CancellationException.class, future::get);
        assertTrue(future.isCancelled());
    }

    @Test
    void applyFilters_isPureAndKeepsOrder() {
        CacheStore cache = cacheWith("/a", 2, 5_000_000, T);
        put(cache, "/c", 2, 10, T);
        List<FolderMatch> all = new ArrayList<>(aggregator.aggregate(List.of(
                FileMatch.of("/a/f0", "/b/f0"),
                FileMatch.of("/a/f1", "/b/f1"),
                FileMatch.of("/c/f0", "/d/f0")), cache));
        List<FolderMatch> before = List.copyOf(all);

        List<FolderMatch> filtered = FolderAggregator.applyFilters(all, FilterCriteria.defaults().withMinimumSimilarity(0));

        assertEquals(before, all, "input untouched");
        assertEquals(1, filtered.size());
        assertEquals("/a", filtered.get(0).leftFolder());
        assertEquals(filtered, FolderAggregator.applyFilters(all, FilterCriteria.defaults().withMinimumSimilarity(0)));
        assertTrue(FolderAggregator.applyFilters(null, FilterCriteria.defaults()).isEmpty());
    }
}
