package com.foldermatch.app.session;

import com.foldermatch.app.concurrent.CancellationToken;
import com.foldermatch.app.fs.CountingFileAccess;
import com.foldermatch.app.model.AnalysisProgress;
import com.foldermatch.app.model.FileDetail;
import com.foldermatch.app.model.FilterCriteria;
import com.foldermatch.app.model.FolderMatch;
import com.foldermatch.app.project.ProjectStore;
import com.foldermatch.app.recovery.FakeNetworkProbe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.foldermatch.app.TestTrees.file;
import static com.foldermatch.app.TestTrees.settings;
import static org.junit.jupiter.api.Assertions.*;

public class AnalysisSessionTest {

    @TempDir
    Path tmp;

    private Path left;
    private Path right;
    private AnalysisSession session;

    @BeforeEach
    void setUp() throws Exception {
        left = tmp.resolve("backup1").resolve("photos");
        right = tmp.resolve("backup2").resolve("photos");
        for (Path dir : List.of(left, right)) {
            file(dir, "a.jpg", "picture-a");
            file(dir, "b.jpg", "picture-b");
        }
        file(left, "c.jpg", "only-left");
        session = newSession();
    }

    private static AnalysisSession newSession() {
        return new AnalysisSession(settings(), new CountingFileAccess(), FakeNetworkProbe.local(), new ProjectStore());
    }

    private static final FilterCriteria ALL = new FilterCriteria(0, 0, null, null);

    @Test
    void addTwoRootsAndCompare_findsThePhotoFolders() {
        assertTrue(session.addFolder(tmp.resolve("backup1").toString(), null).isCompleted());
        Outcome<Integer> second = session.addFolder(tmp.resolve("backup2").toString(), null);
        assertEquals(Outcome.Status.COMPLETED, second.status());
        assertEquals(2, second.value());

        session.applyFilters(ALL);
        List<AnalysisProgress> progress = Collections.synchronizedList(new ArrayList<>());
        Outcome<List<FolderMatch>> outcome = session.runComparison(progress::add);

        assertTrue(outcome.isCompleted(), outcome.message());
        List<FolderMatch> matches = outcome.value();
        assertEquals(1, matches.size());
        FolderMatch m = matches.get(0);
        assertEquals(left.toString(), m.leftFolder());
        assertEquals(right.toString(), m.rightFolder());
        assertEquals(200.0 / 3.0, m.similarityPercentage(), 1e-9);
        assertTrue(progress.get(progress.size() - 1).isComplete());

        List<FileDetail> all = session.fileDetails(m, true);
        assertEquals(3, all.size());
        assertEquals(2, session.fileDetails(m, false).size());
    }

    @Test
    void defaultCriteriaHideSmallFolders() {
        session.addFolder(tmp.resolve("backup1").toString(), null);
        session.addFolder(tmp.resolve("backup2").toString(), null);

        Outcome<List<FolderMatch>> outcome = session.runComparison(null);

        assertTrue(outcome.value().isEmpty(), "below 1 MiB");
        assertEquals(1, session.allMatches().size());
        assertEquals(1, session.applyFilters(ALL).size());
        assertEquals(ALL, session.criteria());
    }

    @Test
    void addFolder_rejectsBlankDuplicateAndMissing() {
        assertEquals(Outcome.Status.FAILED, session.addFolder(" ", null).status());
        assertEquals(Outcome.Status.FAILED, session.addFolder(tmp.resolve("nope").toString(), null).status());

        String root = tmp.resolve("backup1").toString();
        assertTrue(session.addFolder(root, null).isCompleted());
        assertEquals(Outcome.Status.FAILED, session.addFolder(root + "/", null).status());
        assertEquals(List.of(root), session.roots());
    }

    @Test
    void comparisonNeedsTwoFolders() {
        session.addFolder(left.toString(), null);
        Outcome<List<FolderMatch>> outcome = session.runComparison(null);
        assertEquals(Outcome.Status.FAILED, outcome.status());
        assertTrue(outcome.message().contains("ao menos 2"));
    }

    @Test
    void cancelledTokens_yieldCancelledOutcomes() {
        CancellationToken cancel = CancellationToken.create();
        cancel.cancel();

        assertEquals(Outcome.Status.CANCELLED, session.addFolder(tmp.resolve("backup1").toString(), null, cancel).status());
        assertTrue(session.roots().isEmpty());

        session.addFolder(tmp.resolve("backup1").toString(), null);
        session.addFolder(tmp.resolve("backup2").toString(), null);
        assertEquals(Outcome.Status.CANCELLED, session.runComparison(null, cancel).status());
        assertFalse(session.isBusy());
    }

    @Test
    void elapsedScanTimeout_yieldsTimedOut() {
        AnalysisSession quick = new AnalysisSession(settings().withScanTimeout(Duration.ofNanos(1)),
                new CountingFileAccess(), FakeNetworkProbe.local(), new ProjectStore());
        assertEquals(Outcome.Status.TIMED_OUT, quick.addFolder(tmp.resolve("backup1").toString(), null).status());
    }

    @Test
    void hungListing_isCutOffByTheScanTimeout() {
        CountingFileAccess stalled = new CountingFileAccess() {
            @Override
            public List<Path> listDirectories(Path dir) throws IOException {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("listing interrupted");
                }
                return super.listDirectories(dir);
            }
        };
        AnalysisSession quick = new AnalysisSession(settings().withScanTimeout(Duration.ofMillis(200)),
                stalled, FakeNetworkProbe.local(), new ProjectStore());

        long start = System.nanoTime();
        Outcome<Integer> outcome = quick.addFolder(tmp.resolve("backup1").toString(), null);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(Outcome.Status.TIMED_OUT, outcome.status());
        assertTrue(elapsedMs < 2_000, "returned after " + elapsedMs + " ms");
        assertTrue(quick.roots().isEmpty());
        assertFalse(quick.isBusy());
    }

    @Test
    void removeFolder_dropsRootAndItsCache() {
        String root1 = tmp.resolve("backup1").toString();
        String root2 = tmp.resolve("backup2").toString();
        session.addFolder(root1, null);
        session.addFolder(root2, null);

        assertTrue(session.removeFolder(root1 + "/"));
        assertFalse(session.removeFolder("/not/a/root"));
        assertEquals(List.of(root2), session.roots());
        assertFalse(session.cache().isCached(left.toString()));
        assertTrue(session.cache().isCached(right.toString()));
    }

    @Test
    void saveAndLoadProject_restoresRootsAndCache() throws Exception {
        session.addFolder(tmp.resolve("backup1").toString(), null);
        session.addFolder(tmp.resolve("backup2").toString(), null);
        Path project = tmp.resolve("state.fmpz");
        session.saveProject(project);

        AnalysisSession restored = newSession();
        List<String> dropped = restored.loadProject(project);

        assertTrue(dropped.isEmpty());
        assertEquals(session.roots(), restored.roots());
        assertTrue(restored.cache().isCached(left.toString()));

        restored.applyFilters(ALL);
        assertEquals(1, restored.runComparison(null).value().size());
    }

    @Test
    void loadProject_dropsRootsThatNoLongerExist() throws Exception {
        String gone = tmp.resolve("gone").toString();
        Files.createDirectories(Path.of(gone));
        session.addFolder(gone, null);
        session.addFolder(tmp.resolve("backup1").toString(), null);
        Path project = tmp.resolve("state.fmp");
        session.saveProject(project);
        Files.delete(Path.of(gone));

        AnalysisSession restored = newSession();
        assertEquals(List.of(gone), restored.loadProject(project));
        assertEquals(List.of(tmp.resolve("backup1").toString()), restored.roots());
        assertFalse(restored.errorSummary().hasErrors());
    }
}
