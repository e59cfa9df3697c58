package com.foldermatch.app.analysis;

import com.foldermatch.app.cache.CacheStore;
import com.foldermatch.app.concurrent.CancellationToken;
import com.foldermatch.app.fs.CountingFileAccess;
import com.foldermatch.app.model.AnalysisPhase;
import com.foldermatch.app.model.AnalysisProgress;
import com.foldermatch.app.model.FileMatch;
import com.foldermatch.app.recovery.ErrorRecoveryService;
import com.foldermatch.app.recovery.FakeNetworkProbe;
import com.foldermatch.app.scan.FolderScanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;

import static com.foldermatch.app.TestTrees.file;
import static com.foldermatch.app.TestTrees.settings;
import static org.junit.jupiter.api.Assertions.*;

public class DuplicateFinderTest {

    @TempDir
    Path tmp;

    private CountingFileAccess fs;
    private CacheStore cache;
    private ErrorRecoveryService recovery;
    private DuplicateFinder finder;

    @BeforeEach
    void setUp() {
        fs = new CountingFileAccess();
        cache = new CacheStore(fs);
        recovery = new ErrorRecoveryService(FakeNetworkProbe.local(), Duration.ZERO);
        finder = new DuplicateFinder(cache, recovery, new FileHasher(fs), settings());
    }

    private List<String> scan(Path root) throws Exception {
        return new FolderScanner(cache, recovery, fs, settings()).scanHierarchy(root.toString(), null, CancellationToken.none());
    }

    @Test
    void findsIdenticalFilesInDifferentFolders() throws Exception {
        Path root = tmp.resolve("root");
        Path a = root.resolve("a");
        Path b = root.resolve("b");
        file(a, "photo.jpg", "same-bytes");
        file(b, "PHOTO.JPG", "same-bytes");
        file(a, "only-a.txt", "aaa");

        List<AnalysisProgress> progress = Collections.synchronizedList(new ArrayList<>());
        List<FileMatch> matches = finder.findDuplicates(scan(root), progress::add, CancellationToken.none());

        assertEquals(1, matches.size());
        FileMatch m = matches.get(0);
        assertEquals(a.toString(), m.folderA());
        assertEquals(b.toString(), m.folderB());

        AnalysisProgress last = progress.get(progress.size() - 1);
        assertTrue(last.isComplete());
        assertEquals(1, last.current());
        assertTrue(progress.stream().anyMatch(p -> p.phase() == AnalysisPhase.COMPARING_FILES));
    }

    @Test
    void sameNameAndSizeButDifferentContent_isNotAMatch() throws Exception {
        Path root = tmp.resolve("root");
        file(root.resolve("a"), "report.doc", "AAAA");
        file(root.resolve("b"), "report.doc", "BBBB");

        List<FileMatch> matches = finder.findDuplicates(scan(root), null, CancellationToken.none());

        assertTrue(matches.isEmpty());
        assertEquals(2, cache.cachedHashCount());
    }

    @Test
    void filesInTheSameFolderAreNeverCompared() throws Exception {
        Path root = tmp.resolve("root");
        file(root.resolve("a"), "x.txt", "dup");
        file(root.resolve("a"), "X.TXT", "dup");
        file(root.resolve("b"), "y.txt", "dup");

        List<FileMatch> matches = finder.findDuplicates(scan(root), null, CancellationToken.none());

        assertTrue(matches.isEmpty(), "same-folder pairs and differently named files are not candidates");
        assertEquals(0, fs.openCalls.get());
    }

    @Test
    void noMultiFolderBuckets_shortCircuitsWithoutHashing() throws Exception {
        Path root = tmp.resolve("root");
        file(root.resolve("a"), "x.txt", "1");
        file(root.resolve("b"), "y.txt", "22");

        List<AnalysisProgress> progress = new ArrayList<>();
        assertTrue(finder.findDuplicates(scan(root), progress::add, CancellationToken.none()).isEmpty());
        assertEquals(0, fs.openCalls.get());
        assertEquals("Nenhum possivel arquivo duplicado encontrado", progress.get(progress.size() - 1).message());
    }

    @Test
    void cachedHashesAreReused() throws Exception {
        Path root = tmp.resolve("root");
        file(root.resolve("a"), "f.bin", "content");
        file(root.resolve("b"), "f.bin", "content");
        List<String> folders = scan(root);

        finder.findDuplicates(folders, null, CancellationToken.none());
        int opens = fs.openCalls.get();
        assertEquals(2, opens);

        assertEquals(1, finder.findDuplicates(folders, null, CancellationToken.none()).size());
        assertEquals(opens, fs.openCalls.get());
    }

    @Test
    void unreadableFile_isSkippedNotThrown() throws Exception {
        Path root = tmp.resolve("root");
        Path locked = file(root.resolve("a"), "f.bin", "content");
        file(root.resolve("b"), "f.bin", "content");
        List<String> folders = scan(root);
        fs.failOpen(locked, new AccessDeniedException(locked.toString()));

        assertTrue(finder.findDuplicates(folders, null, CancellationToken.none()).isEmpty());
        assertTrue(recovery.getSummary().skippedPaths().contains(locked.toString()));
        assertEquals(1, recovery.getSummary().permissionErrors());
    }

    @Test
    void lockedFile_isRetriedUpToTheConfiguredLimit() throws Exception {
        Path root = tmp.resolve("root");
        Path busy = file(root.resolve("a"), "f.bin", "content");
        file(root.resolve("b"), "f.bin", "content");
        List<String> folders = scan(root);
        fs.failOpen(busy, new FileSystemException(busy.toString(), null, "being used by another process"));

        DuplicateFinder retrying = new DuplicateFinder(cache, recovery, new FileHasher(fs),
                settings().withRetryDelayCap(Duration.ofMillis(1)));
        assertTrue(retrying.findDuplicates(folders, null, CancellationToken.none()).isEmpty());

        // one attempt plus one retry; the pair is dropped before the other side is read
        assertEquals(2, fs.openCalls.get());
        assertTrue(recovery.getSummary().skippedPaths().contains(busy.toString()));
    }

    @Test
    void cancelledBeforeStart_throws() throws Exception {
        Path root = tmp.resolve("root");
        file(root.resolve("a"), "f.bin", "content");
        file(root.resolve("b"), "f.bin", "content");
        List<String> folders = scan(root);
        CancellationToken cancel = CancellationToken.create();
        cancel.cancel();

        assertThrows(CancellationException.class, () -> finder.findDuplicates(folders, null, cancel));
        assertEquals(0, fs.openCalls.get());
    }

    @Test
    void progressNeverMovesBackwardsWithinAPhase() throws Exception {
        Path root = tmp.resolve("root");
        for (int i = 0; i < 30; i++) {
            file(root.resolve("a"), "f" + i + ".txt", "v" + i);
            file(root.resolve("b"), "f" + i + ".txt", "v" + i);
        }
        List<AnalysisProgress> progress = Collections.synchronizedList(new ArrayList<>());
        assertEquals(30, finder.findDuplicates(scan(root), progress::add, CancellationToken.none()).size());

        AnalysisPhase phase = null;
        int last = -1;
        for (AnalysisProgress p : progress) {
            if (p.phase() != phase) {
                phase = p.phase();
                last = p.current();
                continue;
            }
            assertTrue(p.current() >= last, p.toString());
            last = p.current();
        }
    }
}
