package com.foldermatch.app.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FolderMatchTest {

    @Test
    void similarity_matchesJaccardIndex() {
        assertEquals(40.0, FolderMatch.similarity(2, 4, 3), 1e-9);
        assertEquals(100.0, FolderMatch.similarity(1, 1, 1), 1e-9);
        assertEquals(100.0 / 11.0, FolderMatch.similarity(1, 2, 10), 1e-9);
    }

    @Test
    void similarity_identicalSetsIs100_disjointIs0_emptyIs0() {
        assertEquals(100.0, FolderMatch.similarity(5, 5, 5), 1e-9);
        assertEquals(0.0, FolderMatch.similarity(0, 3, 4), 1e-9);
        assertEquals(0.0, FolderMatch.similarity(0, 0, 0), 1e-9);
    }

    @Test
    void similarity_isClampedWhenCountsAreInconsistent() {
        // more duplicates than files on either side (stale cache)
        double s = FolderMatch.similarity(5, 2, 2);
        assertTrue(s >= 0.0 && s <= 100.0);
        assertEquals(0.0, FolderMatch.similarity(3, 1, 1), 1e-9);
    }

    @Test
    void constructor_derivesSimilarityFromDuplicateCount() {
        List<FileMatch> dups = List.of(
                FileMatch.of("/a/x.txt", "/b/x.txt"),
                FileMatch.of("/a/y.txt", "/b/y.txt"));
        FolderMatch m = new FolderMatch("/a", "/b", dups, 4, 3, 1234, Instant.EPOCH);

        assertEquals(40.0, m.similarityPercentage(), 1e-9);
        assertEquals("a", m.folderName());
        assertEquals(Instant.EPOCH, m.latestModificationDate().orElseThrow());
        assertThrows(UnsupportedOperationException.class, () -> m.duplicateFiles().clear());
    }

    @Test
    void fileMatch_isCanonicalRegardlessOfArgumentOrder() {
        FileMatch one = FileMatch.of("/root/B/file.txt", "/root/a/file.txt");
        FileMatch two = FileMatch.of("/root/a/file.txt", "/root/B/file.txt");

        assertEquals(one, two);
        assertEquals("/root/a/file.txt", one.pathA());
        assertEquals("/root/a", one.folderA());
        assertEquals("/root/B", one.folderB());
    }
}
