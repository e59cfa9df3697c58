package com.foldermatch.app.detail;

import com.foldermatch.app.cache.CacheStore;
import com.foldermatch.app.fs.CountingFileAccess;
import com.foldermatch.app.model.FileDetail;
import com.foldermatch.app.model.FileMatch;
import com.foldermatch.app.model.FileMetadata;
import com.foldermatch.app.model.FolderInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static com.foldermatch.app.TestTrees.file;
import static org.junit.jupiter.api.Assertions.*;

public class FileDetailBuilderTest {

    @TempDir
    Path tmp;

    @Test
    void build_listsUnionOfNamesWithDuplicateFlags() throws Exception {
        Path left = tmp.resolve("left");
        Path right = tmp.resolve("right");
        Path shared = file(left, "Shared.txt", "same");
        Path sharedR = file(right, "shared.TXT", "same");
        Path onlyLeft = file(left, "alpha.txt", "a");
        Path onlyRight = file(right, "zeta.txt", "zz");

        CountingFileAccess fs = new CountingFileAccess();
        CacheStore cache = new CacheStore(fs);
        cache.put(left.toString(), new FolderInfo(List.of(shared.toString(), onlyLeft.toString()), 5, null));
        cache.put(right.toString(), new FolderInfo(List.of(sharedR.toString(), onlyRight.toString()), 6, null));
        cache.putMetadata(shared.toString(), new FileMetadata("Shared.txt", 4, Instant.EPOCH));

        List<FileDetail> rows = new FileDetailBuilder(fs).build(left.toString(), right.toString(),
                List.of(FileMatch.of(shared.toString(), sharedR.toString())), cache);

        assertEquals(List.of("alpha.txt", "Shared.txt", "zeta.txt"), rows.stream().map(FileDetail::fileName).toList());

        FileDetail dup = rows.get(1);
        assertTrue(dup.duplicate());
        assertTrue(dup.hasLeft() && dup.hasRight());
        assertEquals(Instant.EPOCH, dup.left().lastWriteTime(), "cached metadata wins");
        assertEquals(4, dup.right().sizeBytes(), "filesystem fallback");

        assertFalse(rows.get(0).duplicate());
        assertFalse(rows.get(0).hasRight());
        assertFalse(rows.get(2).hasLeft());

        assertEquals(List.of(dup), FileDetailBuilder.filter(rows, false));
        assertEquals(rows, FileDetailBuilder.filter(rows, true));
    }

    @Test
    void build_marksVanishedFilesAsNotAvailable() {
        CacheStore cache = new CacheStore();
        String missing = tmp.resolve("l").resolve("gone.bin").toString();
        cache.put(tmp.resolve("l").toString(), new FolderInfo(List.of(missing), 0, null));

        List<FileDetail> rows = new FileDetailBuilder(new CountingFileAccess())
                .build(tmp.resolve("l").toString(), tmp.resolve("r").toString(), List.of(), cache);

        assertEquals(1, rows.size());
        assertFalse(rows.get(0).left().available());
        assertEquals(-1, rows.get(0).left().sizeBytes());
        assertTrue(rows.get(0).left().lastWrite().isEmpty());
    }
}
