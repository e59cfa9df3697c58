package com.foldermatch.app;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.foldermatch.app.config.AnalysisSettings;

/**
 * Helpers for building small folder trees in tests.
 */
public final class TestTrees {

    private TestTrees() {}

    public static Path file(Path dir, String name, String content) throws IOException {
        Files.createDirectories(dir);
        return Files.writeString(dir.resolve(name), content, StandardCharsets.UTF_8);
    }

    public static AnalysisSettings settings() {
        return AnalysisSettings.defaults().withMaxParallelism(2);
    }
}
