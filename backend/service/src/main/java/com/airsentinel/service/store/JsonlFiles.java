package com.airsentinel.service.store;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Line-oriented JSON files shared by the series and event stores. Callers serialize their own
 * writers; nothing here locks.
 */
final class JsonlFiles {
    private JsonlFiles() {
    }

    static void append(Path file, List<String> lines) {
        if (lines.isEmpty()) {
            return;
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                for (String line : lines) {
                    writer.write(line);
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending to " + file, e);
        }
    }

    /**
     * Streams the non-blank lines of {@code file} with their 1-based line numbers. A missing file
     * has no lines.
     */
    static void forEachLine(Path file, LineHandler handler) {
        if (!Files.exists(file)) {
            return;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            int lineNumber = 0;
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (!line.isBlank()) {
                    handler.handle(lineNumber, line);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading " + file, e);
        }
    }

    @FunctionalInterface
    interface LineHandler {
        void handle(int lineNumber, String line);
    }
}
