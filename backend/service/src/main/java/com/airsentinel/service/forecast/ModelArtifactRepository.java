package com.airsentinel.service.forecast;

import com.airsentinel.core.util.JsonUtils;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * One JSON file per city. Saves go through a temp file in the same directory followed by a move
 * over the target, so the previous artifact stays intact until the new one is complete.
 */
public class ModelArtifactRepository {
    private static final Logger LOGGER = Logger.getLogger(ModelArtifactRepository.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path directory;

    public ModelArtifactRepository(Path directory) {
        this.directory = directory;
    }

    public void save(ModelArtifact artifact) {
        Path target = fileFor(artifact.city());
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, artifact);
            }
            moveIntoPlace(temp, target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new IllegalStateException("Failed writing model artifact to " + target, e);
        }
    }

    public List<ModelArtifact> loadAll() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<ModelArtifact> artifacts = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                artifacts.add(read(file));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed listing model artifacts in " + directory, e);
        }
        return artifacts;
    }

    Path fileFor(String city) {
        String slug = city.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        return directory.resolve(slug + ".json");
    }

    private static ModelArtifact read(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return MAPPER.readValue(in, ModelArtifact.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading model artifact from " + file, e);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOGGER.warning(() -> "Atomic move unsupported for " + target + "; falling back to replace");
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupError) {
            LOGGER.warning(() -> "Failed removing temp artifact " + temp + ": " + cleanupError.getMessage());
        }
    }
}
