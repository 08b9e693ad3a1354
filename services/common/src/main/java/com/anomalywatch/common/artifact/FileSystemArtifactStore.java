package com.anomalywatch.common.artifact;

import com.anomalywatch.common.exception.ArtifactStoreException;
import lombok.extern.slf4j.Slf4j;
import weka.core.SerializationHelper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Artifact store backed by one serialized file per key in a directory.
 *
 * <p>Writes go to a temporary file in the same directory which is then moved
 * over the target, so readers never observe a partially written artifact.
 */
@Slf4j
public class FileSystemArtifactStore implements ArtifactStore {

    private final Path directory;

    public FileSystemArtifactStore(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
    }

    @Override
    public void save(ArtifactKey key, Serializable artifact) {
        Path target = pathOf(key);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, key.fileName(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                SerializationHelper.write(out, artifact);
            }
            moveIntoPlace(temp, target);
            log.info("Saved artifact {} -> {}", key.logicalName(), target);
        } catch (Exception e) {
            deleteQuietly(temp);
            throw new ArtifactStoreException("Failed to save artifact " + key.logicalName() + " to " + target, e);
        }
    }

    @Override
    public Optional<Object> load(ArtifactKey key) {
        Path source = pathOf(key);
        if (!Files.isRegularFile(source)) {
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(source)) {
            return Optional.of(SerializationHelper.read(in));
        } catch (Exception e) {
            throw new ArtifactStoreException("Failed to read artifact " + key.logicalName() + " from " + source, e);
        }
    }

    @Override
    public boolean contains(ArtifactKey key) {
        return Files.isRegularFile(pathOf(key));
    }

    @Override
    public String location() {
        return directory.toString();
    }

    Path pathOf(ArtifactKey key) {
        return directory.resolve(key.fileName());
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary artifact file {}", temp, e);
        }
    }
}
