package com.stockneuro.backend.forecasting.registry;

import com.stockneuro.backend.config.ForecastingProperties;
import com.stockneuro.backend.exception.ArtifactStorageException;
import com.stockneuro.backend.forecasting.adapter.Architecture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;

@Component
@Slf4j
public class FileSystemArtifactStore implements ArtifactStore {

    private final Path root;

    public FileSystemArtifactStore(ForecastingProperties properties) {
        this.root = Paths.get(properties.getRegistry().getArtifactDir()).toAbsolutePath().normalize();
    }

    @Override
    public String store(Architecture architecture, int versionNumber, String runId, byte[] artifact) {
        Path directory = root.resolve(architecture.name().toLowerCase(Locale.ROOT));
        Path target = directory.resolve("v" + versionNumber + "-" + runId + ".bin");
        try {
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, "upload-", ".tmp");
            Files.write(temp, artifact);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new ArtifactStorageException("Failed to write artifact for " + architecture + " v" + versionNumber, ex);
        }
        log.info("Stored {} v{} artifact ({} bytes) at {}", architecture, versionNumber, artifact.length, target);
        return target.toString();
    }

    @Override
    public byte[] load(String artifactRef) {
        Path path = Paths.get(artifactRef).toAbsolutePath().normalize();
        if (!path.startsWith(root)) {
            throw new ArtifactStorageException("Artifact " + artifactRef + " is outside the artifact directory");
        }
        try {
            return Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new ArtifactStorageException("Failed to read artifact " + artifactRef, ex);
        }
    }
}
