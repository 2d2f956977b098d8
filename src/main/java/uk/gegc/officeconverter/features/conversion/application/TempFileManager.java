package uk.gegc.officeconverter.features.conversion.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import uk.gegc.officeconverter.features.conversion.config.ConversionProperties;
import uk.gegc.officeconverter.features.conversion.domain.ConversionJob;
import uk.gegc.officeconverter.features.conversion.domain.ConversionRoute;
import uk.gegc.officeconverter.features.conversion.domain.UploadName;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Creates one work directory per conversion and removes it when the workspace closes.
 * LibreOffice writes its output and its throwaway user profile into the same directory,
 * so deleting the tree covers every file an attempt can leave behind.
 */
@Component
@Slf4j
public class TempFileManager {

    private static final String WORKSPACE_PREFIX = "convert-";
    private static final String INPUT_NAME = "input";

    private final Path baseDirectory;
    private final AtomicInteger activeWorkspaces = new AtomicInteger();

    @Autowired
    public TempFileManager(ConversionProperties properties) {
        this(Path.of(properties.getTempDir()));
    }

    public TempFileManager(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    /**
     * Opens a workspace for the given upload. Callers must close it, normally with try-with-resources.
     */
    public ConversionWorkspace open(String originalFilename, UploadName uploadName, ConversionRoute route) throws IOException {
        Files.createDirectories(baseDirectory);
        Path directory = Files.createTempDirectory(baseDirectory, WORKSPACE_PREFIX);
        ConversionJob job = new ConversionJob(
                originalFilename,
                uploadName.baseName(),
                route,
                directory,
                directory.resolve(INPUT_NAME + "." + route.extension()),
                directory.resolve(INPUT_NAME + "." + route.target().extension())
        );
        activeWorkspaces.incrementAndGet();
        log.debug("Opened workspace {} for {}", directory, originalFilename);
        return new ConversionWorkspace(job, this);
    }

    void release(ConversionWorkspace workspace) {
        try {
            deleteTree(workspace.directory());
        } finally {
            activeWorkspaces.decrementAndGet();
        }
    }

    public int activeWorkspaces() {
        return activeWorkspaces.get();
    }

    private void deleteTree(Path directory) {
        if (!Files.exists(directory)) {
            log.warn("Temp directory {} was already removed", directory);
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not list temp directory {} for cleanup: {}", directory, e.getMessage());
            return;
        }
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warn("Could not remove temp file {}: {}", path, e.getMessage());
            }
        }
        log.debug("Removed workspace {}", directory);
    }
}
