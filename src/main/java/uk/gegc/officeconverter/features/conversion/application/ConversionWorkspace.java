package uk.gegc.officeconverter.features.conversion.application;

import uk.gegc.officeconverter.features.conversion.domain.ConversionJob;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped owner of one job's work directory. Closing it removes the directory and
 * everything written into it.
 */
public final class ConversionWorkspace implements AutoCloseable {

    private final ConversionJob job;
    private final TempFileManager owner;
    private final AtomicBoolean closed = new AtomicBoolean();

    ConversionWorkspace(ConversionJob job, TempFileManager owner) {
        this.job = job;
        this.owner = owner;
    }

    public ConversionJob job() {
        return job;
    }

    public Path directory() {
        return job.workDirectory();
    }

    public void writeInput(byte[] bytes) throws IOException {
        Files.write(job.inputFile(), bytes);
    }

    public boolean hasOutput() throws IOException {
        return Files.isRegularFile(job.outputFile()) && Files.size(job.outputFile()) > 0;
    }

    public byte[] readOutput() throws IOException {
        return Files.readAllBytes(job.outputFile());
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            owner.release(this);
        }
    }
}
