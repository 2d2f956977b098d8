package uk.gegc.officeconverter.features.conversion.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import uk.gegc.officeconverter.features.conversion.config.ConversionProperties;
import uk.gegc.officeconverter.features.conversion.domain.ConversionException;
import uk.gegc.officeconverter.features.conversion.domain.ConversionJob;
import uk.gegc.officeconverter.features.conversion.domain.ConversionRoute;
import uk.gegc.officeconverter.features.conversion.domain.ConversionStrategy;
import uk.gegc.officeconverter.features.conversion.domain.ConversionTimeoutException;
import uk.gegc.officeconverter.features.conversion.domain.DocumentConverter;
import uk.gegc.officeconverter.shared.config.AsyncConfig;

import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Delegates formats POI cannot read to a headless LibreOffice run.
 *
 * <p>Each run gets its own user profile inside the job directory, so parallel runs do not
 * fight over the default profile lock. Runs execute on the office worker pool.
 */
@Component
@Slf4j
public class LibreOfficeProcessConverter implements DocumentConverter {

    static final String PROFILE_DIRECTORY = "profile";

    private final OfficeProcessRunner processRunner;
    private final ConversionProperties properties;
    private final AsyncTaskExecutor officeTaskExecutor;

    public LibreOfficeProcessConverter(OfficeProcessRunner processRunner,
                                       ConversionProperties properties,
                                       @Qualifier(AsyncConfig.OFFICE_TASK_EXECUTOR) AsyncTaskExecutor officeTaskExecutor) {
        this.processRunner = processRunner;
        this.properties = properties;
        this.officeTaskExecutor = officeTaskExecutor;
    }

    @Override
    public boolean supports(ConversionRoute route) {
        return route.strategy() == ConversionStrategy.OFFICE_PROCESS;
    }

    @Override
    public void convert(ConversionJob job) throws ConversionException {
        List<String> command = buildCommand(job);
        Duration timeout = properties.getOffice().getTimeout();
        log.info("Running LibreOffice for {} -> {}", job.originalFilename(), job.route().target().extension());

        Future<ProcessOutcome> future;
        try {
            future = officeTaskExecutor.submit(() -> processRunner.run(command, job.workDirectory(), timeout));
        } catch (TaskRejectedException e) {
            throw new ConversionException("Office conversion queue is full", e);
        }

        // The run timeout starts once a worker picks the task up; queueing is bounded separately.
        Duration maxWait = timeout.plus(properties.getOffice().getQueueWait());
        ProcessOutcome outcome;
        try {
            outcome = future.get(maxWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ConversionException("Interrupted while waiting for LibreOffice", e);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ConversionTimeoutException("LibreOffice did not finish within " + maxWait.toSeconds() + "s including queue wait");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ConversionException("Failed to start LibreOffice: " + cause.getMessage(), cause);
        }

        if (outcome.timedOut()) {
            throw new ConversionTimeoutException("LibreOffice did not finish within " + timeout.toSeconds() + "s");
        }
        if (!outcome.succeeded()) {
            throw new ConversionException("LibreOffice exited with code " + outcome.exitCode() + ": " + outcome.output());
        }
        if (!Files.isRegularFile(job.outputFile())) {
            throw new ConversionException("LibreOffice did not produce an output file: " + outcome.output());
        }
    }

    List<String> buildCommand(ConversionJob job) {
        String profileUri = job.workDirectory().resolve(PROFILE_DIRECTORY).toUri().toString();
        return List.of(
                properties.getOffice().getCommand(),
                "--headless",
                "--norestore",
                "--nologo",
                "-env:UserInstallation=" + profileUri,
                "--convert-to", job.route().target().extension(),
                "--outdir", job.workDirectory().toString(),
                job.inputFile().toString()
        );
    }
}
