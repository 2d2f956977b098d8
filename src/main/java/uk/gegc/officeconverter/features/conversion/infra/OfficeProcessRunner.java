package uk.gegc.officeconverter.features.conversion.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command inside a work directory with a hard time limit.
 * Output goes to a log file in that directory so a chatty process can never block on a full pipe.
 */
@Component
@Slf4j
public class OfficeProcessRunner {

    static final String PROCESS_LOG = "process.log";
    private static final int MAX_OUTPUT_CHARS = 2000;
    private static final long KILL_GRACE_SECONDS = 5;

    public ProcessOutcome run(List<String> command, Path workDirectory, Duration timeout)
            throws IOException, InterruptedException {
        Path logFile = workDirectory.resolve(PROCESS_LOG);
        ProcessBuilder builder = new ProcessBuilder(command)
                .directory(workDirectory.toFile())
                .redirectErrorStream(true)
                .redirectOutput(logFile.toFile());

        log.debug("Starting process: {}", String.join(" ", command));
        Process process = builder.start();
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Process {} (pid {}) exceeded {}s, killing it", command.get(0), process.pid(), timeout.toSeconds());
                kill(process);
                return ProcessOutcome.timedOut(readOutput(logFile));
            }
        } catch (InterruptedException e) {
            kill(process);
            throw e;
        }

        int exitCode = process.exitValue();
        log.debug("Process {} exited with {}", command.get(0), exitCode);
        return new ProcessOutcome(exitCode, readOutput(logFile), false);
    }

    private void kill(Process process) throws InterruptedException {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        if (!process.waitFor(KILL_GRACE_SECONDS, TimeUnit.SECONDS)) {
            log.error("Process {} did not terminate after being killed", process.pid());
        }
    }

    private String readOutput(Path logFile) {
        if (!Files.exists(logFile)) {
            return "";
        }
        try {
            String output = new String(Files.readAllBytes(logFile), StandardCharsets.UTF_8).trim();
            return output.length() > MAX_OUTPUT_CHARS ? output.substring(0, MAX_OUTPUT_CHARS) + "..." : output;
        } catch (IOException e) {
            log.warn("Could not read process output {}: {}", logFile, e.getMessage());
            return "";
        }
    }
}
