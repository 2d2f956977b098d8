package uk.gegc.officeconverter.features.conversion.infra;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class OfficeProcessRunnerTest {

    private final OfficeProcessRunner runner = new OfficeProcessRunner();

    @TempDir
    Path workDir;

    @Test
    void run_capturesExitCodeAndMergedOutput() throws Exception {
        ProcessOutcome outcome = runner.run(
                List.of("sh", "-c", "echo converting; echo broken >&2; exit 3"), workDir, Duration.ofSeconds(10));

        assertThat(outcome.timedOut()).isFalse();
        assertThat(outcome.exitCode()).isEqualTo(3);
        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.output()).contains("converting").contains("broken");
        assertThat(workDir.resolve(OfficeProcessRunner.PROCESS_LOG)).exists();
    }

    @Test
    void run_runsInsideWorkDirectory() throws Exception {
        ProcessOutcome outcome = runner.run(List.of("sh", "-c", "pwd"), workDir, Duration.ofSeconds(10));

        assertThat(outcome.succeeded()).isTrue();
        assertThat(Path.of(outcome.output()).toRealPath()).isEqualTo(workDir.toRealPath());
    }

    @Test
    void run_killsProcessThatOverrunsTimeout() throws Exception {
        long started = System.nanoTime();

        ProcessOutcome outcome = runner.run(List.of("sleep", "30"), workDir, Duration.ofMillis(300));

        assertThat(outcome.timedOut()).isTrue();
        assertThat(outcome.exitCode()).isEqualTo(-1);
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void run_failsWhenCommandDoesNotExist() {
        assertThatThrownBy(() -> runner.run(List.of("definitely-not-a-real-soffice"), workDir, Duration.ofSeconds(5)))
                .isInstanceOf(IOException.class);
    }
}
