package uk.gegc.officeconverter.features.conversion.infra;

/**
 * Result of one external process run.
 *
 * @param exitCode exit status, or -1 when the process was killed
 * @param output   combined stdout and stderr, truncated
 * @param timedOut whether the process was killed for running too long
 */
public record ProcessOutcome(int exitCode, String output, boolean timedOut) {

    public static ProcessOutcome timedOut(String output) {
        return new ProcessOutcome(-1, output, true);
    }

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
