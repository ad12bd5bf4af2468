package ai.pokercoach.solver.texas;

import java.time.Duration;

/**
 * Captured output of one finished solver process.
 *
 * @param exitCode process exit status
 * @param stdout console output (progress and exploitability lines)
 * @param stderr error output
 * @param resultJson content of the dumped result file, or null if the process wrote none
 * @param elapsed wall-clock run time
 */
public record RawOutput(int exitCode, String stdout, String stderr, String resultJson, Duration elapsed) {

    public RawOutput {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }
}
