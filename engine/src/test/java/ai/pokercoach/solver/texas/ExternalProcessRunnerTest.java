package ai.pokercoach.solver.texas;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.pokercoach.solver.ProcessExecutionException;
import ai.pokercoach.solver.ProcessSpawnException;
import ai.pokercoach.solver.ProcessTimeoutException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ExternalProcessRunner")
@EnabledOnOs({OS.LINUX, OS.MAC})
class ExternalProcessRunnerTest {
    private final ExternalProcessRunner runner = new ExternalProcessRunner(List.of(75, 137));

    @Nested
    @DisplayName("Successful runs")
    class SuccessTests {

        @Test
        void writesInputAndReadsResultFromWorkingDirectory() {
            ProcessInvocation invocation = shell("cat input.txt > output_result.json; echo 'Iter: 5'");
            RawOutput output = runner.run(invocation, Duration.ofSeconds(10));
            assertEquals(0, output.exitCode());
            assertEquals("{\"ok\":true}\n", output.resultJson());
            assertTrue(output.stdout().contains("Iter: 5"));
        }

        @Test
        void missingResultFileIsReportedAsNull() {
            RawOutput output = runner.run(shell("echo done"), Duration.ofSeconds(10));
            assertNull(output.resultJson());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        void nonZeroExitCarriesStatusAndStderr() {
            ProcessExecutionException failure = assertThrows(ProcessExecutionException.class,
                    () -> runner.run(shell("echo 'bad board' >&2; exit 3"), Duration.ofSeconds(10)));
            assertEquals(3, failure.getExitStatus());
            assertTrue(failure.getStderrExcerpt().contains("bad board"));
            assertFalse(failure.isRetryable());
        }

        @Test
        void resourceExhaustionStatusIsRetryable() {
            ProcessExecutionException failure = assertThrows(ProcessExecutionException.class,
                    () -> runner.run(shell("exit 75"), Duration.ofSeconds(10)));
            assertTrue(failure.isRetryable());
        }

        @Test
        void missingBinaryIsASpawnFailure(@TempDir Path dir) {
            ProcessInvocation invocation = new ProcessInvocation(List.of(dir.resolve("texas_solver").toString()),
                    "input.txt", "", "output_result.json");
            ProcessSpawnException failure = assertThrows(ProcessSpawnException.class,
                    () -> runner.run(invocation, Duration.ofSeconds(1)));
            assertFalse(failure.isRetryable());
        }

        @Test
        void nonExecutableBinaryIsASpawnFailure(@TempDir Path dir) throws IOException {
            Path binary = Files.writeString(dir.resolve("texas_solver"), "not a program");
            ProcessInvocation invocation = new ProcessInvocation(List.of(binary.toString()), "input.txt", "", null);
            assertThrows(ProcessSpawnException.class, () -> runner.run(invocation, Duration.ofSeconds(1)));
        }
    }

    @Nested
    @DisplayName("Timeouts")
    class TimeoutTests {

        @Test
        void killsTheProcessTreeAndReportsTimeout() throws InterruptedException {
            String marker = "sleep 47";
            long start = System.nanoTime();
            ProcessTimeoutException failure = assertThrows(ProcessTimeoutException.class,
                    () -> runner.run(shell(marker + " & wait"), Duration.ofMillis(300)));
            long elapsedMillis = (System.nanoTime() - start) / 1_000_000L;

            assertEquals(Duration.ofMillis(300), failure.getTimeout());
            assertTrue(failure.isRetryable());
            assertTrue(elapsedMillis < 300 + 5_000, "took " + elapsedMillis + " ms");
            assertFalse(stillRunning(marker), "a solver process survived the timeout");
        }

        private boolean stillRunning(String marker) throws InterruptedException {
            for (int attempt = 0; attempt < 20; attempt++) {
                boolean alive = ProcessHandle.allProcesses()
                        .filter(ProcessHandle::isAlive)
                        .anyMatch(handle -> handle.info().commandLine().map(line -> line.contains(marker)).orElse(false));
                if (!alive) {
                    return false;
                }
                Thread.sleep(100);
            }
            return true;
        }
    }

    private static ProcessInvocation shell(String script) {
        return new ProcessInvocation(List.of("sh", "-c", script), "input.txt", "{\"ok\":true}\n", "output_result.json");
    }
}
