package ai.pokercoach.solver.texas;

import java.util.List;
import java.util.Objects;

/**
 * Everything needed to run the solver once: the command line, the input script it
 * reads, and the result file it is expected to write. File names are relative to the
 * working directory the runner creates for the process.
 *
 * @param command program and arguments
 * @param inputFileName file the runner writes {@code inputScript} to before starting
 * @param inputScript solver commands, one per line
 * @param resultFileName file read back as the structured result, or null when none is expected
 */
public record ProcessInvocation(List<String> command, String inputFileName, String inputScript,
        String resultFileName) {

    public ProcessInvocation {
        command = List.copyOf(command);
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Command must name a program");
        }
        Objects.requireNonNull(inputFileName, "inputFileName");
        Objects.requireNonNull(inputScript, "inputScript");
    }

    public String program() {
        return command.get(0);
    }
}
