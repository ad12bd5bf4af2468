package ai.pokercoach.solver;

import ai.pokercoach.config.SolverProperties;
import ai.pokercoach.game.Situation;
import ai.pokercoach.solver.cache.SolutionCache;
import ai.pokercoach.solver.canonical.CanonicalForm;
import ai.pokercoach.solver.canonical.Canonicalizer;
import ai.pokercoach.solver.texas.CommandBuilder;
import ai.pokercoach.solver.texas.OutputParser;
import ai.pokercoach.solver.texas.ProcessInvocation;
import ai.pokercoach.solver.texas.ProcessRunner;
import ai.pokercoach.solver.texas.RawOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Bridge that answers from the cache and solves misses with the external binary.
 * <p>
 * A miss runs build, run and parse once per canonical key no matter how many callers
 * ask at the same time, and the canonical result is cached for every later caller
 * whose situation canonicalizes to the same key.
 * <p>
 * The cached table is the one at the hero's decision: the parser follows the current
 * street's actions through the solved tree. Spots the binary cannot represent fail with a
 * {@link ConfigurationException} before anything is run.
 * <p>
 * Usage: {@code java -jar engine.jar --spring.profiles.active=solver-live}
 */
@Component
@Profile("solver-live")
public class LiveSolverBridge extends AbstractSolverBridge {
    private static final Logger log = LoggerFactory.getLogger(LiveSolverBridge.class);

    private final CommandBuilder commandBuilder;
    private final ProcessRunner runner;
    private final OutputParser parser;
    private final SolverProperties properties;

    public LiveSolverBridge(Canonicalizer canonicalizer, SolutionCache cache, CommandBuilder commandBuilder,
            ProcessRunner runner, OutputParser parser, SolverProperties properties) {
        super(canonicalizer, cache);
        this.commandBuilder = commandBuilder;
        this.runner = runner;
        this.parser = parser;
        this.properties = properties;
    }

    @Override
    protected Solution canonicalSolution(CanonicalForm form) {
        return cache.getOrCompute(form.getKey().solutionKey(), () -> compute(form));
    }

    /**
     * Solves {@code situation} again and overwrites its cache entry.
     *
     * @return the fresh solution in the caller's real suits
     */
    public Solution refresh(Situation situation) {
        CanonicalForm form = canonicalizer.canonicalize(situation);
        log.info("Refreshing {}", form.getKey().solutionKey());
        return form.toReal(cache.recompute(form.getKey().solutionKey(), () -> compute(form)));
    }

    private Solution compute(CanonicalForm form) {
        ProcessInvocation invocation = commandBuilder.build(form.getSituation());
        log.info("Solving {} (timeout {} s)", form.getKey().solutionKey(), properties.getTimeout().toSeconds());
        RawOutput raw = runner.run(invocation, properties.getTimeout());
        Solution solution = parser.parse(raw, form.getSituation().streetActions());
        log.info("Solved {} in {} ms: {} hands, exploitability {}, {} iterations", form.getKey().solutionKey(),
                raw.elapsed().toMillis(), solution.handCount(), solution.getExploitability(),
                solution.getIterations());
        return solution;
    }
}
