package ai.pokercoach.solver;

import ai.pokercoach.solver.cache.SolutionCache;
import ai.pokercoach.solver.canonical.CanonicalForm;
import ai.pokercoach.solver.canonical.Canonicalizer;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Bridge that only reads precomputed solutions; it never starts a solver process.
 * A situation without a stored solution is a {@link NotFoundException}.
 * <p>
 * Usage: {@code java -jar engine.jar --spring.profiles.active=solver-precomputed}
 */
@Component
@Profile("solver-precomputed")
public class PrecomputedSolverBridge extends AbstractSolverBridge {

    public PrecomputedSolverBridge(Canonicalizer canonicalizer, SolutionCache cache) {
        super(canonicalizer, cache);
    }

    @Override
    protected Solution canonicalSolution(CanonicalForm form) {
        String key = form.getKey().solutionKey();
        return cache.get(key).orElseThrow(() -> new NotFoundException("No precomputed solution for " + key));
    }
}
