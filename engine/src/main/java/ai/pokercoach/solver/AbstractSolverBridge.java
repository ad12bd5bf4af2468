package ai.pokercoach.solver;

import ai.pokercoach.game.Hand;
import ai.pokercoach.game.Situation;
import ai.pokercoach.solver.cache.SolutionCache;
import ai.pokercoach.solver.canonical.CanonicalForm;
import ai.pokercoach.solver.canonical.Canonicalizer;

/**
 * Base class for bridges backed by the canonical solution cache.
 * <p>
 * Canonicalizes the request, obtains the canonical-form solution from the subclass,
 * and translates it back through the caller's own suit mapping and stack scale. The
 * mapping is re-derived for every request and never stored.
 */
public abstract class AbstractSolverBridge implements SolverBridge {
    protected final Canonicalizer canonicalizer;
    protected final SolutionCache cache;

    protected AbstractSolverBridge(Canonicalizer canonicalizer, SolutionCache cache) {
        this.canonicalizer = canonicalizer;
        this.cache = cache;
    }

    @Override
    public Solution solve(Situation situation) {
        CanonicalForm form = canonicalizer.canonicalize(situation);
        return form.toReal(canonicalSolution(form));
    }

    @Override
    public Strategy getStrategy(Situation situation, Hand hand) {
        CanonicalForm form = canonicalizer.canonicalize(situation, hand);
        Hand canonicalHand = form.getHand().orElseThrow();
        Strategy canonical = canonicalSolution(form).findStrategy(canonicalHand)
                .orElseThrow(() -> new NotFoundException(
                        "No strategy for hand " + hand + " in " + situation + " (canonical " + form.getKey() + ")"));
        return form.toReal(canonical);
    }

    /**
     * Returns the solution of the canonical situation, in canonical suits.
     */
    protected abstract Solution canonicalSolution(CanonicalForm form);

    public SolutionCache getCache() {
        return cache;
    }
}
