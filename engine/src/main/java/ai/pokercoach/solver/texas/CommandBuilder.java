package ai.pokercoach.solver.texas;

import ai.pokercoach.config.SolverProperties;
import ai.pokercoach.game.Action;
import ai.pokercoach.game.ActionType;
import ai.pokercoach.game.Card;
import ai.pokercoach.game.Street;
import ai.pokercoach.solver.ConfigurationException;
import ai.pokercoach.solver.canonical.CanonicalSituation;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import org.springframework.stereotype.Component;

/**
 * Translates a canonical situation into a TexasSolver console invocation.
 * <p>
 * The situation is already in canonical suits and canonical amounts, so the script is
 * a pure function of it and the solver configuration: two requests sharing a canonical
 * key produce byte-identical scripts. Flag and file names come from
 * {@link SolverProperties.Schema}.
 * <p>
 * The binary solves one heads-up postflop street from its first action, out of position
 * acting first. The hero's decision must be a node of that tree: the current street's
 * actions have to lead to the hero's turn without closing the round. Anything else
 * (preflop, multiway, an impossible action order) is rejected here instead of being
 * answered with some other node's strategy; such spots are served from precomputed
 * solutions.
 */
@Component
public class CommandBuilder {
    private static final String[] PLAYERS = {"oop", "ip"};
    private static final String IN_POSITION = "IP";
    private static final String OUT_OF_POSITION = "OOP";

    private final SolverProperties properties;

    public CommandBuilder(SolverProperties properties) {
        this.properties = properties;
    }

    /**
     * @throws ConfigurationException if a solver setting or the situation is out of range
     */
    public ProcessInvocation build(CanonicalSituation situation) {
        validate(situation);
        SolverProperties.Schema schema = properties.getSchema();

        List<String> script = new ArrayList<>();
        script.add("set_pot " + number(situation.pot()));
        script.add("set_effective_stack " + number(situation.effectiveStack()));
        StringJoiner board = new StringJoiner(",");
        for (Card card : situation.board()) {
            board.add(card.toString());
        }
        script.add("set_board " + board);
        script.add("set_range_ip " + properties.getIpRange().trim());
        script.add("set_range_oop " + properties.getOopRange().trim());
        for (Street street : Street.values()) {
            if (street.ordinal() < situation.street().ordinal()) {
                continue;
            }
            List<Integer> sizes = properties.getBetSizes().getOrDefault(street.getSolverName(), List.of());
            for (String player : PLAYERS) {
                for (Integer size : sizes) {
                    script.add("set_bet_sizes " + player + "," + street.getSolverName() + ",bet," + size);
                    script.add("set_bet_sizes " + player + "," + street.getSolverName() + ",raise," + size);
                }
                script.add("set_bet_sizes " + player + "," + street.getSolverName() + ",allin");
            }
        }
        script.add("set_allin_threshold " + number(properties.getAllinThreshold()));
        script.add("build_tree");
        script.add("set_thread_num " + properties.getThreads());
        script.add("set_accuracy " + number(properties.getAccuracy()));
        script.add("set_max_iteration " + properties.getMaxIterations());
        script.add("set_print_interval " + properties.getPrintInterval());
        script.add("set_use_isomorphism " + (properties.isUseIsomorphism() ? 1 : 0));
        script.add("start_solve");
        script.add("set_dump_rounds " + properties.getDumpRounds());
        script.add("dump_result " + schema.getResultFileName());

        Path binary = Path.of(properties.getBinaryPath()).toAbsolutePath().normalize();
        List<String> command = new ArrayList<>();
        command.add(binary.toString());
        command.add(schema.getInputFileFlag());
        command.add(schema.getInputFileName());
        Path resources = resourceDir(binary);
        if (resources != null) {
            command.add(schema.getResourceDirFlag());
            command.add(resources.toString());
        }
        return new ProcessInvocation(command, schema.getInputFileName(), String.join("\n", script) + "\n",
                schema.getResultFileName());
    }

    private Path resourceDir(Path binary) {
        String configured = properties.getResourceDir();
        if (configured != null && !configured.isBlank()) {
            return Path.of(configured).toAbsolutePath().normalize();
        }
        Path parent = binary.getParent();
        if (parent != null && Files.isDirectory(parent.resolve("resources"))) {
            return parent.resolve("resources");
        }
        return null;
    }

    private void validate(CanonicalSituation situation) {
        if (properties.getBinaryPath() == null || properties.getBinaryPath().isBlank()) {
            throw new ConfigurationException("solver.binary-path", "No solver binary configured");
        }
        require(properties.getThreads() > 0, "solver.threads", "must be positive: " + properties.getThreads());
        require(properties.getAccuracy() > 0, "solver.accuracy", "must be positive: " + properties.getAccuracy());
        require(properties.getMaxIterations() > 0, "solver.max-iterations",
                "must be positive: " + properties.getMaxIterations());
        require(properties.getAllinThreshold() > 0 && properties.getAllinThreshold() <= 1,
                "solver.allin-threshold", "must be in (0, 1]: " + properties.getAllinThreshold());
        require(properties.getDumpRounds() > 0, "solver.dump-rounds", "must be positive: " + properties.getDumpRounds());
        require(properties.getPrintInterval() > 0, "solver.print-interval",
                "must be positive: " + properties.getPrintInterval());
        require(properties.getIpRange() != null && !properties.getIpRange().isBlank(), "solver.ip-range", "is empty");
        require(properties.getOopRange() != null && !properties.getOopRange().isBlank(), "solver.oop-range", "is empty");
        properties.getBetSizes().forEach((street, sizes) -> {
            for (Integer size : sizes) {
                require(size != null && size > 0, "solver.bet-sizes." + street, "sizes must be positive: " + sizes);
            }
        });
        SolverProperties.Schema schema = properties.getSchema();
        require(schema.getInputFileName() != null && !schema.getInputFileName().isBlank(),
                "solver.schema.input-file-name", "is empty");
        require(schema.getResultFileName() != null && !schema.getResultFileName().isBlank(),
                "solver.schema.result-file-name", "is empty");
        require(situation.pot() > 0, "pot", "must be positive: " + situation.pot());
        require(situation.effectiveStack() > 0, "effectiveStack", "must be positive: " + situation.effectiveStack());
        require(situation.board().size() == situation.street().getBoardSize(), "board",
                situation.street() + " needs " + situation.street().getBoardSize() + " cards");
        validateDecision(situation);
    }

    private static void validateDecision(CanonicalSituation situation) {
        require(situation.street() != Street.PREFLOP, "street",
                "the solver starts on the flop; preflop spots need a precomputed solution");
        String position = situation.relativePosition();
        require(IN_POSITION.equals(position) || OUT_OF_POSITION.equals(position), "position",
                "the solver plays heads-up but the hero is " + position);
        List<Action> path = situation.streetActions();
        int heroParity = IN_POSITION.equals(position) ? 1 : 0;
        require(path.size() % 2 == heroParity, "actions",
                "it is not the " + position + " player's turn after " + path);
        for (int i = 0; i < path.size(); i++) {
            ActionType type = path.get(i).type();
            ActionType previous = i == 0 ? null : path.get(i - 1).type();
            boolean legal = switch (type) {
                case CHECK -> i == 0;
                case BET -> previous == null || previous == ActionType.CHECK;
                case RAISE -> previous == ActionType.BET || previous == ActionType.RAISE;
                case ALL_IN -> i == path.size() - 1;
                case CALL, FOLD -> false;
            };
            require(legal, "actions", "'" + path.get(i) + "' at step " + (i + 1) + " of " + path
                    + " does not leave the hero to act on this street");
        }
    }

    private static void require(boolean condition, String field, String problem) {
        if (!condition) {
            throw new ConfigurationException(field, problem);
        }
    }

    /** Two decimals at most, no trailing zeros: 112.5, 11.25, 100. */
    static String number(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }
}
