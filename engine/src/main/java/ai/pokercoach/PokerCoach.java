package ai.pokercoach;

import ai.pokercoach.game.Action;
import ai.pokercoach.game.Hand;
import ai.pokercoach.game.PlayerAction;
import ai.pokercoach.game.Position;
import ai.pokercoach.game.Situation;
import ai.pokercoach.solver.LiveSolverBridge;
import ai.pokercoach.solver.Solution;
import ai.pokercoach.solver.SolverBridge;
import ai.pokercoach.solver.SolverException;
import ai.pokercoach.solver.Strategy;
import ai.pokercoach.solver.cache.SeedReport;
import ai.pokercoach.solver.cache.SolutionCache;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Console front end for the solver bridge.
 * <p>
 * Usage:
 * <pre>
 *   strategy &lt;hand&gt; &lt;position&gt; &lt;pot&gt; &lt;stack&gt; [--board=AhKd2c] [--actions="CO:raise 2.5,BB:call,/,BB:check"]
 *   solve &lt;position&gt; &lt;pot&gt; &lt;stack&gt; [--board=...] [--actions=...]
 *   refresh &lt;position&gt; &lt;pot&gt; &lt;stack&gt; [--board=...] [--actions=...]
 *   stats
 *   seed &lt;directory&gt; [--force]
 * </pre>
 */
@SpringBootApplication
public class PokerCoach implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(PokerCoach.class);

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  strategy <hand> <position> <pot> <stack> [--board=AhKd2c] [--actions=\"CO:raise 2.5,BB:call,/,BB:check\"]",
            "  (pot is the pot at the start of the street; '/' in --actions starts the next street)",
            "  solve <position> <pot> <stack> [--board=...] [--actions=...]",
            "  refresh <position> <pot> <stack> [--board=...] [--actions=...]",
            "  stats",
            "  seed <directory> [--force]");

    /** Separates betting rounds in {@code --actions}. */
    private static final String STREET_BREAK = "/";

    private final SolverBridge bridge;
    private final SolutionCache cache;
    private final PrintStream out;

    @Autowired
    public PokerCoach(SolverBridge bridge, SolutionCache cache) {
        this(bridge, cache, System.out);
    }

    PokerCoach(SolverBridge bridge, SolutionCache cache, PrintStream out) {
        this.bridge = bridge;
        this.cache = cache;
        this.out = out;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(PokerCoach.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            // Spring's own --key=value options are handled by the framework
            if (!arg.startsWith("--spring.") && !arg.startsWith("--solver.") && !arg.startsWith("--cache.")
                    && !arg.startsWith("--canonical.") && !arg.startsWith("--logging.")) {
                positional.add(arg);
            }
        }
        if (positional.isEmpty()) {
            out.println(USAGE);
            return;
        }
        String command = positional.get(0).toLowerCase();
        List<String> rest = positional.subList(1, positional.size());
        try {
            switch (command) {
                case "strategy" -> strategy(rest);
                case "solve" -> solve(rest, false);
                case "refresh" -> solve(rest, true);
                case "stats" -> out.println(cache.stats());
                case "seed" -> seed(rest);
                default -> out.println("Unknown command '" + command + "'" + System.lineSeparator() + USAGE);
            }
        } catch (IllegalArgumentException e) {
            out.println("Invalid input: " + e.getMessage() + System.lineSeparator() + USAGE);
        } catch (SolverException e) {
            log.error("{} failed: {}", command, e.getMessage());
            out.println("Error: " + e.getMessage());
        }
    }

    private void strategy(List<String> args) {
        Arguments parsed = Arguments.parse(args, 4);
        Hand hand = Hand.parse(parsed.positional.get(0));
        Situation situation = situation(parsed, 1);
        Strategy strategy = bridge.getStrategy(situation, hand);
        out.println(hand + " in " + situation);
        for (Map.Entry<Action, Double> entry : strategy.getFrequencies().entrySet()) {
            Double ev = strategy.getEvs().get(entry.getKey());
            out.printf("  %-12s %6.1f%%  EV %s%n", entry.getKey(), entry.getValue() * 100,
                    ev == null ? "-" : String.format("%.2f", ev));
        }
        out.printf("  primary: %s, EV of strategy %.2f%n", strategy.primaryAction(), strategy.expectedValue());
    }

    private void solve(List<String> args, boolean refresh) {
        Arguments parsed = Arguments.parse(args, 3);
        Situation situation = situation(parsed, 0);
        Solution solution;
        if (refresh) {
            if (!(bridge instanceof LiveSolverBridge live)) {
                out.println("refresh needs the solver-live profile");
                return;
            }
            solution = live.refresh(situation);
        } else {
            solution = bridge.solve(situation);
        }
        out.println(situation + ": " + solution);
        for (Strategy strategy : solution.getStrategies().values()) {
            out.printf("  %s %s%n", strategy.getHand(), strategy.primaryAction());
        }
    }

    private void seed(List<String> args) {
        Arguments parsed = Arguments.parse(args, 1);
        SeedReport report = cache.seed(Path.of(parsed.positional.get(0)), parsed.force);
        out.println("loaded=" + report.loaded() + " skipped=" + report.skipped() + " rejected=" + report.rejected());
    }

    private static Situation situation(Arguments parsed, int offset) {
        Situation.Builder builder = Situation.builder()
                .position(Position.fromLabel(parsed.positional.get(offset)))
                .pot(number(parsed.positional.get(offset + 1), "pot"))
                .effectiveStack(number(parsed.positional.get(offset + 2), "stack"))
                .board(parsed.board);
        for (String action : parsed.actions) {
            if (action.equals(STREET_BREAK)) {
                builder.newStreet();
                continue;
            }
            PlayerAction playerAction = PlayerAction.parse(action);
            builder.action(playerAction.actor(), playerAction.action());
        }
        return builder.build();
    }

    private static double number(String text, String what) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad " + what + ": " + text, e);
        }
    }

    /** Positional arguments plus the --board, --actions and --force options. */
    private static final class Arguments {
        private final List<String> positional = new ArrayList<>();
        private String board = "";
        private List<String> actions = List.of();
        private boolean force;

        static Arguments parse(List<String> args, int required) {
            Arguments parsed = new Arguments();
            for (String arg : args) {
                if (arg.startsWith("--board=")) {
                    parsed.board = arg.substring("--board=".length());
                } else if (arg.startsWith("--actions=")) {
                    String value = arg.substring("--actions=".length()).trim();
                    parsed.actions = value.isEmpty() ? List.of() : Arrays.asList(value.split("\\s*,\\s*"));
                } else if (arg.equals("--force")) {
                    parsed.force = true;
                } else {
                    parsed.positional.add(arg);
                }
            }
            if (parsed.positional.size() != required) {
                throw new IllegalArgumentException("expected " + required + " arguments but got " + parsed.positional);
            }
            return parsed;
        }
    }
}
